package uk.gegc.linguapractice.features.repetition.application;

import org.springframework.lang.Nullable;
import uk.gegc.linguapractice.features.repetition.domain.model.DailyReviewLoad;
import uk.gegc.linguapractice.features.repetition.domain.model.RepetitionStatistics;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.task.domain.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SchedulingService {

    List<Task> getNextTasks(UUID learnerId, int count);

    /**
     * Records a graded recall outside of a practice session. When {@code grade} is {@code null}
     * it is derived from {@code isCorrect}.
     */
    SpacedRepetitionItem recordAnswer(UUID learnerId, UUID taskId, boolean isCorrect, @Nullable Integer grade);

    SpacedRepetitionItem recordAnswerTx(UUID learnerId, UUID taskId, boolean isCorrect, @Nullable Integer grade);

    /**
     * Applies an answer to the learner's item for the task and stores it, creating the item on
     * first answer. Joins the caller's transaction.
     */
    SpacedRepetitionItem applyAnswer(UUID learnerId, UUID taskId, int grade, @Nullable Long timeSpentMs);

    Optional<SpacedRepetitionItem> getRepetitionData(UUID learnerId, UUID taskId);

    List<Task> getTasksDue(UUID learnerId);

    List<DailyReviewLoad> getReviewSchedule(UUID learnerId, int days);

    SpacedRepetitionItem rescheduleTask(UUID learnerId, UUID taskId, Instant nextReview);

    RepetitionStatistics getStatistics(UUID learnerId);
}

package uk.gegc.linguapractice.features.repetition.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.repetition.application.ReviewQueueSelector;
import uk.gegc.linguapractice.features.repetition.application.SchedulingEngine;
import uk.gegc.linguapractice.features.repetition.application.SchedulingService;
import uk.gegc.linguapractice.features.repetition.domain.model.DailyReviewLoad;
import uk.gegc.linguapractice.features.repetition.domain.model.RecallGrade;
import uk.gegc.linguapractice.features.repetition.domain.model.RepetitionStatistics;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.repetition.domain.repository.SpacedRepetitionItemRepository;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.repository.TaskRepository;
import uk.gegc.linguapractice.shared.exception.ResourceNotFoundException;
import uk.gegc.linguapractice.shared.exception.ValidationException;
import uk.gegc.linguapractice.shared.metrics.PracticeMetrics;
import uk.gegc.linguapractice.shared.persistence.ConflictRetryExecutor;
import uk.gegc.linguapractice.shared.util.DateUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingServiceImpl implements SchedulingService {

    private final SpacedRepetitionItemRepository itemRepository;
    private final TaskRepository taskRepository;
    private final SchedulingEngine schedulingEngine;
    private final ReviewQueueSelector reviewQueueSelector;
    private final ConflictRetryExecutor retryExecutor;
    private final PracticeMetrics metrics;
    private final DateUtils dateUtils;

    @Lazy
    private final SchedulingService self;

    @Override
    public List<Task> getNextTasks(UUID learnerId, int count) {
        return reviewQueueSelector.getNextTasks(learnerId, count, dateUtils.now());
    }

    @Override
    public SpacedRepetitionItem recordAnswer(UUID learnerId, UUID taskId, boolean isCorrect, @Nullable Integer grade) {
        SpacedRepetitionItem item = retryExecutor.execute("recordAnswer",
                () -> self.recordAnswerTx(learnerId, taskId, isCorrect, grade));
        metrics.incrementAnswerRecorded(RecallGrade.of(item.performance().lastGrade()).isLapse());
        return item;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SpacedRepetitionItem recordAnswerTx(UUID learnerId, UUID taskId, boolean isCorrect, @Nullable Integer grade) {
        int resolvedGrade = grade != null ? grade : RecallGrade.fromCorrectness(isCorrect).getSm2Value();
        return applyAnswer(learnerId, taskId, resolvedGrade, null);
    }

    @Override
    @Transactional
    public SpacedRepetitionItem applyAnswer(UUID learnerId, UUID taskId, int grade, @Nullable Long timeSpentMs) {
        RecallGrade.of(grade);
        taskRepository.findById(taskId)
                .orElseThrow(() -> ResourceNotFoundException.of("Task", taskId));

        Optional<SpacedRepetitionItem> current = itemRepository.findByTaskId(learnerId, taskId);
        SpacedRepetitionItem updated = schedulingEngine.recordAnswer(
                learnerId, taskId, current.orElse(null), grade, timeSpentMs, dateUtils.now());

        SpacedRepetitionItem stored = updated.isNew()
                ? itemRepository.create(updated)
                : itemRepository.update(updated);

        log.debug("Task {} for learner {} graded {}: interval={}d repetition={} efactor={}",
                taskId, learnerId, grade,
                stored.algorithm().interval(), stored.algorithm().repetition(), stored.algorithm().efactor());
        return stored;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SpacedRepetitionItem> getRepetitionData(UUID learnerId, UUID taskId) {
        return itemRepository.findByTaskId(learnerId, taskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> getTasksDue(UUID learnerId) {
        return reviewQueueSelector.hydrate(reviewQueueSelector.getDue(learnerId, dateUtils.now()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DailyReviewLoad> getReviewSchedule(UUID learnerId, int days) {
        return reviewQueueSelector.getReviewSchedule(learnerId, days);
    }

    @Override
    @Transactional
    public SpacedRepetitionItem rescheduleTask(UUID learnerId, UUID taskId, Instant nextReview) {
        if (nextReview == null) {
            throw new ValidationException("Next review date is required", "nextReview", null);
        }
        SpacedRepetitionItem item = itemRepository.findByTaskId(learnerId, taskId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No repetition data for task " + taskId + " and learner " + learnerId));

        SpacedRepetitionItem rescheduled = itemRepository.updateSchedule(item.id(), nextReview);
        log.info("Task {} for learner {} rescheduled to {}", taskId, learnerId, nextReview);
        return rescheduled;
    }

    @Override
    @Transactional(readOnly = true)
    public RepetitionStatistics getStatistics(UUID learnerId) {
        return itemRepository.statistics(learnerId, dateUtils.now());
    }
}

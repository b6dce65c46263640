package uk.gegc.linguapractice.features.repetition.application;

import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.repetition.domain.model.RecallGrade;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.shared.config.PracticeProperties;
import uk.gegc.linguapractice.shared.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;

/**
 * Applies one graded answer to the scheduling state of a task.
 * <p>
 * The transition is pure: it reads nothing but its arguments and returns a new
 * {@link SpacedRepetitionItem}; persisting the result is the caller's job. When no item
 * exists yet the answer is applied to a freshly seeded item (repetition 0, ease 2.5).
 * An untimed answer ({@code timeSpentMs == null}) leaves the average time untouched.
 */
@Component
@RequiredArgsConstructor
public class SchedulingEngine {

    private final SrsAlgorithm srsAlgorithm;
    private final PracticeProperties properties;

    public SpacedRepetitionItem recordAnswer(UUID learnerId,
                                             UUID taskId,
                                             @Nullable SpacedRepetitionItem current,
                                             int grade,
                                             @Nullable Long timeSpentMs,
                                             Instant now) {
        RecallGrade recallGrade = RecallGrade.of(grade);
        if (timeSpentMs != null && timeSpentMs < 0) {
            throw new ValidationException("Time spent must not be negative", "timeSpent", timeSpentMs);
        }

        SpacedRepetitionItem item = current != null ? current : SpacedRepetitionItem.newItem(learnerId, taskId, now);
        SrsAlgorithm.ReviewStep step = srsAlgorithm.review(
                item.algorithm(),
                item.metadata().lapseCount(),
                recallGrade,
                properties.getGraduationThreshold(),
                now
        );

        SpacedRepetitionItem.Schedule previousSchedule = item.schedule();
        int totalReviews = previousSchedule.totalReviews() + 1;
        boolean lapse = step.lapse();

        SpacedRepetitionItem.Schedule schedule = new SpacedRepetitionItem.Schedule(
                step.nextReview(),
                now,
                totalReviews,
                lapse ? 0 : previousSchedule.consecutiveCorrect() + 1
        );
        SpacedRepetitionItem.Performance performance = new SpacedRepetitionItem.Performance(
                Math.min(100, runningAverage(item.performance().averageAccuracy(), lapse ? 0 : 100, totalReviews)),
                timeSpentMs == null
                        ? item.performance().averageTime()
                        : runningAverage(item.performance().averageTime(), timeSpentMs, totalReviews),
                difficultyRating(recallGrade),
                recallGrade.getSm2Value()
        );
        SpacedRepetitionItem.Metadata metadata = new SpacedRepetitionItem.Metadata(
                item.metadata().introduced(),
                step.graduated(),
                step.lapseCount()
        );

        return new SpacedRepetitionItem(
                item.id(),
                item.learnerId(),
                item.taskId(),
                step.algorithm(),
                schedule,
                performance,
                metadata,
                item.version(),
                item.createdAt(),
                now
        );
    }

    // incremental mean over n samples, the newest being sample
    private static double runningAverage(double previousAverage, double sample, int n) {
        return previousAverage + (sample - previousAverage) / n;
    }

    private static int difficultyRating(RecallGrade grade) {
        return Math.max(1, Math.min(5, 6 - grade.getSm2Value()));
    }
}

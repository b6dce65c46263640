package uk.gegc.linguapractice.features.repetition.domain.model;

import uk.gegc.linguapractice.shared.exception.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Scheduling state of one task for one learner. Instances are immutable; the scheduling
 * engine produces a new instance for every recorded answer.
 *
 * @param version optimistic-lock version of the persisted row, {@code null} until first stored
 */
public record SpacedRepetitionItem(
        UUID id,
        UUID learnerId,
        UUID taskId,
        Algorithm algorithm,
        Schedule schedule,
        Performance performance,
        Metadata metadata,
        Long version,
        Instant createdAt,
        Instant updatedAt
) {

    public static final double MIN_EFACTOR = 1.3;
    public static final double DEFAULT_EFACTOR = 2.5;
    public static final int MIN_INTERVAL_DAYS = 1;
    public static final int MAX_INTERVAL_DAYS = 365;

    public SpacedRepetitionItem {
        Objects.requireNonNull(learnerId, "learnerId");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(performance, "performance");
        Objects.requireNonNull(metadata, "metadata");
    }

    public record Algorithm(int interval, int repetition, double efactor) {
        public Algorithm {
            if (interval < MIN_INTERVAL_DAYS || interval > MAX_INTERVAL_DAYS) {
                throw new ValidationException("Interval must be between 1 and 365 days", "interval", interval);
            }
            if (repetition < 0) {
                throw new ValidationException("Repetition must not be negative", "repetition", repetition);
            }
            if (efactor < MIN_EFACTOR) {
                throw new ValidationException("Efactor must be at least 1.3", "efactor", efactor);
            }
        }
    }

    public record Schedule(Instant nextReview, Instant lastReviewed, int totalReviews, int consecutiveCorrect) {
        public Schedule {
            Objects.requireNonNull(nextReview, "nextReview");
        }
    }

    public record Performance(double averageAccuracy, double averageTime, int difficultyRating, int lastGrade) {
        public Performance {
            if (averageAccuracy < 0 || averageAccuracy > 100) {
                throw new ValidationException("Average accuracy must be between 0 and 100", "averageAccuracy", averageAccuracy);
            }
            if (difficultyRating < 1 || difficultyRating > 5) {
                throw new ValidationException("Difficulty rating must be between 1 and 5", "difficultyRating", difficultyRating);
            }
            if (lastGrade < 0 || lastGrade > 5) {
                throw new ValidationException("Grade must be between 0 and 5", "lastGrade", lastGrade);
            }
        }
    }

    public record Metadata(Instant introduced, boolean graduated, int lapseCount) {
    }

    /**
     * Unsaved item for a task that has never been answered. Its first review is the next day.
     */
    public static SpacedRepetitionItem newItem(UUID learnerId, UUID taskId, Instant now) {
        return new SpacedRepetitionItem(
                null,
                learnerId,
                taskId,
                new Algorithm(MIN_INTERVAL_DAYS, 0, DEFAULT_EFACTOR),
                new Schedule(now.plus(Duration.ofDays(1)), null, 0, 0),
                new Performance(0, 0, 3, 0),
                new Metadata(now, false, 0),
                null,
                now,
                now
        );
    }

    public boolean isNew() {
        return id == null;
    }

    public boolean isDue(Instant now) {
        return !schedule.nextReview().isAfter(now);
    }

    /**
     * Whole days until the next review, rounded up; zero or negative when due.
     */
    public long daysUntilReview(Instant now) {
        long millis = Duration.between(now, schedule.nextReview()).toMillis();
        return (long) Math.ceil(millis / (double) Duration.ofDays(1).toMillis());
    }

    public SpacedRepetitionItem withNextReview(Instant nextReview, Instant now) {
        Schedule rescheduled = new Schedule(nextReview, schedule.lastReviewed(), schedule.totalReviews(), schedule.consecutiveCorrect());
        return new SpacedRepetitionItem(id, learnerId, taskId, algorithm, rescheduled, performance, metadata, version, createdAt, now);
    }

    public SpacedRepetitionItem withIdentity(UUID id, Long version) {
        return new SpacedRepetitionItem(id, learnerId, taskId, algorithm, schedule, performance, metadata, version, createdAt, updatedAt);
    }
}

package uk.gegc.linguapractice.features.session.domain.model;

import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;
import uk.gegc.linguapractice.shared.exception.BusinessRuleException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One practice attempt of a learner. Every lifecycle operation returns a new instance and
 * leaves this one untouched; illegal transitions raise {@link BusinessRuleException}.
 *
 * @param results {@code null} until the session is completed
 */
public record PracticeSession(
        UUID id,
        UUID learnerId,
        Configuration configuration,
        Execution execution,
        Results results,
        Long version,
        Instant createdAt,
        Instant updatedAt
) {

    public PracticeSession {
        Objects.requireNonNull(learnerId, "learnerId");
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(execution, "execution");
    }

    public record Configuration(
            UUID topicId,
            List<UUID> learningPathIds,
            int targetCount,
            boolean includeReview,
            TaskDifficulty difficultyFilter
    ) {
        public Configuration {
            learningPathIds = learningPathIds == null ? List.of() : List.copyOf(learningPathIds);
        }
    }

    /**
     * @param totalTimeSpent seconds spent on recorded answers
     */
    public record Execution(
            List<UUID> taskIds,
            int completedCount,
            int correctCount,
            SessionStatus status,
            Instant startedAt,
            Instant completedAt,
            long totalTimeSpent
    ) {
        public Execution {
            taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
            Objects.requireNonNull(status, "status");
            if (correctCount < 0 || correctCount > completedCount) {
                throw new IllegalArgumentException("correctCount must be between 0 and completedCount");
            }
        }
    }

    /**
     * @param accuracy    rounded percentage of correct answers
     * @param averageTime mean seconds per answer
     */
    public record Results(
            int accuracy,
            double averageTime,
            Map<String, Integer> difficultyDistribution,
            List<String> improvementAreas
    ) {
        public Results {
            difficultyDistribution = difficultyDistribution == null ? Map.of() : Map.copyOf(difficultyDistribution);
            improvementAreas = improvementAreas == null ? List.of() : List.copyOf(improvementAreas);
        }
    }

    public static PracticeSession plan(UUID learnerId, Configuration configuration, List<UUID> taskIds, Instant now) {
        Execution execution = new Execution(taskIds, 0, 0, SessionStatus.PLANNED, null, null, 0);
        return new PracticeSession(null, learnerId, configuration, execution, null, null, now, now);
    }

    public SessionStatus status() {
        return execution.status();
    }

    /**
     * Counts one answer. A planned session becomes active with this call.
     */
    public PracticeSession recordAnswer(boolean correct, long timeSpentSeconds, Instant now) {
        SessionStatus status = execution.status();
        if (status == SessionStatus.PAUSED) {
            throw new BusinessRuleException("Session " + id + " is paused; resume it before answering",
                    status.name(), "ANSWER");
        }
        if (status != SessionStatus.PLANNED && status != SessionStatus.ACTIVE) {
            throw new BusinessRuleException("Session " + id + " no longer accepts answers",
                    status.name(), "ANSWER");
        }
        if (isTargetReached()) {
            throw new BusinessRuleException("Session " + id + " already reached its target of "
                    + configuration.targetCount() + " answers", status.name(), "ANSWER");
        }
        Execution next = new Execution(
                execution.taskIds(),
                execution.completedCount() + 1,
                execution.correctCount() + (correct ? 1 : 0),
                SessionStatus.ACTIVE,
                execution.startedAt() != null ? execution.startedAt() : now,
                null,
                execution.totalTimeSpent() + timeSpentSeconds
        );
        return withExecution(next, results, now);
    }

    public PracticeSession pause(Instant now) {
        if (execution.status() != SessionStatus.ACTIVE) {
            throw illegalTransition("PAUSE");
        }
        return withStatus(SessionStatus.PAUSED, now);
    }

    public PracticeSession resume(Instant now) {
        if (execution.status() != SessionStatus.PAUSED) {
            throw illegalTransition("RESUME");
        }
        return withStatus(SessionStatus.ACTIVE, now);
    }

    public PracticeSession complete(Results sessionResults, Instant now) {
        if (!execution.status().canTransitionTo(SessionStatus.COMPLETED)) {
            throw illegalTransition("COMPLETE");
        }
        Execution next = new Execution(
                execution.taskIds(),
                execution.completedCount(),
                execution.correctCount(),
                SessionStatus.COMPLETED,
                execution.startedAt(),
                now,
                execution.totalTimeSpent()
        );
        return withExecution(next, sessionResults, now);
    }

    public PracticeSession abandon(Instant now) {
        if (!execution.status().canTransitionTo(SessionStatus.ABANDONED)) {
            throw illegalTransition("ABANDON");
        }
        return withStatus(SessionStatus.ABANDONED, now);
    }

    /**
     * Completed answers as a percentage of the target, 0-100.
     */
    public double progress() {
        return Math.min(100.0, execution.completedCount() * 100.0 / configuration.targetCount());
    }

    public int remainingCount() {
        return Math.max(0, configuration.targetCount() - execution.completedCount());
    }

    public boolean isTargetReached() {
        return execution.completedCount() >= configuration.targetCount();
    }

    public PracticeSession withIdentity(UUID id, Long version) {
        return new PracticeSession(id, learnerId, configuration, execution, results, version, createdAt, updatedAt);
    }

    private PracticeSession withStatus(SessionStatus status, Instant now) {
        Execution next = new Execution(
                execution.taskIds(),
                execution.completedCount(),
                execution.correctCount(),
                status,
                execution.startedAt(),
                execution.completedAt(),
                execution.totalTimeSpent()
        );
        return withExecution(next, results, now);
    }

    private PracticeSession withExecution(Execution next, Results nextResults, Instant now) {
        return new PracticeSession(id, learnerId, configuration, next, nextResults, version, createdAt, now);
    }

    private BusinessRuleException illegalTransition(String action) {
        return new BusinessRuleException(
                "Cannot " + action.toLowerCase(Locale.ROOT) + " session " + id + " in status " + execution.status(),
                execution.status().name(), action);
    }
}

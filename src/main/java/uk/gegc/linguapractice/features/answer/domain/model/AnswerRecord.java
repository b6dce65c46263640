package uk.gegc.linguapractice.features.answer.domain.model;

import uk.gegc.linguapractice.shared.exception.ValidationException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A submitted answer. Records are append-only and never change after they are stored.
 *
 * @param timeSpent seconds, 0-3600
 * @param grade     recall grade the answer was scheduled with
 */
public record AnswerRecord(
        UUID id,
        UUID sessionId,
        UUID learnerId,
        UUID taskId,
        List<String> userAnswer,
        boolean correct,
        int timeSpent,
        int confidence,
        int grade,
        Metadata metadata,
        Instant timestamp
) {

    public static final int MAX_TIME_SPENT_SECONDS = 3600;
    private static final int QUICK_ANSWER_SECONDS = 10;
    private static final int SLOW_ANSWER_SECONDS = 120;

    public record Metadata(int attemptNumber, int hintsUsed, DeviceType deviceType, String clientInfo) {
    }

    public AnswerRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(metadata, "metadata");
        userAnswer = userAnswer == null ? List.of() : List.copyOf(userAnswer);
        if (timeSpent < 0 || timeSpent > MAX_TIME_SPENT_SECONDS) {
            throw new ValidationException("Time spent must be between 0 and 3600 seconds", "timeSpent", timeSpent);
        }
        if (confidence < 1 || confidence > 5) {
            throw new ValidationException("Confidence must be between 1 and 5", "confidence", confidence);
        }
    }

    public boolean isQuickAnswer() {
        return timeSpent < QUICK_ANSWER_SECONDS;
    }

    public boolean isSlowAnswer() {
        return timeSpent > SLOW_ANSWER_SECONDS;
    }

    /**
     * 0-100 score: half for correctness, a quarter for pacing and a quarter for confidence.
     * Answers of 30 to 90 seconds get the full pacing share; faster ones are treated as possible guesses.
     */
    public int performanceScore() {
        double score = correct ? 50 : 0;

        if (timeSpent >= 30 && timeSpent <= 90) {
            score += 25;
        } else if (timeSpent < 30) {
            score += 15;
        } else if (timeSpent <= 180) {
            score += 20;
        } else {
            score += 10;
        }

        score += (confidence - 1) / 4.0 * 25;
        return (int) Math.round(score);
    }

    public AnswerRecord withId(UUID id) {
        return new AnswerRecord(id, sessionId, learnerId, taskId, userAnswer, correct, timeSpent, confidence,
                grade, metadata, timestamp);
    }
}

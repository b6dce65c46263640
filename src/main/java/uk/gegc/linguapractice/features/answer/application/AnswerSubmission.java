package uk.gegc.linguapractice.features.answer.application;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.linguapractice.features.answer.domain.model.DeviceType;

import java.util.List;
import java.util.UUID;

/**
 * An answer as submitted by the presentation layer.
 *
 * @param timeSpent seconds spent on the task
 * @param grade     explicit recall grade; derived from {@code isCorrect} when {@code null}
 */
public record AnswerSubmission(
        @NotNull UUID sessionId,
        @NotNull UUID taskId,
        List<String> userAnswer,
        boolean isCorrect,
        @Min(0) @Max(3600) int timeSpent,
        @Min(1) @Max(5) int confidence,
        @Min(0) @Max(5) Integer grade,
        @Min(1) int attemptNumber,
        @Min(0) int hintsUsed,
        DeviceType deviceType,
        @Size(max = 500) String clientInfo
) {
}

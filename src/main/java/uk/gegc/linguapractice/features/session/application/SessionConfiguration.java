package uk.gegc.linguapractice.features.session.application;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;

import java.util.List;
import java.util.UUID;

/**
 * Input for creating a practice session.
 *
 * @param topicId          optional topic the session was started from
 * @param difficultyFilter restricts newly introduced tasks to one difficulty, {@code null} for any
 */
public record SessionConfiguration(
        UUID topicId,
        @NotEmpty List<@NotNull UUID> learningPathIds,
        @Min(1) int targetCount,
        boolean includeReview,
        TaskDifficulty difficultyFilter
) {
}

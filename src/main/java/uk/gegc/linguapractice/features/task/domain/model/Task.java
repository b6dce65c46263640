package uk.gegc.linguapractice.features.task.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A practice task as the scheduler sees it. The content body is carried as opaque JSON
 * for the presentation layer.
 */
public record Task(
        UUID id,
        UUID learningPathId,
        TaskType type,
        TaskDifficulty difficulty,
        List<String> tags,
        int estimatedTimeSeconds,
        int points,
        String content,
        Instant createdAt,
        Instant updatedAt
) {
    public Task {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}

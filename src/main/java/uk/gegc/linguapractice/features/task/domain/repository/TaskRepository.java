package uk.gegc.linguapractice.features.task.domain.repository;

import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TaskRepository {

    Optional<Task> findById(UUID taskId);

    /**
     * Loads the given tasks in one round trip. Unknown ids are silently absent from the result,
     * which is in no particular order.
     */
    List<Task> findAllById(Collection<UUID> taskIds);

    /**
     * Picks up to {@code count} tasks at random from the given learning paths.
     *
     * @param difficulty only tasks of this difficulty, or any difficulty when {@code null}
     * @param excludeIds tasks that must not be returned
     */
    List<Task> findRandom(int count, Collection<UUID> learningPathIds, TaskDifficulty difficulty, Collection<UUID> excludeIds);
}

package uk.gegc.linguapractice.features.task.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;
import uk.gegc.linguapractice.features.task.domain.repository.TaskRepository;
import uk.gegc.linguapractice.features.task.infra.mapping.TaskMapper;

import java.util.*;

@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaTaskRepository implements TaskRepository {

    private final TaskJpaRepository taskJpaRepository;
    private final TaskMapper taskMapper;

    @Override
    public Optional<Task> findById(UUID taskId) {
        return taskJpaRepository.findById(taskId).map(taskMapper::toDomain);
    }

    @Override
    public List<Task> findAllById(Collection<UUID> taskIds) {
        if (taskIds.isEmpty()) {
            return List.of();
        }
        return taskJpaRepository.findAllById(new HashSet<>(taskIds)).stream()
                .map(taskMapper::toDomain)
                .toList();
    }

    @Override
    public List<Task> findRandom(int count, Collection<UUID> learningPathIds, TaskDifficulty difficulty, Collection<UUID> excludeIds) {
        if (count <= 0 || learningPathIds.isEmpty()) {
            return List.of();
        }
        Set<UUID> excluded = new HashSet<>(excludeIds);
        List<UUID> candidates = new ArrayList<>(taskJpaRepository.findCandidateIds(learningPathIds, difficulty));
        candidates.removeIf(excluded::contains);
        Collections.shuffle(candidates);

        List<UUID> picked = candidates.subList(0, Math.min(count, candidates.size()));
        Map<UUID, Task> byId = new HashMap<>();
        taskJpaRepository.findAllById(picked).forEach(entity -> byId.put(entity.getId(), taskMapper.toDomain(entity)));
        return picked.stream().map(byId::get).filter(Objects::nonNull).toList();
    }
}

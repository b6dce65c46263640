package uk.gegc.linguapractice.features.task.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.infra.persistence.TaskEntity;

@Component
public class TaskMapper {

    public Task toDomain(TaskEntity entity) {
        return new Task(
                entity.getId(),
                entity.getLearningPathId(),
                entity.getType(),
                entity.getDifficulty(),
                entity.getTags(),
                entity.getEstimatedTimeSeconds(),
                entity.getPoints(),
                entity.getContent(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}

package uk.gegc.linguapractice.features.task.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;
import uk.gegc.linguapractice.features.task.domain.model.TaskType;
import uk.gegc.linguapractice.shared.persistence.StringListConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "tasks", indexes = @Index(name = "idx_tasks_learning_path", columnList = "learning_path_id"))
public class TaskEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "learning_path_id", nullable = false)
    private UUID learningPathId;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 30)
    private TaskType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", nullable = false, length = 10)
    private TaskDifficulty difficulty;

    @Convert(converter = StringListConverter.class)
    @Column(name = "tags", length = 2000)
    private List<String> tags = new ArrayList<>();

    @Column(name = "estimated_time_seconds", nullable = false)
    private Integer estimatedTimeSeconds = 60;

    @Column(name = "points", nullable = false)
    private Integer points = 10;

    @Lob
    @Column(name = "content")
    private String content;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

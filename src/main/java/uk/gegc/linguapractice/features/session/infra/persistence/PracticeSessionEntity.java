package uk.gegc.linguapractice.features.session.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;
import uk.gegc.linguapractice.shared.persistence.CountMapConverter;
import uk.gegc.linguapractice.shared.persistence.StringListConverter;
import uk.gegc.linguapractice.shared.persistence.UuidListConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "practice_session",
        indexes = {
                @Index(name = "idx_practice_session_learner_status", columnList = "learner_id, status"),
                @Index(name = "idx_practice_session_learner_completed", columnList = "learner_id, completed_at")
        }
)
public class PracticeSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    // configuration

    @Column(name = "topic_id", updatable = false)
    private UUID topicId;

    @Convert(converter = UuidListConverter.class)
    @Column(name = "learning_path_ids", nullable = false, length = 4000, updatable = false)
    private List<UUID> learningPathIds = new ArrayList<>();

    @Column(name = "target_count", nullable = false, updatable = false)
    private Integer targetCount;

    @Column(name = "include_review", nullable = false, updatable = false)
    private Boolean includeReview;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty_filter", length = 10, updatable = false)
    private TaskDifficulty difficultyFilter;

    // execution

    @Convert(converter = UuidListConverter.class)
    @Column(name = "task_ids", nullable = false, length = 4000)
    private List<UUID> taskIds = new ArrayList<>();

    @Column(name = "completed_count", nullable = false)
    private Integer completedCount;

    @Column(name = "correct_count", nullable = false)
    private Integer correctCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "total_time_spent", nullable = false)
    private Long totalTimeSpent;

    // results, set on completion

    @Column(name = "accuracy")
    private Integer accuracy;

    @Column(name = "average_time")
    private Double averageTime;

    @Convert(converter = CountMapConverter.class)
    @Column(name = "difficulty_distribution", length = 1000)
    private Map<String, Integer> difficultyDistribution;

    @Convert(converter = StringListConverter.class)
    @Column(name = "improvement_areas", length = 2000)
    private List<String> improvementAreas;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

package uk.gegc.linguapractice.features.repetition.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "spaced_repetition_item",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_spaced_repetition_learner_task",
                        columnNames = {"learner_id", "task_id"}
                )
        },
        indexes = @Index(name = "idx_spaced_repetition_next_review", columnList = "learner_id, next_review")
)
public class SpacedRepetitionItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Column(name = "interval_days", nullable = false)
    private Integer intervalDays;

    @Column(name = "repetition_count", nullable = false)
    private Integer repetitionCount;

    @Column(name = "ease_factor", nullable = false)
    private Double easeFactor;

    @Column(name = "next_review", nullable = false)
    private Instant nextReview;

    @Column(name = "last_reviewed")
    private Instant lastReviewed;

    @Column(name = "total_reviews", nullable = false)
    private Integer totalReviews;

    @Column(name = "consecutive_correct", nullable = false)
    private Integer consecutiveCorrect;

    @Column(name = "average_accuracy", nullable = false)
    private Double averageAccuracy;

    @Column(name = "average_time_ms", nullable = false)
    private Double averageTimeMs;

    @Column(name = "difficulty_rating", nullable = false)
    private Integer difficultyRating;

    @Column(name = "last_grade", nullable = false)
    private Integer lastGrade;

    @Column(name = "introduced_at", nullable = false, updatable = false)
    private Instant introducedAt;

    @Column(name = "graduated", nullable = false)
    private Boolean graduated = Boolean.FALSE;

    @Column(name = "lapse_count", nullable = false)
    private Integer lapseCount;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

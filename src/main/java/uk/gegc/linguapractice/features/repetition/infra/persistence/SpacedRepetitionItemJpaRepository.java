package uk.gegc.linguapractice.features.repetition.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpacedRepetitionItemJpaRepository extends JpaRepository<SpacedRepetitionItemEntity, UUID> {

    Optional<SpacedRepetitionItemEntity> findByLearnerIdAndTaskId(UUID learnerId, UUID taskId);

    List<SpacedRepetitionItemEntity> findByLearnerIdAndNextReviewLessThanEqual(UUID learnerId, Instant now);

    List<SpacedRepetitionItemEntity> findByLearnerIdAndNextReviewBetween(UUID learnerId, Instant from, Instant to);

    @Query("""
            SELECT COUNT(i) AS totalItems,
                   SUM(CASE WHEN i.nextReview <= :now THEN 1 ELSE 0 END) AS dueNow,
                   SUM(CASE WHEN i.graduated = true THEN 1 ELSE 0 END) AS graduated,
                   AVG(i.intervalDays) AS averageInterval,
                   AVG(i.averageAccuracy) AS averageAccuracy
            FROM SpacedRepetitionItemEntity i
            WHERE i.learnerId = :learnerId
            """)
    RepetitionStatisticsProjection aggregateStatistics(@Param("learnerId") UUID learnerId, @Param("now") Instant now);
}

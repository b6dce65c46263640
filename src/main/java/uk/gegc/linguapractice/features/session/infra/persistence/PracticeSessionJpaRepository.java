package uk.gegc.linguapractice.features.session.infra.persistence;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PracticeSessionJpaRepository extends JpaRepository<PracticeSessionEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM PracticeSessionEntity s WHERE s.id = :id")
    Optional<PracticeSessionEntity> findByIdForUpdate(@Param("id") UUID id);

    List<PracticeSessionEntity> findByLearnerIdAndStatusInOrderByCreatedAtDesc(UUID learnerId,
                                                                               Collection<SessionStatus> statuses);

    List<PracticeSessionEntity> findByLearnerIdOrderByCreatedAtDesc(UUID learnerId, Pageable pageable);

    List<PracticeSessionEntity> findByLearnerIdAndStatusAndCompletedAtBetweenOrderByCompletedAtDesc(
            UUID learnerId, SessionStatus status, Instant from, Instant to);
}

package uk.gegc.linguapractice.features.session.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;
import uk.gegc.linguapractice.features.session.domain.repository.PracticeSessionRepository;
import uk.gegc.linguapractice.features.session.infra.mapping.PracticeSessionMapper;
import uk.gegc.linguapractice.shared.exception.ResourceNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Transactional
public class JpaPracticeSessionRepository implements PracticeSessionRepository {

    private final PracticeSessionJpaRepository jpaRepository;
    private final PracticeSessionMapper mapper;

    @Override
    public PracticeSession create(PracticeSession session) {
        return mapper.toDomain(jpaRepository.saveAndFlush(mapper.toNewEntity(session)));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PracticeSession> findById(UUID sessionId) {
        return jpaRepository.findById(sessionId).map(mapper::toDomain);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<PracticeSession> findByIdForUpdate(UUID sessionId) {
        return jpaRepository.findByIdForUpdate(sessionId).map(mapper::toDomain);
    }

    @Override
    public PracticeSession update(PracticeSession session) {
        PracticeSessionEntity entity = jpaRepository.findById(session.id())
                .orElseThrow(() -> ResourceNotFoundException.of("Session", session.id()));
        if (!Objects.equals(entity.getVersion(), session.version())) {
            throw new ObjectOptimisticLockingFailureException(PracticeSessionEntity.class, session.id());
        }
        mapper.applyState(entity, session);
        return mapper.toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PracticeSession> findActive(UUID learnerId) {
        return jpaRepository.findByLearnerIdAndStatusInOrderByCreatedAtDesc(learnerId, SessionStatus.open()).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PracticeSession> findRecent(UUID learnerId, int limit) {
        return jpaRepository.findByLearnerIdOrderByCreatedAtDesc(learnerId, PageRequest.of(0, limit)).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PracticeSession> findCompletedBetween(UUID learnerId, Instant from, Instant to) {
        return jpaRepository.findByLearnerIdAndStatusAndCompletedAtBetweenOrderByCompletedAtDesc(
                        learnerId, SessionStatus.COMPLETED, from, to).stream()
                .map(mapper::toDomain)
                .toList();
    }
}

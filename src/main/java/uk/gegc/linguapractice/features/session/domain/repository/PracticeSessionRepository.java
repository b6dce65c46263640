package uk.gegc.linguapractice.features.session.domain.repository;

import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PracticeSessionRepository {

    PracticeSession create(PracticeSession session);

    Optional<PracticeSession> findById(UUID sessionId);

    /**
     * Reads the session and holds a write lock on it until the surrounding transaction ends.
     * Must be called inside a transaction.
     */
    Optional<PracticeSession> findByIdForUpdate(UUID sessionId);

    /**
     * Stores the session's state if the stored version still equals {@code session.version()}.
     */
    PracticeSession update(PracticeSession session);

    /**
     * Planned, active and paused sessions, newest first.
     */
    List<PracticeSession> findActive(UUID learnerId);

    List<PracticeSession> findRecent(UUID learnerId, int limit);

    /**
     * Completed sessions whose completion time lies within {@code [from, to]}.
     */
    List<PracticeSession> findCompletedBetween(UUID learnerId, Instant from, Instant to);
}

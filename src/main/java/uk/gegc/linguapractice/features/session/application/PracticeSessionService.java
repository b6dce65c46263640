package uk.gegc.linguapractice.features.session.application;

import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;

import java.util.List;
import java.util.UUID;

public interface PracticeSessionService {

    PracticeSession createSession(UUID learnerId, SessionConfiguration configuration);

    PracticeSession getSession(UUID sessionId);

    PracticeSession completeSession(UUID sessionId);

    PracticeSession pauseSession(UUID sessionId);

    PracticeSession resumeSession(UUID sessionId);

    PracticeSession abandonSession(UUID sessionId);

    List<PracticeSession> getActiveSessions(UUID learnerId);

    List<PracticeSession> getRecentSessions(UUID learnerId, int limit);
}

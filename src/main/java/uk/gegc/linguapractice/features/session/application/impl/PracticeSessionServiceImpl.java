package uk.gegc.linguapractice.features.session.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;
import uk.gegc.linguapractice.features.answer.domain.repository.AnswerRecordRepository;
import uk.gegc.linguapractice.features.session.application.PracticeSessionService;
import uk.gegc.linguapractice.features.session.application.SessionConfiguration;
import uk.gegc.linguapractice.features.session.application.SessionResultsCalculator;
import uk.gegc.linguapractice.features.session.application.SessionTaskComposer;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;
import uk.gegc.linguapractice.features.session.domain.repository.PracticeSessionRepository;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.repository.TaskRepository;
import uk.gegc.linguapractice.shared.config.PracticeProperties;
import uk.gegc.linguapractice.shared.exception.BusinessRuleException;
import uk.gegc.linguapractice.shared.exception.ResourceNotFoundException;
import uk.gegc.linguapractice.shared.exception.ValidationException;
import uk.gegc.linguapractice.shared.metrics.PracticeMetrics;
import uk.gegc.linguapractice.shared.util.DateUtils;
import uk.gegc.linguapractice.shared.validation.InputValidator;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PracticeSessionServiceImpl implements PracticeSessionService {

    private final PracticeSessionRepository sessionRepository;
    private final AnswerRecordRepository answerRecordRepository;
    private final TaskRepository taskRepository;
    private final SessionTaskComposer taskComposer;
    private final SessionResultsCalculator resultsCalculator;
    private final InputValidator inputValidator;
    private final PracticeProperties properties;
    private final PracticeMetrics metrics;
    private final DateUtils dateUtils;

    @Override
    @Transactional
    public PracticeSession createSession(UUID learnerId, SessionConfiguration configuration) {
        if (learnerId == null) {
            throw new ValidationException("Learner id is required", "learnerId", null);
        }
        inputValidator.validate(configuration, "configuration");
        if (configuration.targetCount() > properties.getMaxTargetCount()) {
            throw new ValidationException("Target count must be between 1 and " + properties.getMaxTargetCount(),
                    "targetCount", configuration.targetCount());
        }

        Instant now = dateUtils.now();
        List<UUID> taskIds = taskComposer.compose(learnerId, configuration, now);
        if (taskIds.isEmpty()) {
            throw new ValidationException("No tasks available for the selected learning paths",
                    "learningPathIds", configuration.learningPathIds());
        }

        PracticeSession.Configuration sessionConfiguration = new PracticeSession.Configuration(
                configuration.topicId(),
                configuration.learningPathIds(),
                configuration.targetCount(),
                configuration.includeReview(),
                configuration.difficultyFilter()
        );
        PracticeSession created = sessionRepository.create(
                PracticeSession.plan(learnerId, sessionConfiguration, taskIds, now));

        metrics.incrementSessionCreated();
        log.info("Created session {} for learner {} with {} of {} target tasks",
                created.id(), learnerId, taskIds.size(), configuration.targetCount());
        return created;
    }

    @Override
    @Transactional(readOnly = true)
    public PracticeSession getSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Session", sessionId));
    }

    @Override
    @Transactional
    public PracticeSession completeSession(UUID sessionId) {
        PracticeSession session = lockSession(sessionId);
        if (!session.status().canTransitionTo(SessionStatus.COMPLETED)) {
            throw new BusinessRuleException("Cannot complete session " + sessionId + " in status " + session.status(),
                    session.status().name(), "COMPLETE");
        }

        List<AnswerRecord> answers = answerRecordRepository.findBySessionId(sessionId);
        List<UUID> answeredTaskIds = answers.stream().map(AnswerRecord::taskId).distinct().toList();
        Map<UUID, Task> tasks = taskRepository.findAllById(answeredTaskIds).stream()
                .collect(Collectors.toMap(Task::id, Function.identity(), (a, b) -> a));

        PracticeSession.Results results = resultsCalculator.calculate(session, answers, tasks);
        PracticeSession completed = sessionRepository.update(session.complete(results, dateUtils.now()));

        metrics.incrementSessionCompleted();
        log.info("Completed session {}: {} answers, accuracy {}%",
                sessionId, completed.execution().completedCount(), results.accuracy());
        return completed;
    }

    @Override
    @Transactional
    public PracticeSession pauseSession(UUID sessionId) {
        PracticeSession paused = sessionRepository.update(lockSession(sessionId).pause(dateUtils.now()));
        log.info("Paused session {}", sessionId);
        return paused;
    }

    @Override
    @Transactional
    public PracticeSession resumeSession(UUID sessionId) {
        PracticeSession resumed = sessionRepository.update(lockSession(sessionId).resume(dateUtils.now()));
        log.info("Resumed session {}", sessionId);
        return resumed;
    }

    @Override
    @Transactional
    public PracticeSession abandonSession(UUID sessionId) {
        PracticeSession abandoned = sessionRepository.update(lockSession(sessionId).abandon(dateUtils.now()));
        metrics.incrementSessionAbandoned();
        log.info("Abandoned session {} after {} answers", sessionId, abandoned.execution().completedCount());
        return abandoned;
    }

    @Override
    @Transactional(readOnly = true)
    public List<PracticeSession> getActiveSessions(UUID learnerId) {
        return sessionRepository.findActive(learnerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PracticeSession> getRecentSessions(UUID learnerId, int limit) {
        if (limit < 1) {
            throw new ValidationException("Limit must be at least 1", "limit", limit);
        }
        return sessionRepository.findRecent(learnerId, limit);
    }

    private PracticeSession lockSession(UUID sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> ResourceNotFoundException.of("Session", sessionId));
    }
}

package uk.gegc.linguapractice.features.answer.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.answer.application.AnswerOutcome;
import uk.gegc.linguapractice.features.answer.application.AnswerRecorder;
import uk.gegc.linguapractice.features.answer.application.AnswerSubmission;
import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;
import uk.gegc.linguapractice.features.answer.domain.repository.AnswerRecordRepository;
import uk.gegc.linguapractice.features.repetition.application.SchedulingService;
import uk.gegc.linguapractice.features.repetition.domain.model.RecallGrade;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;
import uk.gegc.linguapractice.features.session.domain.repository.PracticeSessionRepository;
import uk.gegc.linguapractice.features.task.domain.repository.TaskRepository;
import uk.gegc.linguapractice.shared.exception.ResourceNotFoundException;
import uk.gegc.linguapractice.shared.metrics.PracticeMetrics;
import uk.gegc.linguapractice.shared.persistence.ConflictRetryExecutor;
import uk.gegc.linguapractice.shared.util.DateUtils;
import uk.gegc.linguapractice.shared.validation.InputValidator;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerRecorderImpl implements AnswerRecorder {

    private final PracticeSessionRepository sessionRepository;
    private final AnswerRecordRepository answerRecordRepository;
    private final TaskRepository taskRepository;
    private final SchedulingService schedulingService;
    private final ConflictRetryExecutor retryExecutor;
    private final InputValidator inputValidator;
    private final PracticeMetrics metrics;
    private final DateUtils dateUtils;

    @Lazy
    private final AnswerRecorder self;

    @Override
    public AnswerOutcome recordAnswer(AnswerSubmission submission) {
        inputValidator.validate(submission, "answer");
        AnswerOutcome outcome = retryExecutor.execute("recordAnswer", () -> self.recordAnswerTx(submission));
        metrics.incrementAnswerRecorded(RecallGrade.of(outcome.answer().grade()).isLapse());
        return outcome;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AnswerOutcome recordAnswerTx(AnswerSubmission submission) {
        PracticeSession session = sessionRepository.findByIdForUpdate(submission.sessionId())
                .orElseThrow(() -> ResourceNotFoundException.of("Session", submission.sessionId()));
        taskRepository.findById(submission.taskId())
                .orElseThrow(() -> ResourceNotFoundException.of("Task", submission.taskId()));

        Instant now = dateUtils.now();
        boolean wasPlanned = session.status() == SessionStatus.PLANNED;
        PracticeSession counted = session.recordAnswer(submission.isCorrect(), submission.timeSpent(), now);

        int grade = submission.grade() != null
                ? submission.grade()
                : RecallGrade.fromCorrectness(submission.isCorrect()).getSm2Value();

        AnswerRecord answer = answerRecordRepository.append(new AnswerRecord(
                null,
                session.id(),
                session.learnerId(),
                submission.taskId(),
                submission.userAnswer(),
                submission.isCorrect(),
                submission.timeSpent(),
                submission.confidence(),
                grade,
                new AnswerRecord.Metadata(
                        submission.attemptNumber(),
                        submission.hintsUsed(),
                        submission.deviceType(),
                        submission.clientInfo()),
                now
        ));

        SpacedRepetitionItem item = schedulingService.applyAnswer(
                session.learnerId(), submission.taskId(), grade, submission.timeSpent() * 1000L);
        PracticeSession updated = sessionRepository.update(counted);

        if (wasPlanned) {
            log.info("Session {} started with first answer", session.id());
        }
        log.debug("Recorded answer for task {} in session {} ({}/{}), next review in {} days",
                submission.taskId(), session.id(),
                updated.execution().completedCount(), updated.configuration().targetCount(),
                item.algorithm().interval());
        return new AnswerOutcome(answer, item, updated);
    }
}

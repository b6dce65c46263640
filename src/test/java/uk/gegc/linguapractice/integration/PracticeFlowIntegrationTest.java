package uk.gegc.linguapractice.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.BaseIntegrationTest;
import uk.gegc.linguapractice.features.answer.application.AnswerOutcome;
import uk.gegc.linguapractice.features.answer.application.AnswerRecorder;
import uk.gegc.linguapractice.features.answer.application.AnswerSubmission;
import uk.gegc.linguapractice.features.answer.domain.model.DeviceType;
import uk.gegc.linguapractice.features.progress.application.StreakService;
import uk.gegc.linguapractice.features.progress.domain.model.StreakSummary;
import uk.gegc.linguapractice.features.repetition.application.SchedulingService;
import uk.gegc.linguapractice.features.repetition.domain.model.RepetitionStatistics;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.session.application.PracticeSessionService;
import uk.gegc.linguapractice.features.session.application.SessionConfiguration;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;
import uk.gegc.linguapractice.features.task.domain.model.TaskType;
import uk.gegc.linguapractice.features.task.infra.persistence.TaskEntity;
import uk.gegc.linguapractice.features.task.infra.persistence.TaskJpaRepository;
import uk.gegc.linguapractice.shared.exception.BusinessRuleException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("Practice flow against a real database")
class PracticeFlowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private PracticeSessionService sessionService;

    @Autowired
    private AnswerRecorder answerRecorder;

    @Autowired
    private SchedulingService schedulingService;

    @Autowired
    private StreakService streakService;

    @Autowired
    private TaskJpaRepository taskJpaRepository;

    private UUID learner;
    private UUID learningPath;

    @BeforeEach
    void setUp() {
        learner = UUID.randomUUID();
        learningPath = UUID.randomUUID();
        for (int i = 0; i < 15; i++) {
            TaskEntity task = new TaskEntity();
            task.setLearningPathId(learningPath);
            task.setType(TaskType.FLASHCARD);
            task.setDifficulty(TaskDifficulty.EASY);
            task.setTags(new ArrayList<>(List.of("vocabulary")));
            task.setContent("{\"front\":\"Hund\",\"back\":\"dog\"}");
            taskJpaRepository.save(task);
        }
    }

    @AfterEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM answer_record");
        jdbcTemplate.update("DELETE FROM spaced_repetition_item");
        jdbcTemplate.update("DELETE FROM practice_session");
        jdbcTemplate.update("DELETE FROM tasks");
    }

    private PracticeSession newSession(int targetCount, boolean includeReview) {
        return sessionService.createSession(learner,
                new SessionConfiguration(null, List.of(learningPath), targetCount, includeReview, null));
    }

    private AnswerOutcome answer(PracticeSession session, UUID taskId, boolean correct) {
        return answerRecorder.recordAnswer(new AnswerSubmission(
                session.id(), taskId, List.of("dog"), correct, 30, 4, null, 1, 0, DeviceType.DESKTOP, "it"));
    }

    @Test
    @DisplayName("a full session of ten correct answers completes with perfect accuracy and starts a streak")
    void fullSession() {
        PracticeSession session = newSession(10, false);
        assertThat(session.execution().taskIds()).hasSize(10).doesNotHaveDuplicates();

        for (UUID taskId : session.execution().taskIds()) {
            answer(session, taskId, true);
        }
        PracticeSession completed = sessionService.completeSession(session.id());

        assertThat(completed.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(completed.execution().completedCount()).isEqualTo(10);
        assertThat(completed.execution().completedAt()).isNotNull();
        assertThat(completed.results().accuracy()).isEqualTo(100);
        assertThat(completed.results().averageTime()).isEqualTo(30.0);
        assertThat(completed.results().difficultyDistribution()).containsEntry("EASY", 10);
        assertThat(completed.results().improvementAreas()).isEmpty();

        SpacedRepetitionItem item = schedulingService
                .getRepetitionData(learner, session.execution().taskIds().get(0))
                .orElseThrow();
        assertThat(item.algorithm().interval()).isEqualTo(1);
        assertThat(item.algorithm().repetition()).isEqualTo(1);
        assertThat(item.performance().averageTime()).isEqualTo(30_000.0);

        RepetitionStatistics statistics = schedulingService.getStatistics(learner);
        assertThat(statistics.totalItems()).isEqualTo(10);
        assertThat(statistics.dueNow()).isZero();

        StreakSummary streak = streakService.getStreak(learner);
        assertThat(streak.currentStreak()).isEqualTo(1);
        assertThat(streak.streakActive()).isTrue();

        assertThatThrownBy(() -> answer(completed, session.execution().taskIds().get(0), true))
                .isInstanceOf(BusinessRuleException.class);
    }

    @Test
    @DisplayName("pausing keeps the counts, blocks answers until resumed and lets the session continue")
    void pauseAndResume() {
        PracticeSession session = newSession(10, false);
        List<UUID> taskIds = session.execution().taskIds();
        answer(session, taskIds.get(0), true);
        answer(session, taskIds.get(1), false);
        answer(session, taskIds.get(2), true);

        PracticeSession paused = sessionService.pauseSession(session.id());
        assertThat(paused.status()).isEqualTo(SessionStatus.PAUSED);
        assertThatThrownBy(() -> answer(session, taskIds.get(3), true))
                .isInstanceOf(BusinessRuleException.class)
                .hasMessageContaining("resume");

        PracticeSession resumed = sessionService.resumeSession(session.id());
        assertThat(resumed.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(resumed.execution().completedCount()).isEqualTo(3);
        assertThat(resumed.execution().correctCount()).isEqualTo(2);

        AnswerOutcome next = answer(session, taskIds.get(3), true);
        assertThat(next.session().execution().completedCount()).isEqualTo(4);
        assertThat(sessionService.getActiveSessions(learner)).extracting(PracticeSession::id).containsExactly(session.id());
    }

    @Test
    @DisplayName("overdue reviews are placed into the next session that asks for them")
    void reviewTasksEnterNextSession() {
        PracticeSession first = newSession(5, false);
        for (UUID taskId : first.execution().taskIds()) {
            answer(first, taskId, true);
        }
        sessionService.completeSession(first.id());
        UUID reviewTask = first.execution().taskIds().get(2);
        schedulingService.rescheduleTask(learner, reviewTask, Instant.now().minus(1, ChronoUnit.HOURS));

        assertThat(schedulingService.getTasksDue(learner)).extracting(Task::id).containsExactly(reviewTask);

        PracticeSession second = newSession(5, true);
        assertThat(second.execution().taskIds()).hasSize(5).startsWith(reviewTask);
    }

    @Test
    @DisplayName("concurrent answers to one session are all counted")
    void concurrentAnswers() throws Exception {
        PracticeSession session = newSession(10, false);
        List<UUID> taskIds = session.execution().taskIds();
        ExecutorService pool = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AnswerOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < taskIds.size(); i++) {
                UUID taskId = taskIds.get(i);
                boolean correct = i % 2 == 0;
                futures.add(pool.submit(() -> {
                    start.await();
                    return answer(session, taskId, correct);
                }));
            }
            start.countDown();
            for (Future<AnswerOutcome> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        PracticeSession stored = sessionService.getSession(session.id());
        assertThat(stored.execution().completedCount()).isEqualTo(10);
        assertThat(stored.execution().correctCount()).isEqualTo(5);
        assertThat(stored.execution().totalTimeSpent()).isEqualTo(300);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM answer_record", Integer.class)).isEqualTo(10);
    }

    @Test
    @DisplayName("concurrent first answers to the same task produce a single repetition item")
    void concurrentFirstReviewOfOneTask() throws Exception {
        UUID taskId = newSession(1, false).execution().taskIds().get(0);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SpacedRepetitionItem>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return schedulingService.recordAnswer(learner, taskId, true, null);
                }));
            }
            start.countDown();
            for (Future<SpacedRepetitionItem> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        SpacedRepetitionItem item = schedulingService.getRepetitionData(learner, taskId).orElseThrow();
        assertThat(item.schedule().totalReviews()).isEqualTo(4);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM spaced_repetition_item", Integer.class)).isEqualTo(1);
    }
}

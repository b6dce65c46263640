package uk.gegc.linguapractice.features.progress.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.linguapractice.features.progress.domain.model.StreakSummary;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("StreakProjector")
class StreakProjectorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 8, 10);
    private static final UUID LEARNER = UUID.randomUUID();

    private final StreakProjector projector = new StreakProjector();

    private static PracticeSession planned(Instant createdAt) {
        PracticeSession.Configuration configuration =
                new PracticeSession.Configuration(null, List.of(UUID.randomUUID()), 5, false, null);
        return PracticeSession.plan(LEARNER, configuration, List.of(UUID.randomUUID()), createdAt)
                .withIdentity(UUID.randomUUID(), 0L);
    }

    private static PracticeSession completedAt(Instant at) {
        return planned(at.minusSeconds(600))
                .recordAnswer(true, 30, at.minusSeconds(300))
                .complete(new PracticeSession.Results(100, 30, null, null), at);
    }

    private static PracticeSession completedDaysAgo(int daysAgo) {
        return completedAt(TODAY.minusDays(daysAgo).atTime(18, 0).toInstant(ZoneOffset.UTC));
    }

    private StreakSummary project(List<PracticeSession> sessions) {
        return projector.project(sessions, TODAY, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("no completed sessions yields an empty streak aimed at the first milestone")
    void empty() {
        StreakSummary summary = project(List.of());

        assertThat(summary).isEqualTo(new StreakSummary(0, 0, null, false, 7, 0));
    }

    @Test
    @DisplayName("sessions that were not completed are ignored")
    void ignoresOpenSessions() {
        Instant at = TODAY.atTime(9, 0).toInstant(ZoneOffset.UTC);
        PracticeSession active = planned(at).recordAnswer(true, 20, at);
        PracticeSession abandoned = planned(at).abandon(at);

        StreakSummary summary = project(List.of(active, abandoned));

        assertThat(summary.currentStreak()).isZero();
        assertThat(summary.lastActivityDate()).isNull();
    }

    @Test
    @DisplayName("consecutive days ending today count as an active streak")
    void streakEndingToday() {
        StreakSummary summary = project(List.of(completedDaysAgo(0), completedDaysAgo(1), completedDaysAgo(2)));

        assertThat(summary.currentStreak()).isEqualTo(3);
        assertThat(summary.bestStreak()).isEqualTo(3);
        assertThat(summary.streakActive()).isTrue();
        assertThat(summary.nextMilestone()).isEqualTo(7);
        assertThat(summary.progressToNextMilestone()).isCloseTo(300.0 / 7, within(1e-9));
    }

    @Test
    @DisplayName("a streak ending yesterday is still active")
    void streakEndingYesterday() {
        StreakSummary summary = project(List.of(completedDaysAgo(1), completedDaysAgo(2)));

        assertThat(summary.currentStreak()).isEqualTo(2);
        assertThat(summary.streakActive()).isTrue();
    }

    @Test
    @DisplayName("a missed day ends the current streak while the best streak remembers older runs")
    void gapStopsStreak() {
        List<PracticeSession> sessions = new ArrayList<>(List.of(
                completedDaysAgo(0), completedDaysAgo(1), completedDaysAgo(3)));
        for (int day = 10; day < 14; day++) {
            sessions.add(completedDaysAgo(day));
        }

        StreakSummary summary = project(sessions);

        assertThat(summary.currentStreak()).isEqualTo(2);
        assertThat(summary.bestStreak()).isEqualTo(4);
    }

    @Test
    @DisplayName("activity older than yesterday leaves no current streak but keeps the best one")
    void staleActivity() {
        PracticeSession last = completedDaysAgo(5);

        StreakSummary summary = project(List.of(last, completedDaysAgo(6)));

        assertThat(summary.currentStreak()).isZero();
        assertThat(summary.streakActive()).isFalse();
        assertThat(summary.bestStreak()).isEqualTo(2);
        assertThat(summary.lastActivityDate()).isEqualTo(last.execution().completedAt());
        assertThat(summary.progressToNextMilestone()).isZero();
    }

    @Test
    @DisplayName("a single stale day still counts as a best streak of one")
    void singleStaleDay() {
        StreakSummary summary = project(List.of(completedDaysAgo(4)));

        assertThat(summary.currentStreak()).isZero();
        assertThat(summary.bestStreak()).isEqualTo(1);
    }

    @Test
    @DisplayName("several sessions on one day count once and the latest completion is reported")
    void sameDayCountsOnce() {
        Instant morning = TODAY.atTime(8, 0).toInstant(ZoneOffset.UTC);
        Instant evening = TODAY.atTime(21, 0).toInstant(ZoneOffset.UTC);

        StreakSummary summary = project(List.of(completedAt(morning), completedAt(evening), completedAt(morning)));

        assertThat(summary.currentStreak()).isEqualTo(1);
        assertThat(summary.lastActivityDate()).isEqualTo(evening);
    }

    @Test
    @DisplayName("days are bucketed in the learner's zone")
    void usesLearnerZone() {
        // 23:30 UTC on the 9th is already the 10th in Berlin
        Instant lateEvening = Instant.parse("2025-08-09T23:30:00Z");
        Instant dayBefore = Instant.parse("2025-08-09T10:00:00Z");

        StreakSummary summary = projector.project(
                List.of(completedAt(lateEvening), completedAt(dayBefore)), TODAY, ZoneId.of("Europe/Berlin"));

        assertThat(summary.currentStreak()).isEqualTo(2);
    }

    @Test
    @DisplayName("progress is measured between the surrounding milestones")
    void progressBetweenMilestones() {
        List<PracticeSession> sessions = new ArrayList<>();
        for (int day = 0; day < 10; day++) {
            sessions.add(completedDaysAgo(day));
        }

        StreakSummary summary = project(sessions);

        assertThat(summary.currentStreak()).isEqualTo(10);
        assertThat(summary.nextMilestone()).isEqualTo(14);
        assertThat(summary.progressToNextMilestone()).isCloseTo(3 * 100.0 / 7, within(1e-9));
    }

    @ParameterizedTest(name = "streak {0} -> next {1}, previous {2}")
    @CsvSource({
            "0, 7, 0",
            "6, 7, 0",
            "7, 14, 7",
            "30, 60, 30",
            "364, 365, 180",
            "365, 730, 365",
            "400, 730, 365",
            "730, 1095, 730"
    })
    @DisplayName("milestones continue in yearly steps after a full year")
    void milestones(int streak, int expectedNext, int expectedPrevious) {
        int next = StreakProjector.nextMilestone(streak);

        assertThat(next).isEqualTo(expectedNext);
        assertThat(StreakProjector.previousMilestone(streak, next)).isEqualTo(expectedPrevious);
    }
}

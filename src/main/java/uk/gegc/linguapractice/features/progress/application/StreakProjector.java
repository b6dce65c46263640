package uk.gegc.linguapractice.features.progress.application;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.progress.domain.model.StreakSummary;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.domain.model.SessionStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Computes practice streaks from completed sessions. A day counts once no matter how many
 * sessions were completed on it; days are taken in the learner's zone.
 */
@Component
public class StreakProjector {

    public static final List<Integer> MILESTONES = List.of(7, 14, 30, 60, 100, 180, 365);
    private static final int YEAR_CYCLE = 365;

    public StreakSummary project(Collection<PracticeSession> sessions, LocalDate today, ZoneId zone) {
        List<Instant> completions = sessions.stream()
                .filter(session -> session.status() == SessionStatus.COMPLETED)
                .map(session -> session.execution().completedAt())
                .filter(Objects::nonNull)
                .sorted(Comparator.reverseOrder())
                .toList();

        if (completions.isEmpty()) {
            return new StreakSummary(0, 0, null, false, MILESTONES.get(0), 0);
        }

        // distinct days, newest first
        List<LocalDate> days = new ArrayList<>(new TreeSet<>(
                completions.stream().map(instant -> instant.atZone(zone).toLocalDate()).toList()
        ).descendingSet());

        LocalDate mostRecent = days.get(0);
        LocalDate yesterday = today.minusDays(1);
        boolean active = mostRecent.equals(today) || mostRecent.equals(yesterday);

        int current = active ? runLength(days, 0) : 0;
        int best = Math.max(current, longestRun(days));

        int next = nextMilestone(current);
        int previous = previousMilestone(current, next);
        double progress = next > previous ? (current - previous) * 100.0 / (next - previous) : 0;

        return new StreakSummary(current, best, completions.get(0), active, next, progress);
    }

    static int nextMilestone(int streak) {
        for (int milestone : MILESTONES) {
            if (milestone > streak) {
                return milestone;
            }
        }
        return (int) Math.ceil((streak + 1) / (double) YEAR_CYCLE) * YEAR_CYCLE;
    }

    static int previousMilestone(int streak, int next) {
        int last = MILESTONES.get(MILESTONES.size() - 1);
        if (streak >= last) {
            return (streak / YEAR_CYCLE) * YEAR_CYCLE;
        }
        int index = MILESTONES.indexOf(next);
        return index > 0 ? MILESTONES.get(index - 1) : 0;
    }

    // consecutive days starting at days[start] going back in time
    private static int runLength(List<LocalDate> days, int start) {
        int length = 1;
        for (int i = start + 1; i < days.size(); i++) {
            if (!days.get(i).equals(days.get(i - 1).minusDays(1))) {
                break;
            }
            length++;
        }
        return length;
    }

    private static int longestRun(List<LocalDate> days) {
        int best = 1;
        int run = 1;
        for (int i = 1; i < days.size(); i++) {
            run = days.get(i).equals(days.get(i - 1).minusDays(1)) ? run + 1 : 1;
            best = Math.max(best, run);
        }
        return best;
    }
}

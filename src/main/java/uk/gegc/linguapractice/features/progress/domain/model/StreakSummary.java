package uk.gegc.linguapractice.features.progress.domain.model;

import java.time.Instant;

/**
 * @param lastActivityDate        completion time of the most recent completed session, {@code null} if none
 * @param streakActive            a session was completed today or yesterday
 * @param progressToNextMilestone percentage (0-100) of the way from the previous milestone to the next
 */
public record StreakSummary(
        int currentStreak,
        int bestStreak,
        Instant lastActivityDate,
        boolean streakActive,
        int nextMilestone,
        double progressToNextMilestone
) {
}

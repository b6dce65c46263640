package uk.gegc.linguapractice.features.repetition.domain.model;

import java.time.LocalDate;

/**
 * Projected review workload of one calendar day.
 *
 * @param estimatedTimeSeconds sum of the items' average answer times, rounded to seconds
 */
public record DailyReviewLoad(LocalDate date, int taskCount, long estimatedTimeSeconds) {
}

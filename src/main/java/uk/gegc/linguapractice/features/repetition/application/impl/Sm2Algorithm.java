package uk.gegc.linguapractice.features.repetition.application.impl;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.repetition.application.SrsAlgorithm;
import uk.gegc.linguapractice.features.repetition.domain.model.RecallGrade;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem.MAX_INTERVAL_DAYS;
import static uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem.MIN_EFACTOR;
import static uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem.MIN_INTERVAL_DAYS;

/**
 * SM-2: a lapse sends the task back to a one-day interval and clears its learned status; each
 * success grows the interval 1, 6, then by the updated ease factor up to a year.
 */
@Component
public class Sm2Algorithm implements SrsAlgorithm {

    private static final int SECOND_SUCCESS_INTERVAL_DAYS = 6;

    @Override
    public ReviewStep review(
            SpacedRepetitionItem.Algorithm current,
            int lapseCount,
            RecallGrade grade,
            int graduationThreshold,
            Instant now
    ) {
        double efactor = updatedEfactor(current.efactor(), grade.getSm2Value());

        if (grade.isLapse()) {
            SpacedRepetitionItem.Algorithm reset = new SpacedRepetitionItem.Algorithm(MIN_INTERVAL_DAYS, 0, efactor);
            return new ReviewStep(reset, dueAfter(now, MIN_INTERVAL_DAYS), true, lapseCount + 1, false);
        }

        int repetition = current.repetition() + 1;
        int interval = switch (current.repetition()) {
            case 0 -> MIN_INTERVAL_DAYS;
            case 1 -> SECOND_SUCCESS_INTERVAL_DAYS;
            default -> (int) Math.min(MAX_INTERVAL_DAYS, Math.round(current.interval() * efactor));
        };
        SpacedRepetitionItem.Algorithm grown = new SpacedRepetitionItem.Algorithm(interval, repetition, efactor);
        return new ReviewStep(grown, dueAfter(now, interval), false, lapseCount, repetition >= graduationThreshold);
    }

    private static Instant dueAfter(Instant now, int days) {
        return now.plus(days, ChronoUnit.DAYS);
    }

    // EF' = EF + (0.1 - (5 - q) * (0.08 + (5 - q) * 0.02)), floor 1.3
    private static double updatedEfactor(double efactor, int q) {
        return Math.max(MIN_EFACTOR, efactor + (0.1 - (5 - q) * (0.08 + (5 - q) * 0.02)));
    }
}

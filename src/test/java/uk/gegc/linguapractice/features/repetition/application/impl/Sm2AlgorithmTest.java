package uk.gegc.linguapractice.features.repetition.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import uk.gegc.linguapractice.BaseUnitTest;
import uk.gegc.linguapractice.features.repetition.application.SrsAlgorithm;
import uk.gegc.linguapractice.features.repetition.domain.model.RecallGrade;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Sm2Algorithm Tests")
class Sm2AlgorithmTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-02-01T12:00:00Z");
    private static final int GRADUATION = 3;

    private Sm2Algorithm algorithm;

    @BeforeEach
    void setUp() {
        algorithm = new Sm2Algorithm();
    }

    private SrsAlgorithm.ReviewStep review(int repetition, int interval, double efactor, int lapses, RecallGrade grade) {
        return algorithm.review(new SpacedRepetitionItem.Algorithm(interval, repetition, efactor), lapses, grade, GRADUATION, NOW);
    }

    @Test
    @DisplayName("A lapse resets repetition and interval, counts the lapse and clears graduation")
    void shouldResetOnLapse() {
        SrsAlgorithm.ReviewStep step = review(4, 40, 2.5, 2, RecallGrade.WRONG_FAMILIAR);

        assertTrue(step.lapse());
        assertEquals(0, step.algorithm().repetition());
        assertEquals(1, step.algorithm().interval());
        assertEquals(3, step.lapseCount());
        assertFalse(step.graduated());
        assertEquals(NOW.plus(1, ChronoUnit.DAYS), step.nextReview());
    }

    @Test
    @DisplayName("A fresh item answered correctly gets interval 1 and repetition 1")
    void shouldReturnInterval1ForFirstSuccess() {
        SrsAlgorithm.ReviewStep step = review(0, 1, 2.5, 0, RecallGrade.PERFECT);

        assertFalse(step.lapse());
        assertEquals(1, step.algorithm().interval());
        assertEquals(1, step.algorithm().repetition());
        assertEquals(2.6, step.algorithm().efactor(), 1e-9);
        assertEquals(0, step.lapseCount());
    }

    @Test
    @DisplayName("The second success gets interval 6")
    void shouldReturnInterval6ForSecondSuccess() {
        SrsAlgorithm.ReviewStep step = review(1, 1, 2.5, 0, RecallGrade.GOOD);

        assertEquals(6, step.algorithm().interval());
        assertEquals(2, step.algorithm().repetition());
        assertEquals(NOW.plus(6, ChronoUnit.DAYS), step.nextReview());
    }

    @Test
    @DisplayName("Later successes multiply the interval by the updated ease")
    void shouldUseMultiplierForLaterReviews() {
        // GOOD keeps ease at 2.5, so round(6*2.5)=15
        SrsAlgorithm.ReviewStep step = review(2, 6, 2.5, 0, RecallGrade.GOOD);

        assertEquals(15, step.algorithm().interval());
        assertEquals(3, step.algorithm().repetition());
    }

    @Test
    @DisplayName("Interval is capped at 365 days")
    void shouldCapInterval() {
        assertEquals(365, review(6, 300, 2.5, 0, RecallGrade.PERFECT).algorithm().interval());
    }

    @Test
    @DisplayName("Graduation happens once repetition reaches the threshold")
    void graduatesAtThreshold() {
        assertFalse(review(1, 1, 2.5, 0, RecallGrade.GOOD).graduated());
        assertTrue(review(2, 6, 2.5, 0, RecallGrade.GOOD).graduated());
    }

    @Test
    @DisplayName("Successes keep the existing lapse count")
    void successKeepsLapseCount() {
        SrsAlgorithm.ReviewStep step = review(0, 1, 2.0, 4, RecallGrade.HARD);

        assertFalse(step.lapse());
        assertEquals(4, step.lapseCount());
    }

    @Test
    @DisplayName("Applies the SM-2 ease formula")
    void shouldApplyEaseFormula() {
        assertEquals(2.6, review(2, 6, 2.5, 0, RecallGrade.PERFECT).algorithm().efactor(), 1e-9);
        assertEquals(2.5, review(2, 6, 2.5, 0, RecallGrade.GOOD).algorithm().efactor(), 1e-9);
        assertEquals(2.36, review(2, 6, 2.5, 0, RecallGrade.HARD).algorithm().efactor(), 1e-9);
        assertEquals(2.18, review(2, 6, 2.5, 0, RecallGrade.WRONG_FAMILIAR).algorithm().efactor(), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(RecallGrade.class)
    @DisplayName("Ease factor never drops below 1.3")
    void easeNeverBelowFloor(RecallGrade grade) {
        assertTrue(review(3, 10, 1.3, 0, grade).algorithm().efactor() >= 1.3);
    }
}

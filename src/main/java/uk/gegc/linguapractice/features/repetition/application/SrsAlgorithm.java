package uk.gegc.linguapractice.features.repetition.application;

import uk.gegc.linguapractice.features.repetition.domain.model.RecallGrade;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;

import java.time.Instant;

/**
 * Scheduling rule for one graded review of a task.
 */
public interface SrsAlgorithm {

    /**
     * @param current             interval, repetition and ease before the review; a never-reviewed
     *                            item has repetition 0
     * @param lapseCount          lapses recorded so far
     * @param graduationThreshold successful repetitions after which the item counts as learned
     */
    ReviewStep review(
            SpacedRepetitionItem.Algorithm current,
            int lapseCount,
            RecallGrade grade,
            int graduationThreshold,
            Instant now
    );

    record ReviewStep(
            SpacedRepetitionItem.Algorithm algorithm,
            Instant nextReview,
            boolean lapse,
            int lapseCount,
            boolean graduated
    ) {
    }
}

package uk.gegc.linguapractice.features.repetition.domain.repository;

import uk.gegc.linguapractice.features.repetition.domain.model.RepetitionStatistics;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpacedRepetitionItemRepository {

    Optional<SpacedRepetitionItem> findByTaskId(UUID learnerId, UUID taskId);

    /**
     * Items whose next review is at or before {@code now}.
     */
    List<SpacedRepetitionItem> findDue(UUID learnerId, Instant now);

    /**
     * Items whose next review lies within {@code [from, to]}.
     */
    List<SpacedRepetitionItem> findByNextReviewBetween(UUID learnerId, Instant from, Instant to);

    SpacedRepetitionItem create(SpacedRepetitionItem item);

    /**
     * Writes the item only if the stored version still equals {@code item.version()}.
     *
     * @throws org.springframework.dao.OptimisticLockingFailureException when another writer got there first
     */
    SpacedRepetitionItem update(SpacedRepetitionItem item);

    SpacedRepetitionItem updateSchedule(UUID itemId, Instant nextReview);

    RepetitionStatistics statistics(UUID learnerId, Instant now);
}

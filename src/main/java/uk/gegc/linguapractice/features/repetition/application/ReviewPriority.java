package uk.gegc.linguapractice.features.repetition.application;

import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;

import java.util.Comparator;

/**
 * Review order of due items: most lapses first, then most overdue, then task id so that
 * equal items always come out in the same order.
 */
public final class ReviewPriority {

    public static final Comparator<SpacedRepetitionItem> ORDER = Comparator
            .comparingInt((SpacedRepetitionItem item) -> item.metadata().lapseCount()).reversed()
            .thenComparing(item -> item.schedule().nextReview())
            .thenComparing(SpacedRepetitionItem::taskId);

    private ReviewPriority() {
    }
}

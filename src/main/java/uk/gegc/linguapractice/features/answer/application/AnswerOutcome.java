package uk.gegc.linguapractice.features.answer.application;

import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;

/**
 * State after an answer was recorded: the stored answer, the rescheduled item and the updated session.
 */
public record AnswerOutcome(AnswerRecord answer, SpacedRepetitionItem item, PracticeSession session) {
}

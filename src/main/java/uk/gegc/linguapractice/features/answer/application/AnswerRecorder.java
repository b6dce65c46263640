package uk.gegc.linguapractice.features.answer.application;

public interface AnswerRecorder {

    /**
     * Stores the answer, reschedules the task for the session's learner and counts the answer
     * on the session, all in one transaction. Conflicting concurrent writes are retried.
     */
    AnswerOutcome recordAnswer(AnswerSubmission submission);

    AnswerOutcome recordAnswerTx(AnswerSubmission submission);
}

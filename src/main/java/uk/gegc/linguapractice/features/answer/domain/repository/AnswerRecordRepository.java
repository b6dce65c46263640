package uk.gegc.linguapractice.features.answer.domain.repository;

import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;

import java.util.List;
import java.util.UUID;

public interface AnswerRecordRepository {

    AnswerRecord append(AnswerRecord record);

    /**
     * Answers of a session in submission order.
     */
    List<AnswerRecord> findBySessionId(UUID sessionId);
}

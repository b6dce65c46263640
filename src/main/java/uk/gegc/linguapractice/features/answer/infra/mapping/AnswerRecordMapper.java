package uk.gegc.linguapractice.features.answer.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;
import uk.gegc.linguapractice.features.answer.infra.persistence.AnswerRecordEntity;

import java.util.ArrayList;

@Component
public class AnswerRecordMapper {

    public AnswerRecord toDomain(AnswerRecordEntity entity) {
        return new AnswerRecord(
                entity.getId(),
                entity.getSessionId(),
                entity.getLearnerId(),
                entity.getTaskId(),
                entity.getUserAnswer(),
                Boolean.TRUE.equals(entity.getCorrect()),
                entity.getTimeSpent(),
                entity.getConfidence(),
                entity.getGrade(),
                new AnswerRecord.Metadata(
                        entity.getAttemptNumber(),
                        entity.getHintsUsed(),
                        entity.getDeviceType(),
                        entity.getClientInfo()),
                entity.getAnsweredAt()
        );
    }

    public AnswerRecordEntity toEntity(AnswerRecord record) {
        AnswerRecordEntity entity = new AnswerRecordEntity();
        entity.setSessionId(record.sessionId());
        entity.setLearnerId(record.learnerId());
        entity.setTaskId(record.taskId());
        entity.setUserAnswer(new ArrayList<>(record.userAnswer()));
        entity.setCorrect(record.correct());
        entity.setTimeSpent(record.timeSpent());
        entity.setConfidence(record.confidence());
        entity.setGrade(record.grade());
        entity.setAttemptNumber(record.metadata().attemptNumber());
        entity.setHintsUsed(record.metadata().hintsUsed());
        entity.setDeviceType(record.metadata().deviceType());
        entity.setClientInfo(record.metadata().clientInfo());
        entity.setAnsweredAt(record.timestamp());
        return entity;
    }
}

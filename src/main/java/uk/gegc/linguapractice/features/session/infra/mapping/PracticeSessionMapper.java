package uk.gegc.linguapractice.features.session.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.infra.persistence.PracticeSessionEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;

@Component
public class PracticeSessionMapper {

    public PracticeSession toDomain(PracticeSessionEntity entity) {
        PracticeSession.Configuration configuration = new PracticeSession.Configuration(
                entity.getTopicId(),
                entity.getLearningPathIds(),
                entity.getTargetCount(),
                Boolean.TRUE.equals(entity.getIncludeReview()),
                entity.getDifficultyFilter()
        );
        PracticeSession.Execution execution = new PracticeSession.Execution(
                entity.getTaskIds(),
                entity.getCompletedCount(),
                entity.getCorrectCount(),
                entity.getStatus(),
                entity.getStartedAt(),
                entity.getCompletedAt(),
                entity.getTotalTimeSpent()
        );
        PracticeSession.Results results = entity.getAccuracy() == null ? null : new PracticeSession.Results(
                entity.getAccuracy(),
                entity.getAverageTime() == null ? 0 : entity.getAverageTime(),
                entity.getDifficultyDistribution(),
                entity.getImprovementAreas()
        );
        return new PracticeSession(
                entity.getId(),
                entity.getLearnerId(),
                configuration,
                execution,
                results,
                entity.getVersion(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    public PracticeSessionEntity toNewEntity(PracticeSession session) {
        PracticeSessionEntity entity = new PracticeSessionEntity();
        PracticeSession.Configuration configuration = session.configuration();
        entity.setLearnerId(session.learnerId());
        entity.setTopicId(configuration.topicId());
        entity.setLearningPathIds(new ArrayList<>(configuration.learningPathIds()));
        entity.setTargetCount(configuration.targetCount());
        entity.setIncludeReview(configuration.includeReview());
        entity.setDifficultyFilter(configuration.difficultyFilter());
        entity.setCreatedAt(session.createdAt());
        applyState(entity, session);
        return entity;
    }

    /**
     * Copies execution state and results onto an existing row.
     */
    public void applyState(PracticeSessionEntity entity, PracticeSession session) {
        PracticeSession.Execution execution = session.execution();
        entity.setTaskIds(new ArrayList<>(execution.taskIds()));
        entity.setCompletedCount(execution.completedCount());
        entity.setCorrectCount(execution.correctCount());
        entity.setStatus(execution.status());
        entity.setStartedAt(execution.startedAt());
        entity.setCompletedAt(execution.completedAt());
        entity.setTotalTimeSpent(execution.totalTimeSpent());

        PracticeSession.Results results = session.results();
        if (results != null) {
            entity.setAccuracy(results.accuracy());
            entity.setAverageTime(results.averageTime());
            entity.setDifficultyDistribution(new LinkedHashMap<>(results.difficultyDistribution()));
            entity.setImprovementAreas(new ArrayList<>(results.improvementAreas()));
        }
        entity.setUpdatedAt(session.updatedAt());
    }
}

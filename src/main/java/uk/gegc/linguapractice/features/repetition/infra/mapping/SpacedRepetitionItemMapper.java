package uk.gegc.linguapractice.features.repetition.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.repetition.infra.persistence.SpacedRepetitionItemEntity;

@Component
public class SpacedRepetitionItemMapper {

    public SpacedRepetitionItem toDomain(SpacedRepetitionItemEntity entity) {
        return new SpacedRepetitionItem(
                entity.getId(),
                entity.getLearnerId(),
                entity.getTaskId(),
                new SpacedRepetitionItem.Algorithm(
                        entity.getIntervalDays(),
                        entity.getRepetitionCount(),
                        entity.getEaseFactor()),
                new SpacedRepetitionItem.Schedule(
                        entity.getNextReview(),
                        entity.getLastReviewed(),
                        entity.getTotalReviews(),
                        entity.getConsecutiveCorrect()),
                new SpacedRepetitionItem.Performance(
                        entity.getAverageAccuracy(),
                        entity.getAverageTimeMs(),
                        entity.getDifficultyRating(),
                        entity.getLastGrade()),
                new SpacedRepetitionItem.Metadata(
                        entity.getIntroducedAt(),
                        Boolean.TRUE.equals(entity.getGraduated()),
                        entity.getLapseCount()),
                entity.getVersion(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    public SpacedRepetitionItemEntity toNewEntity(SpacedRepetitionItem item) {
        SpacedRepetitionItemEntity entity = new SpacedRepetitionItemEntity();
        entity.setLearnerId(item.learnerId());
        entity.setTaskId(item.taskId());
        entity.setIntroducedAt(item.metadata().introduced());
        entity.setCreatedAt(item.createdAt());
        applyState(entity, item);
        return entity;
    }

    /**
     * Copies the mutable scheduling state onto an existing row. Identity, owner and version are left alone.
     */
    public void applyState(SpacedRepetitionItemEntity entity, SpacedRepetitionItem item) {
        entity.setIntervalDays(item.algorithm().interval());
        entity.setRepetitionCount(item.algorithm().repetition());
        entity.setEaseFactor(item.algorithm().efactor());
        entity.setNextReview(item.schedule().nextReview());
        entity.setLastReviewed(item.schedule().lastReviewed());
        entity.setTotalReviews(item.schedule().totalReviews());
        entity.setConsecutiveCorrect(item.schedule().consecutiveCorrect());
        entity.setAverageAccuracy(item.performance().averageAccuracy());
        entity.setAverageTimeMs(item.performance().averageTime());
        entity.setDifficultyRating(item.performance().difficultyRating());
        entity.setLastGrade(item.performance().lastGrade());
        entity.setGraduated(item.metadata().graduated());
        entity.setLapseCount(item.metadata().lapseCount());
        entity.setUpdatedAt(item.updatedAt());
    }
}

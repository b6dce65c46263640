package uk.gegc.linguapractice.features.repetition.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.repetition.domain.model.RepetitionStatistics;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.repetition.domain.repository.SpacedRepetitionItemRepository;
import uk.gegc.linguapractice.features.repetition.infra.mapping.SpacedRepetitionItemMapper;
import uk.gegc.linguapractice.shared.exception.ResourceNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Transactional
public class JpaSpacedRepetitionItemRepository implements SpacedRepetitionItemRepository {

    private final SpacedRepetitionItemJpaRepository jpaRepository;
    private final SpacedRepetitionItemMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<SpacedRepetitionItem> findByTaskId(UUID learnerId, UUID taskId) {
        return jpaRepository.findByLearnerIdAndTaskId(learnerId, taskId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<SpacedRepetitionItem> findDue(UUID learnerId, Instant now) {
        return jpaRepository.findByLearnerIdAndNextReviewLessThanEqual(learnerId, now).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SpacedRepetitionItem> findByNextReviewBetween(UUID learnerId, Instant from, Instant to) {
        return jpaRepository.findByLearnerIdAndNextReviewBetween(learnerId, from, to).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    public SpacedRepetitionItem create(SpacedRepetitionItem item) {
        SpacedRepetitionItemEntity saved = jpaRepository.saveAndFlush(mapper.toNewEntity(item));
        return mapper.toDomain(saved);
    }

    @Override
    public SpacedRepetitionItem update(SpacedRepetitionItem item) {
        SpacedRepetitionItemEntity entity = loadEntity(item.id());
        if (!Objects.equals(entity.getVersion(), item.version())) {
            throw new ObjectOptimisticLockingFailureException(SpacedRepetitionItemEntity.class, item.id());
        }
        mapper.applyState(entity, item);
        return mapper.toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    public SpacedRepetitionItem updateSchedule(UUID itemId, Instant nextReview) {
        SpacedRepetitionItemEntity entity = loadEntity(itemId);
        entity.setNextReview(nextReview);
        return mapper.toDomain(jpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional(readOnly = true)
    public RepetitionStatistics statistics(UUID learnerId, Instant now) {
        RepetitionStatisticsProjection row = jpaRepository.aggregateStatistics(learnerId, now);
        if (row == null || row.getTotalItems() == null || row.getTotalItems() == 0) {
            return RepetitionStatistics.empty();
        }
        return new RepetitionStatistics(
                row.getTotalItems(),
                valueOrZero(row.getDueNow()),
                valueOrZero(row.getGraduated()),
                row.getAverageInterval() == null ? 0 : row.getAverageInterval(),
                row.getAverageAccuracy() == null ? 0 : row.getAverageAccuracy()
        );
    }

    private SpacedRepetitionItemEntity loadEntity(UUID itemId) {
        return jpaRepository.findById(itemId)
                .orElseThrow(() -> ResourceNotFoundException.of("SpacedRepetitionItem", itemId));
    }

    private static long valueOrZero(Long value) {
        return value == null ? 0 : value;
    }
}

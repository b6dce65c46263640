package uk.gegc.linguapractice.features.answer.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;
import uk.gegc.linguapractice.features.answer.domain.repository.AnswerRecordRepository;
import uk.gegc.linguapractice.features.answer.infra.mapping.AnswerRecordMapper;

import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JpaAnswerRecordRepository implements AnswerRecordRepository {

    private final AnswerRecordJpaRepository jpaRepository;
    private final AnswerRecordMapper mapper;

    @Override
    @Transactional
    public AnswerRecord append(AnswerRecord record) {
        AnswerRecordEntity saved = jpaRepository.save(mapper.toEntity(record));
        return record.withId(saved.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AnswerRecord> findBySessionId(UUID sessionId) {
        return jpaRepository.findBySessionIdOrderByAnsweredAtAsc(sessionId).stream()
                .map(mapper::toDomain)
                .toList();
    }
}

package uk.gegc.linguapractice.features.answer.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AnswerRecordJpaRepository extends JpaRepository<AnswerRecordEntity, UUID> {

    List<AnswerRecordEntity> findBySessionIdOrderByAnsweredAtAsc(UUID sessionId);
}

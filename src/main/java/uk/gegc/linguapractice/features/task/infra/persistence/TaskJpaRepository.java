package uk.gegc.linguapractice.features.task.infra.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.linguapractice.features.task.domain.model.TaskDifficulty;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface TaskJpaRepository extends JpaRepository<TaskEntity, UUID> {

    @Query("""
            SELECT t.id FROM TaskEntity t
            WHERE t.learningPathId IN :learningPathIds
              AND (:difficulty IS NULL OR t.difficulty = :difficulty)
            """)
    List<UUID> findCandidateIds(@Param("learningPathIds") Collection<UUID> learningPathIds,
                                @Param("difficulty") TaskDifficulty difficulty);
}

package uk.gegc.linguapractice.features.answer.infra.persistence;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.linguapractice.features.answer.domain.model.DeviceType;
import uk.gegc.linguapractice.shared.persistence.StringListConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(name = "answer_record", indexes = @Index(name = "idx_answer_record_session", columnList = "session_id, answered_at"))
public class AnswerRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "learner_id", nullable = false, updatable = false)
    private UUID learnerId;

    @Column(name = "task_id", nullable = false, updatable = false)
    private UUID taskId;

    @Convert(converter = StringListConverter.class)
    @Column(name = "user_answer", length = 4000, updatable = false)
    private List<String> userAnswer = new ArrayList<>();

    @Column(name = "is_correct", nullable = false, updatable = false)
    private Boolean correct;

    @Column(name = "time_spent", nullable = false, updatable = false)
    private Integer timeSpent;

    @Column(name = "confidence", nullable = false, updatable = false)
    private Integer confidence;

    @Column(name = "grade", nullable = false, updatable = false)
    private Integer grade;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private Integer attemptNumber;

    @Column(name = "hints_used", nullable = false, updatable = false)
    private Integer hintsUsed;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_type", length = 10, updatable = false)
    private DeviceType deviceType;

    @Column(name = "client_info", length = 500, updatable = false)
    private String clientInfo;

    @Column(name = "answered_at", nullable = false, updatable = false)
    private Instant answeredAt;
}

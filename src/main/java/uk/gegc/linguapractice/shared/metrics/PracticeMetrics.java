package uk.gegc.linguapractice.shared.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for practice activity.
 */
@Slf4j
@Component
public class PracticeMetrics {

    private final Counter answersRecordedCounter;
    private final Counter lapsesCounter;
    private final Counter sessionsCreatedCounter;
    private final Counter sessionsCompletedCounter;
    private final Counter sessionsAbandonedCounter;
    private final Counter writeRetriesCounter;

    public PracticeMetrics(MeterRegistry meterRegistry) {
        this.answersRecordedCounter = Counter.builder("practice.answers.recorded")
                .description("Number of answers recorded")
                .register(meterRegistry);
        this.lapsesCounter = Counter.builder("practice.repetition.lapses")
                .description("Number of answers graded as a lapse")
                .register(meterRegistry);
        this.sessionsCreatedCounter = Counter.builder("practice.sessions.created")
                .description("Number of practice sessions created")
                .register(meterRegistry);
        this.sessionsCompletedCounter = Counter.builder("practice.sessions.completed")
                .description("Number of practice sessions completed")
                .register(meterRegistry);
        this.sessionsAbandonedCounter = Counter.builder("practice.sessions.abandoned")
                .description("Number of practice sessions abandoned")
                .register(meterRegistry);
        this.writeRetriesCounter = Counter.builder("practice.writes.retried")
                .description("Number of write units retried after a conflicting concurrent update")
                .register(meterRegistry);
    }

    public void incrementAnswerRecorded(boolean lapse) {
        answersRecordedCounter.increment();
        if (lapse) {
            lapsesCounter.increment();
        }
    }

    public void incrementSessionCreated() {
        sessionsCreatedCounter.increment();
    }

    public void incrementSessionCompleted() {
        sessionsCompletedCounter.increment();
    }

    public void incrementSessionAbandoned() {
        sessionsAbandonedCounter.increment();
    }

    public void incrementWriteRetry(String operation) {
        writeRetriesCounter.increment();
        log.debug("Write retry recorded for {}", operation);
    }
}

package uk.gegc.linguapractice.shared.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.shared.config.PracticeProperties;
import uk.gegc.linguapractice.shared.metrics.PracticeMetrics;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Re-runs a transactional unit of work when it lost a race against a concurrent writer.
 * <p>
 * Version conflicts, lock failures such as deadlocks, and duplicate-key violations are
 * retried; every other exception propagates on the first failure. The action must open its
 * own transaction so that each attempt starts from fresh reads.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConflictRetryExecutor {

    private final PracticeProperties properties;
    private final PracticeMetrics metrics;

    public <T> T execute(String operation, Supplier<T> action) {
        int maxRetries = properties.getMaxWriteRetries();
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                if (attempt == maxRetries - 1) throw e;
                onConflict(operation, attempt + 1, e);
            } catch (DataIntegrityViolationException e) {
                if (!isDuplicateKey(e) || attempt == maxRetries - 1) throw e;
                onConflict(operation, attempt + 1, e);
            }
        }
        throw new IllegalStateException("Retry loop exhausted unexpectedly");
    }

    private void onConflict(String operation, int attempt, RuntimeException conflict) {
        log.warn("Concurrent write conflict in {} (attempt {}): {}", operation, attempt, conflict.getMessage());
        metrics.incrementWriteRetry(operation);
        sleepBackoff(operation, attempt, conflict);
    }

    // an interrupted wait gives up and surfaces the conflict that triggered it
    private void sleepBackoff(String operation, int attempt, RuntimeException conflict) {
        try {
            Thread.sleep(properties.getRetryBackoffMs() * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Retry of {} interrupted after attempt {}", operation, attempt);
            throw conflict;
        }
    }

    static boolean isDuplicateKey(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        String message = e.getMostSpecificCause().getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("duplicate") || normalized.contains("unique");
    }
}

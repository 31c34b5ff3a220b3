package email.labeler.app.remote;

import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Retry with exponential random backoff for remote mail API calls. How often a failure is
 * retried depends on its {@link ErrorKind}: transient failures up to {@code retry.transient-retries}
 * times, conflicts up to {@code retry.conflict-retries} times, not-found and unexpected
 * failures never. Errors never escape {@link #execute}; they come back as a failed
 * {@link RemoteResult}.
 */
@Slf4j
@Component
public class RetryPolicy {
    private final RemoteErrorClassifier errorClassifier;
    private final Map<ErrorKind, Integer> maxRetries = new EnumMap<>(ErrorKind.class);
    private final IntervalFunction backoff;

    @Autowired
    public RetryPolicy(RemoteErrorClassifier errorClassifier,
                       @Value("${retry.transient-retries:3}") int transientRetries,
                       @Value("${retry.conflict-retries:2}") int conflictRetries,
                       @Value("${retry.base-delay-ms:500}") long baseDelayMs) {
        this(errorClassifier, transientRetries, conflictRetries,
                IntervalFunction.ofExponentialRandomBackoff(Duration.ofMillis(baseDelayMs), 2.0, 0.5));
    }

    public RetryPolicy(RemoteErrorClassifier errorClassifier, int transientRetries, int conflictRetries,
                       IntervalFunction backoff) {
        this.errorClassifier = errorClassifier;
        this.backoff = backoff;
        maxRetries.put(ErrorKind.TRANSIENT, transientRetries);
        maxRetries.put(ErrorKind.CONFLICT, conflictRetries);
        maxRetries.put(ErrorKind.NOT_FOUND, 0);
        maxRetries.put(ErrorKind.UNEXPECTED, 0);
    }

    public <T> RemoteResult<T> execute(String operation, Callable<T> call) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return RemoteResult.success(call.call(), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RemoteResult.failure(ErrorKind.UNEXPECTED, e, attempt);
            } catch (Exception e) {
                ErrorKind kind = errorClassifier.classify(e);
                if (attempt > maxRetries.get(kind)) {
                    if (maxRetries.get(kind) > 0) {
                        log.warn("{} failed after {} attempts ({}): {}", operation, attempt, kind, e.getMessage());
                    } else {
                        log.debug("{} failed ({}), not retried: {}", operation, kind, e.getMessage());
                    }
                    return RemoteResult.failure(kind, e, attempt);
                }
                long delayMs = backoff.apply(attempt);
                log.debug("{} failed ({}), retrying in {} ms (attempt {})", operation, kind, delayMs, attempt);
                if (!sleep(delayMs)) {
                    log.warn("{} retry interrupted", operation);
                    return RemoteResult.failure(kind, e, attempt);
                }
            }
        }
    }

    private static boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

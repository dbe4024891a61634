package tech.idmirror.platform.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Re-runs a unit of work when it fails with a write conflict.
 *
 * <p>Each attempt must be self-contained (typically one {@link TransactionRunner} call), so a
 * conflicting attempt rolls back alone and the next one starts from a clean transaction.
 * Errors that are not conflicts propagate immediately. When every attempt conflicts, a
 * {@link DatabaseException} wrapping the last conflict is thrown.
 */
@ApplicationScoped
public class ConflictRetry {

    private static final Logger LOG = Logger.getLogger(ConflictRetry.class);

    private final int maxAttempts;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    @Inject
    public ConflictRetry(SyncConfig config) {
        this(config.maxAttempts(), BackoffPolicy.exponential(config.baseBackoff()), Sleeper.THREAD);
    }

    public ConflictRetry(int maxAttempts, BackoffPolicy backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public static <T> T retryOnConflict(Supplier<T> attempt, int maxAttempts, BackoffPolicy backoff) {
        return new ConflictRetry(maxAttempts, backoff, Sleeper.THREAD).execute("operation", attempt);
    }

    public <T> T execute(String operation, Supplier<T> attempt) {
        return execute(operation, attempt, conflict -> {
        });
    }

    /**
     * @param onConflict invoked with every conflict, including the last one
     */
    public <T> T execute(String operation, Supplier<T> attempt, Consumer<RuntimeException> onConflict) {
        RuntimeException lastConflict = null;

        for (int i = 0; i < maxAttempts; i++) {
            try {
                return attempt.get();
            } catch (RuntimeException e) {
                if (!ConflictDetector.isConflict(e)) {
                    throw e;
                }
                lastConflict = e;
                onConflict.accept(e);

                if (i + 1 < maxAttempts) {
                    Duration delay = backoff.delayFor(i);
                    LOG.warnf("Write conflict on %s (attempt %d/%d), retrying in %dms",
                        operation, i + 1, maxAttempts, delay.toMillis());
                    pause(operation, delay, e);
                }
            }
        }

        LOG.errorf(lastConflict, "Write conflict on %s persisted after %d attempts", operation, maxAttempts);
        throw new DatabaseException(
            "Database conflict on " + operation + " after " + maxAttempts + " attempts",
            Map.of("operation", operation, "attempts", maxAttempts),
            lastConflict);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void pause(String operation, Duration delay, RuntimeException conflict) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DatabaseException("Interrupted while retrying " + operation,
                Map.of("operation", operation), conflict);
        }
    }
}

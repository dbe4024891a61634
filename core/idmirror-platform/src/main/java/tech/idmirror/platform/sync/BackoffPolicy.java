package tech.idmirror.platform.sync;

import java.time.Duration;

/**
 * Delay before the next attempt, given the zero-based number of the attempt that just failed.
 */
@FunctionalInterface
public interface BackoffPolicy {

    Duration delayFor(int failedAttempt);

    /**
     * {@code base * 2^failedAttempt}: 100ms, 200ms, 400ms... for a 100ms base.
     */
    static BackoffPolicy exponential(Duration base) {
        return failedAttempt -> base.multipliedBy(1L << Math.min(failedAttempt, 20));
    }

    static BackoffPolicy none() {
        return failedAttempt -> Duration.ZERO;
    }
}

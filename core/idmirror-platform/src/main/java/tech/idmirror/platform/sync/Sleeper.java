package tech.idmirror.platform.sync;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}

package tech.idmirror.platform.resilience;

import tech.idmirror.platform.common.errors.ErrorKind;
import tech.idmirror.platform.common.errors.IdMirrorException;

import java.time.Duration;
import java.util.Map;

/**
 * Thrown instead of invoking an operation while its dependency's circuit is open
 * (or while the single half-open probe is still in flight).
 *
 * <p>Callers should treat this as "service temporarily degraded" and may pass
 * {@link #retryAfter()} on to their own clients.
 */
public class CircuitOpenException extends IdMirrorException {

    private final String dependencyName;
    private final Duration retryAfter;

    public CircuitOpenException(String dependencyName, Duration retryAfter) {
        super(ErrorKind.CIRCUIT_OPEN,
            "Circuit breaker open: " + dependencyName,
            Map.of("dependency", dependencyName, "retryAfterSeconds", retryAfter.toSeconds()));
        this.dependencyName = dependencyName;
        this.retryAfter = retryAfter;
    }

    public String dependencyName() {
        return dependencyName;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}

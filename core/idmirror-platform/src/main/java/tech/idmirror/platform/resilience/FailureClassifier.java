package tech.idmirror.platform.resilience;

import tech.idmirror.platform.common.errors.IdMirrorException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Decides which exceptions count as failures for a circuit breaker.
 *
 * <p>Network errors, timeouts and 5xx answers count. Client errors (not found,
 * validation, permission denied) do not; they pass through the breaker untouched.
 */
public final class FailureClassifier {

    /**
     * Default predicate used by {@link CircuitBreakerRegistry}.
     */
    public static final Predicate<Throwable> DEFAULT = FailureClassifier::isBreakerFailure;

    private FailureClassifier() {
    }

    /**
     * Walks the cause chain: the first {@link IdMirrorException} decides by its kind,
     * otherwise any I/O error or timeout in the chain counts.
     */
    public static boolean isBreakerFailure(Throwable error) {
        Map<Throwable, Boolean> seen = new IdentityHashMap<>();
        Throwable current = error;
        while (current != null && seen.put(current, Boolean.TRUE) == null) {
            if (current instanceof IdMirrorException) {
                return ((IdMirrorException) current).kind().countsAsBreakerFailure();
            }
            if (current instanceof IOException
                    || current instanceof UncheckedIOException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

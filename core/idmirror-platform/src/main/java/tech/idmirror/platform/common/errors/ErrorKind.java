package tech.idmirror.platform.common.errors;

/**
 * Error category carried by every {@link IdMirrorException}.
 *
 * <p>The kind decides two things: whether the failure counts toward a circuit
 * breaker's failure threshold, and (through {@link ErrorStatusTable}) which HTTP
 * status a route handler should answer with.
 */
public enum ErrorKind {

    /** Network error, timeout or 5xx from the identity provider. */
    TRANSIENT_PROVIDER(true),

    NOT_FOUND(false),
    VALIDATION(false),
    UNAUTHORIZED(false),
    FORBIDDEN(false),
    CONFLICT(false),
    RATE_LIMITED(false),

    /** Any other 4xx answer from the identity provider. */
    PERMANENT_PROVIDER(false),

    /** Call rejected because the dependency's breaker is open. */
    CIRCUIT_OPEN(false),

    /** Uniqueness or serialization conflict; retried internally by the sync engine. */
    DATABASE_CONFLICT(false),

    /** Database failure surfaced to the caller, e.g. after exhausting conflict retries. */
    DATABASE(false),

    /** Cache backend failure. Never escapes the cache layer. */
    CACHE(false);

    private final boolean breakerFailure;

    ErrorKind(boolean breakerFailure) {
        this.breakerFailure = breakerFailure;
    }

    /**
     * Whether an error of this kind counts toward a circuit breaker's failure threshold.
     */
    public boolean countsAsBreakerFailure() {
        return breakerFailure;
    }
}

package tech.idmirror.platform.audit;

/**
 * A remote audit event could not be coerced into the canonical shape. The event is
 * skipped; the rest of the page is still ingested.
 */
public class AuditNormalizationException extends RuntimeException {

    public AuditNormalizationException(String message) {
        super(message);
    }

    public AuditNormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}

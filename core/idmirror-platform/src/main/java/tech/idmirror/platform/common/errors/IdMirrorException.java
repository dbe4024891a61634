package tech.idmirror.platform.common.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for every failure raised by the mirror core.
 *
 * <p>Carries an explicit {@link ErrorKind} tag and a details map. Details are meant
 * for logs and debug responses, never for end users.
 */
public class IdMirrorException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public IdMirrorException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public IdMirrorException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public IdMirrorException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
            : Map.of();
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    public int httpStatus() {
        return ErrorStatusTable.statusFor(kind);
    }
}

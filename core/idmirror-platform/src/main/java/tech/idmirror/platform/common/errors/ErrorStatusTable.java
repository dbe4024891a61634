package tech.idmirror.platform.common.errors;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Single lookup table from {@link ErrorKind} to HTTP status code.
 *
 * <p>Route handlers map any {@link IdMirrorException} with
 * {@code ErrorStatusTable.statusFor(e.kind())} instead of testing exception subclasses.
 */
public final class ErrorStatusTable {

    private static final Map<ErrorKind, Integer> STATUS_BY_KIND;

    static {
        EnumMap<ErrorKind, Integer> table = new EnumMap<>(ErrorKind.class);
        table.put(ErrorKind.TRANSIENT_PROVIDER, 503);
        table.put(ErrorKind.NOT_FOUND, 404);
        table.put(ErrorKind.VALIDATION, 400);
        table.put(ErrorKind.UNAUTHORIZED, 401);
        table.put(ErrorKind.FORBIDDEN, 403);
        table.put(ErrorKind.CONFLICT, 409);
        table.put(ErrorKind.RATE_LIMITED, 429);
        table.put(ErrorKind.PERMANENT_PROVIDER, 502);
        table.put(ErrorKind.CIRCUIT_OPEN, 503);
        table.put(ErrorKind.DATABASE_CONFLICT, 409);
        table.put(ErrorKind.DATABASE, 500);
        table.put(ErrorKind.CACHE, 500);
        STATUS_BY_KIND = Collections.unmodifiableMap(table);
    }

    private ErrorStatusTable() {
    }

    /**
     * HTTP status for an error kind. Unknown (null) kinds map to 500.
     */
    public static int statusFor(ErrorKind kind) {
        if (kind == null) {
            return 500;
        }
        return STATUS_BY_KIND.getOrDefault(kind, 500);
    }

    public static Map<ErrorKind, Integer> asMap() {
        return STATUS_BY_KIND;
    }
}

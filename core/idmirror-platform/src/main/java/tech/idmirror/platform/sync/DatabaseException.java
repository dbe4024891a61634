package tech.idmirror.platform.sync;

import tech.idmirror.platform.common.errors.ErrorKind;
import tech.idmirror.platform.common.errors.IdMirrorException;

import java.util.Map;

/**
 * Database failure surfaced to the caller, for example after conflict retries ran out.
 */
public class DatabaseException extends IdMirrorException {

    public DatabaseException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorKind.DATABASE, message, details, cause);
    }
}

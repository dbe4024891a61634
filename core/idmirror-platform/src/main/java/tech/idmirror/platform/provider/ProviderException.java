package tech.idmirror.platform.provider;

import tech.idmirror.platform.common.errors.ErrorKind;
import tech.idmirror.platform.common.errors.IdMirrorException;

import java.util.Map;

/**
 * Failure talking to the identity provider.
 *
 * <p>Subclasses tell network errors, timeouts and HTTP error answers apart; the
 * {@link ErrorKind} they carry decides whether the circuit breaker counts them.
 */
public abstract class ProviderException extends IdMirrorException {

    protected ProviderException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(kind, message, details, cause);
    }

    /**
     * Whether this failure is transient (network, timeout, 5xx).
     */
    public boolean isTransient() {
        return kind() == ErrorKind.TRANSIENT_PROVIDER;
    }
}

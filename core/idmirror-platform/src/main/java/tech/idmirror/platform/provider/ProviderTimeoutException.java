package tech.idmirror.platform.provider;

import tech.idmirror.platform.common.errors.ErrorKind;

import java.time.Duration;
import java.util.Map;

/**
 * The identity provider did not answer within the configured request timeout.
 */
public class ProviderTimeoutException extends ProviderException {

    private final Duration timeout;

    public ProviderTimeoutException(String message, Duration timeout, Throwable cause) {
        super(ErrorKind.TRANSIENT_PROVIDER, message,
            Map.of("timeoutMs", timeout != null ? timeout.toMillis() : 0L), cause);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}

package tech.idmirror.platform.provider;

import tech.idmirror.platform.common.errors.ErrorKind;

import java.util.Map;

/**
 * Connection refused, reset, DNS failure or any other I/O error before an answer arrived.
 */
public class ProviderNetworkException extends ProviderException {

    public ProviderNetworkException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_PROVIDER, message, Map.of(), cause);
    }
}

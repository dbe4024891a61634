package tech.idmirror.platform.provider;

import tech.idmirror.platform.common.errors.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The identity provider answered with an HTTP error status.
 *
 * <p>5xx answers are transient; 4xx answers are permanent and map to the
 * closest client-facing kind.
 */
public class ProviderHttpException extends ProviderException {

    private final int statusCode;

    public ProviderHttpException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public ProviderHttpException(int statusCode, String message, String responseBody) {
        super(kindFor(statusCode), message, details(statusCode, responseBody), null);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    static ErrorKind kindFor(int statusCode) {
        if (statusCode >= 500) {
            return ErrorKind.TRANSIENT_PROVIDER;
        }
        switch (statusCode) {
            case 400:
            case 422:
                return ErrorKind.VALIDATION;
            case 401:
                return ErrorKind.UNAUTHORIZED;
            case 403:
                return ErrorKind.FORBIDDEN;
            case 404:
                return ErrorKind.NOT_FOUND;
            case 409:
                return ErrorKind.CONFLICT;
            case 429:
                return ErrorKind.RATE_LIMITED;
            default:
                return ErrorKind.PERMANENT_PROVIDER;
        }
    }

    private static Map<String, Object> details(int statusCode, String responseBody) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("statusCode", statusCode);
        if (responseBody != null && !responseBody.isBlank()) {
            details.put("body", responseBody.length() > 500 ? responseBody.substring(0, 500) : responseBody);
        }
        return details;
    }
}

package com.fxanalytics.exception;

import java.util.Map;

/**
 * A provider failure that may succeed on a later attempt: timeouts, refused or reset
 * connections, DNS failures, "service busy" replies. Absorbed by the retry loop up to
 * the configured attempt budget.
 */
public class TransientProviderException extends BaseException {

    public TransientProviderException(String message) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, message, cause);
    }

    public TransientProviderException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, message, details, cause);
    }
}

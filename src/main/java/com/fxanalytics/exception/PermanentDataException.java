package com.fxanalytics.exception;

import java.util.Map;

/**
 * Bad ticker, malformed provider response, or any other data failure that a retry
 * cannot fix. Never retried; propagated to the caller untouched.
 */
public class PermanentDataException extends BaseException {

    public PermanentDataException(String message) {
        super(ErrorCode.DATA_ERROR, message);
    }

    public PermanentDataException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_ERROR, message, details);
    }

    public PermanentDataException(String message, Throwable cause) {
        super(ErrorCode.DATA_ERROR, message, cause);
    }
}

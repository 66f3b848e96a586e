package com.fxanalytics.exception;

import java.util.Map;

/**
 * Invalid inputs to a numerical routine (non-positive spot, strike, vol or expiry, empty
 * surface). A caller bug, so it is never retried.
 */
public class DomainException extends BaseException {

    public DomainException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public DomainException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}

package com.fxanalytics.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the unchecked exception hierarchy. Each subclass pins an {@link ErrorCode} so the
 * HTTP layer and the resilience layer can classify failures without string matching.
 *
 * <p>{@code details} is rendered into the error envelope as is: field names for validation
 * failures, {@code currencyPair}/{@code tenor} for data problems, {@code attempts} and
 * {@code retryAfterMs} for provider outages.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    /** True for failures on our side or the provider's, as opposed to a bad request. */
    public boolean isServerSide() {
        return errorCode.getHttpStatus() >= 500;
    }
}

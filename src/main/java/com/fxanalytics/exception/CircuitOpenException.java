package com.fxanalytics.exception;

import java.util.Map;
import lombok.Getter;

/** Thrown instead of calling the provider while its circuit breaker is open. */
@Getter
public class CircuitOpenException extends BaseException {

    private final long retryAfterMs;

    public CircuitOpenException(String breakerName, long retryAfterMs) {
        super(
                ErrorCode.PROVIDER_UNAVAILABLE,
                "Circuit breaker is open - service unavailable",
                Map.of("breaker", breakerName, "retryAfterMs", retryAfterMs));
        this.retryAfterMs = retryAfterMs;
    }
}

package com.fxanalytics.resilience;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Builder;
import lombok.Value;

/**
 * Retry budget for one provider operation. {@code maxRetries} is the total number of
 * attempts, not the number of retries after the first.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    long initialDelayMs = 1000;

    @Builder.Default
    long maxDelayMs = 10000;

    @Builder.Default
    double backoffMultiplier = 2.0;

    @Builder.Default
    long timeoutMs = 30000;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /** Attempts actually made; at least one. */
    public int attemptLimit() {
        return Math.max(1, maxRetries);
    }

    /**
     * Wait before the attempt following {@code failedAttempt} (1-based):
     * {@code min(initialDelayMs * backoffMultiplier^(failedAttempt-1), maxDelayMs)}.
     */
    public long delayAfterAttempt(int failedAttempt) {
        return intervalFunction().apply(failedAttempt);
    }

    IntervalFunction intervalFunction() {
        long initial = Math.max(1, initialDelayMs);
        return IntervalFunction.ofExponentialBackoff(
                initial, Math.max(1.0, backoffMultiplier), Math.max(initial, maxDelayMs));
    }
}

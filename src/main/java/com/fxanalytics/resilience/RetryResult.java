package com.fxanalytics.resilience;

import com.fxanalytics.exception.PermanentDataException;
import com.fxanalytics.exception.TransientProviderException;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a retried operation. Failures are returned, not thrown, together with the
 * number of attempts made and the elapsed time.
 */
@Value
@Builder
public class RetryResult<T> {

    boolean success;
    T data;
    Throwable error;
    int attempts;
    long durationMs;

    public static <T> RetryResult<T> success(T data, int attempts, long durationMs) {
        return RetryResult.<T>builder()
                .success(true)
                .data(data)
                .attempts(attempts)
                .durationMs(durationMs)
                .build();
    }

    public static <T> RetryResult<T> failure(Throwable error, int attempts, long durationMs) {
        return RetryResult.<T>builder()
                .success(false)
                .error(error)
                .attempts(attempts)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Returns the data, or throws the terminal failure. An exhausted transient failure
     * surfaces as {@link TransientProviderException} with attempt and duration details;
     * unchecked errors propagate unchanged; other checked errors become
     * {@link PermanentDataException}.
     */
    public T getOrThrow() {
        if (success) {
            return data;
        }
        if (ProviderErrors.isRetryable(error)) {
            throw new TransientProviderException(
                    "Provider call failed after " + attempts + " attempts: " + error.getMessage(),
                    Map.of("attempts", attempts, "durationMs", durationMs),
                    error);
        }
        if (error instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        throw new PermanentDataException("Provider call failed: " + error.getMessage(), error);
    }
}

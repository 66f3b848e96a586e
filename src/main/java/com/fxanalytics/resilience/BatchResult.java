package com.fxanalytics.resilience;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of {@link ResilientExecutor#batchWithRecovery}. {@code successful} and
 * {@code failed} are disjoint and together hold every input item. {@code batchErrors}
 * maps a batch's index to the error that failed it as a whole, even when some of its
 * items later recovered individually.
 */
@Value
@Builder
public class BatchResult<T, R> {

    List<T> successful;
    List<T> failed;
    List<R> results;
    Map<Integer, Throwable> batchErrors;

    public boolean isFullySuccessful() {
        return failed.isEmpty();
    }
}

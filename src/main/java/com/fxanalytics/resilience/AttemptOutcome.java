package com.fxanalytics.resilience;

/** Result classification of a single attempt inside {@link ResilientExecutor#withRetry}. */
public enum AttemptOutcome {
    SUCCESS,
    RETRYABLE_FAILURE,
    FATAL_FAILURE
}

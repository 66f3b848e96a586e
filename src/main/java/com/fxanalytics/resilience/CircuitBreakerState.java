package com.fxanalytics.resilience;

import com.fxanalytics.domain.enums.CircuitState;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view of a {@link ProviderCircuitBreaker}, for dashboards. */
@Value
@Builder
public class CircuitBreakerState {

    String name;
    CircuitState state;
    int failureCount;
    Instant lastFailureTime;
    int threshold;
    long cooldownMs;
}

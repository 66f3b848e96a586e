package com.fxanalytics.resilience;

import com.fxanalytics.domain.enums.CircuitState;
import com.fxanalytics.exception.CircuitOpenException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-fast guard around the market-data provider.
 *
 * <p>State machine:
 * <ul>
 *   <li><b>CLOSED</b>: calls pass through; {@code threshold} consecutive failures open it
 *   <li><b>OPEN</b>: calls fail immediately with {@link CircuitOpenException} without
 *       running the operation, until {@code cooldownMs} has elapsed
 *   <li><b>HALF_OPEN</b>: the first call after the cooldown is a trial; success closes
 *       the breaker, failure reopens it and restarts the cooldown
 * </ul>
 *
 * <p>Backed by a Resilience4j count-based breaker whose window equals the threshold and
 * trips only at a 100% failure rate, which makes "all of the last N calls failed" the
 * opening condition. Instances are independent; the host owns the shared one as a bean.
 * Safe for concurrent use.
 */
public class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    private final String name;
    private final int threshold;
    private final long cooldownMs;
    private final CircuitBreaker circuitBreaker;
    private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public ProviderCircuitBreaker(String name, int threshold, long cooldownMs) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Circuit breaker threshold must be >= 1, got " + threshold);
        }
        this.name = name;
        this.threshold = threshold;
        this.cooldownMs = cooldownMs;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(Duration.ofMillis(Math.max(1, cooldownMs)))
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.circuitBreaker = CircuitBreaker.of(name, config);

        circuitBreaker
                .getEventPublisher()
                .onError(event -> {
                    lastFailureTime.set(event.getCreationTime().toInstant());
                    consecutiveFailures.incrementAndGet();
                })
                .onSuccess(event -> consecutiveFailures.set(0))
                .onStateTransition(event -> logTransition(event.getStateTransition()));
    }

    /**
     * Runs the operation through the breaker.
     *
     * @throws CircuitOpenException if the breaker is open and the cooldown has not elapsed
     * @throws Exception whatever the operation throws; the failure is recorded first
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        try {
            return circuitBreaker.executeCallable(operation);
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(name, remainingCooldownMs());
        }
    }

    /**
     * Snapshot for dashboards. {@code failureCount} is the current run of consecutive
     * failures; any success sets it back to zero, and fail-fast rejections do not add to it.
     */
    public CircuitBreakerState getState() {
        return CircuitBreakerState.builder()
                .name(name)
                .state(currentState())
                .failureCount(consecutiveFailures.get())
                .lastFailureTime(lastFailureTime.get())
                .threshold(threshold)
                .cooldownMs(cooldownMs)
                .build();
    }

    public CircuitState currentState() {
        return switch (circuitBreaker.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    /** Returns the breaker to CLOSED with an empty failure window. */
    public void reset() {
        circuitBreaker.reset();
        lastFailureTime.set(null);
        consecutiveFailures.set(0);
    }

    public String getName() {
        return name;
    }

    private long remainingCooldownMs() {
        Instant lastFailure = lastFailureTime.get();
        if (lastFailure == null) {
            return cooldownMs;
        }
        long elapsed = Duration.between(lastFailure, Instant.now()).toMillis();
        return Math.max(0, cooldownMs - elapsed);
    }

    private void logTransition(CircuitBreaker.StateTransition transition) {
        switch (transition.getToState()) {
            case OPEN -> log.warn(
                    "Circuit breaker '{}' opened after {} consecutive failures ({} -> {})",
                    name,
                    threshold,
                    transition.getFromState(),
                    transition.getToState());
            case CLOSED -> log.info("Circuit breaker '{}' reset ({} -> CLOSED)", name, transition.getFromState());
            default -> log.info(
                    "Circuit breaker '{}' {} -> {}", name, transition.getFromState(), transition.getToState());
        }
    }
}

package com.fxanalytics.unit.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fxanalytics.domain.enums.CircuitState;
import com.fxanalytics.exception.CircuitOpenException;
import com.fxanalytics.resilience.CircuitBreakerState;
import com.fxanalytics.resilience.ProviderCircuitBreaker;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * State-machine tests for ProviderCircuitBreaker: CLOSED -> OPEN after the threshold,
 * fail-fast while open, HALF_OPEN trial after the cooldown.
 */
class ProviderCircuitBreakerTest {

    private static final int THRESHOLD = 5;
    private static final long COOLDOWN_MS = 100;

    private ProviderCircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        breaker = new ProviderCircuitBreaker("test", THRESHOLD, COOLDOWN_MS);
        invocations = new AtomicInteger();
    }

    private String failingCall() throws IOException {
        invocations.incrementAndGet();
        throw new IOException("ECONNREFUSED");
    }

    private String succeedingCall() {
        invocations.incrementAndGet();
        return "ok";
    }

    private void failTimes(int n) {
        for (int i = 0; i < n; i++) {
            assertThatThrownBy(() -> breaker.execute(this::failingCall)).isInstanceOf(IOException.class);
        }
    }

    @Test
    @DisplayName("Starts closed and passes calls through")
    void startsClosed() throws Exception {
        assertThat(breaker.currentState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.execute(this::succeedingCall)).isEqualTo("ok");
        assertThat(invocations).hasValue(1);
    }

    @Test
    @DisplayName("Fewer failures than the threshold keep it closed")
    void belowThreshold() {
        failTimes(THRESHOLD - 1);

        assertThat(breaker.currentState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("A success inside the window prevents opening")
    void successResetsRun() throws Exception {
        failTimes(THRESHOLD - 1);
        breaker.execute(this::succeedingCall);
        failTimes(1);

        assertThat(breaker.currentState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Threshold consecutive failures open it; the next call fails fast without running")
    void opensAndFailsFast() {
        failTimes(THRESHOLD);
        assertThat(breaker.currentState()).isEqualTo(CircuitState.OPEN);

        int before = invocations.get();
        assertThatThrownBy(() -> breaker.execute(this::succeedingCall))
                .isInstanceOf(CircuitOpenException.class)
                .hasMessage("Circuit breaker is open - service unavailable");
        assertThat(invocations).hasValue(before);
    }

    @Test
    @DisplayName("After the cooldown a successful trial call closes it")
    void halfOpenSuccessCloses() throws Exception {
        failTimes(THRESHOLD);
        Thread.sleep(COOLDOWN_MS + 50);

        assertThat(breaker.execute(this::succeedingCall)).isEqualTo("ok");
        assertThat(breaker.currentState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getState().getFailureCount()).isZero();
    }

    @Test
    @DisplayName("A failed trial call reopens it and restarts the cooldown")
    void halfOpenFailureReopens() throws Exception {
        failTimes(THRESHOLD);
        Thread.sleep(COOLDOWN_MS + 50);

        failTimes(1);
        assertThat(breaker.currentState()).isEqualTo(CircuitState.OPEN);

        int before = invocations.get();
        assertThatThrownBy(() -> breaker.execute(this::succeedingCall)).isInstanceOf(CircuitOpenException.class);
        assertThat(invocations).hasValue(before);
    }

    @Test
    @DisplayName("State snapshot reports failures, threshold and last failure time")
    void snapshot() {
        failTimes(THRESHOLD);

        CircuitBreakerState state = breaker.getState();

        assertThat(state.getName()).isEqualTo("test");
        assertThat(state.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(state.getFailureCount()).isEqualTo(THRESHOLD);
        assertThat(state.getThreshold()).isEqualTo(THRESHOLD);
        assertThat(state.getCooldownMs()).isEqualTo(COOLDOWN_MS);
        assertThat(state.getLastFailureTime()).isNotNull();
    }

    @Test
    @DisplayName("Failure count is the current consecutive run, not failures in the window")
    void failureCountIsConsecutiveRun() throws Exception {
        failTimes(2);
        breaker.execute(this::succeedingCall);
        failTimes(2);

        assertThat(breaker.getState().getFailureCount()).isEqualTo(2);
        assertThat(breaker.currentState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("Reset returns an open breaker to closed")
    void reset() throws Exception {
        failTimes(THRESHOLD);

        breaker.reset();

        assertThat(breaker.currentState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.execute(this::succeedingCall)).isEqualTo("ok");
        assertThat(breaker.getState().getLastFailureTime()).isNull();
    }

    @Test
    @DisplayName("Breakers are independent of each other")
    void independentInstances() {
        ProviderCircuitBreaker other = new ProviderCircuitBreaker("other", THRESHOLD, COOLDOWN_MS);

        failTimes(THRESHOLD);

        assertThat(other.currentState()).isEqualTo(CircuitState.CLOSED);
    }
}

package com.fxanalytics.domain.enums;

/**
 * Provider circuit breaker states.
 *
 * <p>CLOSED --(threshold consecutive failures)--> OPEN --(cooldown elapsed)--> HALF_OPEN
 * --(success)--> CLOSED. A failure in HALF_OPEN goes back to OPEN with a fresh cooldown.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

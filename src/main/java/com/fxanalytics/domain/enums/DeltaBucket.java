package com.fxanalytics.domain.enums;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Market-convention delta pillars quoted for risk reversals and butterflies.
 * {@link #label()} is the snake-case token used in field names ("25d").
 */
@Getter
@RequiredArgsConstructor
public enum DeltaBucket {
    D5(5),
    D10(10),
    D15(15),
    D25(25),
    D35(35);

    private final int delta;

    public String label() {
        return delta + "d";
    }

    public static Optional<DeltaBucket> ofDelta(int delta) {
        return Arrays.stream(values()).filter(b -> b.delta == delta).findFirst();
    }
}

package com.fxanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Premium and premium-included FX Greeks for a European vanilla.
 *
 * <p>{@code premium}, {@code intrinsicValue}, {@code timeValue} and every {@code *Notional}
 * field are scaled by the request notional. {@code premiumPercentOfSpot},
 * {@code deltaPercent} and the per-unit Greeks are not.
 */
@Value
@Builder
public class OptionResult {

    double premium;
    double premiumPercentOfSpot;

    double deltaPercent;
    double deltaNotional;

    /** Gamma x 100. */
    double gammaPer1PctSpot;

    double gammaNotional;

    /** Premium change for a 1 vol-point move. */
    double vegaPer1PctVol;

    double vegaNotional;

    /** Calendar-day decay (annual theta / 365). */
    double thetaPerDay;

    double thetaNotional;

    /** Premium change for a 1 percentage-point move in the domestic rate. */
    double rhoPer1PctRate;

    double rhoNotional;

    double forward;
    double intrinsicValue;
    double timeValue;
    double d1;
    double d2;
}

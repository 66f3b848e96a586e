package com.fxanalytics.domain.model;

import com.fxanalytics.domain.enums.OptionType;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs for one Garman-Kohlhagen valuation. Rates and vol are percentages (4.96 means
 * 4.96%), time is in years, notional is in base-currency units.
 */
@Value
@Builder
public class OptionRequest {

    double spot;
    double strike;
    double timeToExpiryYears;
    double domesticRatePct;
    double foreignRatePct;
    double volatilityPct;
    OptionType optionType;

    @Builder.Default
    double notional = 1.0;
}

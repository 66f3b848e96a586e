package com.fxanalytics.domain.model;

import com.fxanalytics.domain.enums.OptionType;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Result of {@code FxOptionPricingService.price}: the valuation plus the inputs it resolved. */
@Value
@Builder
public class PricedOption {

    public enum VolatilitySource {
        INPUT,
        SURFACE
    }

    String currencyPair;
    OptionType optionType;
    LocalDate tradeDate;
    LocalDate expiryDate;
    int daysToExpiry;
    double timeToExpiryYears;
    double volatilityPct;
    VolatilitySource volatilitySource;
    OptionResult result;
}

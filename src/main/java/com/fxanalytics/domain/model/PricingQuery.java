package com.fxanalytics.domain.model;

import com.fxanalytics.domain.enums.OptionType;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A pricing request in market terms: expiry as a tenor or a date, and an optional
 * volatility. Without a volatility the pair's surface is fetched and interpolated at the
 * strike and expiry.
 */
@Value
@Builder
public class PricingQuery {

    String currencyPair;
    double spot;
    double strike;
    OptionType optionType;

    /** Exactly one of tenor and expiryDate is expected; expiryDate wins if both are set. */
    String tenor;

    LocalDate expiryDate;

    /** Defaults to today. */
    LocalDate tradeDate;

    double domesticRatePct;
    double foreignRatePct;

    /** Null means "use the surface". */
    Double volatilityPct;

    @Builder.Default
    double notional = 1.0;
}

package com.fxanalytics.api.dto.request;

import com.fxanalytics.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request payload for pricing a European vanilla FX option.
 *
 * <p>Expiry is given either as a {@code tenor} ("1M") or an {@code expiryDate}. Omitting
 * {@code volatility} prices off the pair's interpolated surface, which needs
 * {@code currencyPair}. Rates and vol are percentages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FxPricingRequest {

    private String currencyPair;

    @NotNull(message = "spot is required")
    @Positive(message = "spot must be positive")
    private Double spot;

    @NotNull(message = "strike is required")
    @Positive(message = "strike must be positive")
    private Double strike;

    @NotNull(message = "optionType is required")
    private OptionType optionType;

    private String tenor;

    private LocalDate expiryDate;

    private LocalDate tradeDate;

    @NotNull(message = "domesticRate is required")
    private Double domesticRate;

    @NotNull(message = "foreignRate is required")
    private Double foreignRate;

    @Positive(message = "volatility must be positive")
    private Double volatility;

    /** Base-currency units. Defaults to 1. */
    @Positive(message = "notional must be positive")
    private Double notional;
}

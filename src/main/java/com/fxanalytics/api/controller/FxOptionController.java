package com.fxanalytics.api.controller;

import com.fxanalytics.api.dto.request.FxPricingRequest;
import com.fxanalytics.api.dto.response.ForwardResponse;
import com.fxanalytics.domain.model.PricedOption;
import com.fxanalytics.domain.model.PricingQuery;
import com.fxanalytics.exception.DomainException;
import com.fxanalytics.service.FxOptionPricingService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for FX option pricing.
 *
 * <ul>
 *   <li>POST /api/fx-options/price -- Garman-Kohlhagen premium and Greeks
 *   <li>GET /api/fx-options/forward -- outright forward for a horizon in days or years
 * </ul>
 */
@RestController
@RequestMapping("/api/fx-options")
public class FxOptionController {

    private static final double DAYS_PER_YEAR = 365.0;

    private final FxOptionPricingService fxOptionPricingService;

    public FxOptionController(FxOptionPricingService fxOptionPricingService) {
        this.fxOptionPricingService = fxOptionPricingService;
    }

    @PostMapping("/price")
    public PricedOption price(@RequestBody @Valid FxPricingRequest request) {
        return fxOptionPricingService.price(PricingQuery.builder()
                .currencyPair(request.getCurrencyPair())
                .spot(request.getSpot())
                .strike(request.getStrike())
                .optionType(request.getOptionType())
                .tenor(request.getTenor())
                .expiryDate(request.getExpiryDate())
                .tradeDate(request.getTradeDate())
                .domesticRatePct(request.getDomesticRate())
                .foreignRatePct(request.getForeignRate())
                .volatilityPct(request.getVolatility())
                .notional(request.getNotional() != null ? request.getNotional() : 1.0)
                .build());
    }

    /** Exactly one of {@code days} and {@code years} is required. */
    @GetMapping("/forward")
    public ForwardResponse forward(
            @RequestParam double spot,
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) Double years,
            @RequestParam double domesticRate,
            @RequestParam double foreignRate) {
        if ((days == null) == (years == null)) {
            throw new DomainException("Exactly one of days or years is required");
        }
        double t = years != null ? years : days / DAYS_PER_YEAR;
        double forward = fxOptionPricingService.forward(spot, t, domesticRate, foreignRate);
        return ForwardResponse.builder()
                .spot(spot)
                .timeToExpiryYears(t)
                .domesticRate(domesticRate)
                .foreignRate(foreignRate)
                .forward(forward)
                .forwardPoints(forward - spot)
                .build();
    }
}

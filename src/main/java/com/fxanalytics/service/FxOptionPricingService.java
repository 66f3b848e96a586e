package com.fxanalytics.service;

import com.fxanalytics.calendar.TenorCalendarService;
import com.fxanalytics.core.processor.GarmanKohlhagenPricer;
import com.fxanalytics.core.processor.SurfaceInterpolator;
import com.fxanalytics.domain.model.OptionRequest;
import com.fxanalytics.domain.model.OptionResult;
import com.fxanalytics.domain.model.PricedOption;
import com.fxanalytics.domain.model.PricedOption.VolatilitySource;
import com.fxanalytics.domain.model.PricingQuery;
import com.fxanalytics.domain.model.SurfacePoint;
import com.fxanalytics.exception.DomainException;
import com.fxanalytics.exception.TransientProviderException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * End-to-end vanilla pricing in market terms.
 *
 * <p>Resolves the expiry (tenor via the FX calendar, or an explicit date), converts it to an
 * ACT/365 year fraction, takes the caller's vol or interpolates one from the pair's surface,
 * and prices with {@link GarmanKohlhagenPricer}.
 */
@Service
public class FxOptionPricingService {

    private static final Logger log = LoggerFactory.getLogger(FxOptionPricingService.class);

    private final GarmanKohlhagenPricer pricer;
    private final SurfaceInterpolator surfaceInterpolator;
    private final VolatilitySurfaceService volatilitySurfaceService;
    private final TenorCalendarService tenorCalendarService;
    private final Clock clock;

    public FxOptionPricingService(
            GarmanKohlhagenPricer pricer,
            SurfaceInterpolator surfaceInterpolator,
            VolatilitySurfaceService volatilitySurfaceService,
            TenorCalendarService tenorCalendarService,
            Clock clock) {
        this.pricer = pricer;
        this.surfaceInterpolator = surfaceInterpolator;
        this.volatilitySurfaceService = volatilitySurfaceService;
        this.tenorCalendarService = tenorCalendarService;
        this.clock = clock;
    }

    /**
     * @throws DomainException on missing expiry, an expiry not after the trade date, a
     *     surface-priced trade date other than today, or invalid pricing inputs
     * @throws TransientProviderException if the surface is needed and has no ATM data
     */
    public PricedOption price(PricingQuery query) {
        LocalDate tradeDate = query.getTradeDate() != null ? query.getTradeDate() : LocalDate.now(clock);
        LocalDate expiry = resolveExpiry(query, tradeDate);
        double years = tenorCalendarService.yearFraction(tradeDate, expiry);
        int days = (int) ChronoUnit.DAYS.between(tradeDate, expiry);

        double vol;
        VolatilitySource source;
        if (query.getVolatilityPct() != null) {
            vol = query.getVolatilityPct();
            source = VolatilitySource.INPUT;
        } else {
            vol = surfaceVolatility(query, tradeDate, days);
            source = VolatilitySource.SURFACE;
        }

        OptionResult result = pricer.price(OptionRequest.builder()
                .spot(query.getSpot())
                .strike(query.getStrike())
                .timeToExpiryYears(years)
                .domesticRatePct(query.getDomesticRatePct())
                .foreignRatePct(query.getForeignRatePct())
                .volatilityPct(vol)
                .optionType(query.getOptionType())
                .notional(query.getNotional())
                .build());

        log.info(
                "Priced {} {} K={} exp={} ({}d) vol={}% [{}]: premium={}",
                query.getCurrencyPair() != null ? query.getCurrencyPair() : "-",
                query.getOptionType(),
                query.getStrike(),
                expiry,
                days,
                vol,
                source,
                result.getPremium());

        return PricedOption.builder()
                .currencyPair(query.getCurrencyPair())
                .optionType(query.getOptionType())
                .tradeDate(tradeDate)
                .expiryDate(expiry)
                .daysToExpiry(days)
                .timeToExpiryYears(years)
                .volatilityPct(vol)
                .volatilitySource(source)
                .result(result)
                .build();
    }

    /** Outright forward, {@code S * e^((rd - rf) * T)}. */
    public double forward(double spot, double timeToExpiryYears, double domesticRatePct, double foreignRatePct) {
        return pricer.forwardRate(spot, timeToExpiryYears, domesticRatePct, foreignRatePct);
    }

    private LocalDate resolveExpiry(PricingQuery query, LocalDate tradeDate) {
        if (query.getExpiryDate() != null) {
            return query.getExpiryDate();
        }
        if (query.getTenor() == null || query.getTenor().isBlank()) {
            throw new DomainException("Either tenor or expiryDate is required");
        }
        return tenorCalendarService.expiryDate(tradeDate, query.getTenor());
    }

    private double surfaceVolatility(PricingQuery query, LocalDate tradeDate, int days) {
        if (query.getCurrencyPair() == null || query.getCurrencyPair().isBlank()) {
            throw new DomainException("currencyPair is required when no volatility is given");
        }
        // the surface is today's snapshot; its tenor days are counted from today
        LocalDate today = LocalDate.now(clock);
        if (!tradeDate.equals(today)) {
            throw new DomainException(
                    "Surface volatility is only available for trade date " + today + "; give volatilityPct instead",
                    Map.of("tradeDate", tradeDate.toString(), "today", today.toString()));
        }
        List<SurfacePoint> points = volatilitySurfaceService.getSurfacePoints(query.getCurrencyPair(), null);
        if (points.isEmpty()) {
            throw new TransientProviderException(
                    "No ATM volatility available for " + query.getCurrencyPair(),
                    Map.of("currencyPair", query.getCurrencyPair()),
                    null);
        }
        return surfaceInterpolator.volatilityAt(query.getStrike(), query.getSpot(), days, points);
    }
}

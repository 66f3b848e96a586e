package com.fxanalytics.provider;

import com.fxanalytics.domain.model.SecurityQuote;
import com.fxanalytics.domain.vo.Tenor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Deterministic stand-in for the market-data gateway so the service runs end to end without
 * a terminal connection.
 *
 * <p>Active when {@code fxanalytics.provider.mode=simulated} (the default). Every id that
 * {@link VolatilityTicker#parse} recognizes gets a two-sided quote built from a per-pair
 * base vol, a gently upward-sloping term structure, a put-skewed risk reversal and a
 * convex butterfly. Anything else comes back as a failed record.
 */
@Service
@ConditionalOnProperty(name = "fxanalytics.provider.mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataProvider.class);

    private static final Map<String, Double> BASE_ATM_VOL = Map.of(
            "EURUSD", 7.30,
            "GBPUSD", 8.10,
            "USDJPY", 9.60,
            "AUDUSD", 9.90,
            "USDCHF", 7.80,
            "USDCAD", 6.40);

    private static final double DEFAULT_BASE_VOL = 10.0;
    private static final double HALF_SPREAD = 0.10;

    @Override
    public List<SecurityQuote> fetchQuotes(List<String> securityIds) {
        log.debug("Simulated fetch of {} securities", securityIds.size());
        List<SecurityQuote> quotes = new ArrayList<>(securityIds.size());
        for (String securityId : securityIds) {
            Optional<VolatilityTicker> ticker = VolatilityTicker.parse(securityId);
            quotes.add(ticker.map(t -> quote(securityId, t))
                    .orElseGet(() -> SecurityQuote.failed(securityId, "Unknown security: " + securityId)));
        }
        return quotes;
    }

    private SecurityQuote quote(String securityId, VolatilityTicker ticker) {
        double mid = midFor(ticker);
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put(SecurityQuote.PX_LAST, round(mid));
        fields.put(SecurityQuote.PX_BID, round(mid - HALF_SPREAD));
        fields.put(SecurityQuote.PX_ASK, round(mid + HALF_SPREAD));
        return SecurityQuote.builder().securityId(securityId).fields(fields).success(true).build();
    }

    private double midFor(VolatilityTicker ticker) {
        double atm = atmVol(ticker.getPair(), Tenor.parse(ticker.getTenorLabel()).getNominalDays());
        return switch (ticker.getKind()) {
            case ATM -> atm;
            // puts over calls, steepest in the far wings
            case RISK_REVERSAL -> -0.04 * atm * (50 - ticker.getBucket().getDelta()) / 25.0;
            case BUTTERFLY -> 0.02 * atm * Math.pow((50 - ticker.getBucket().getDelta()) / 25.0, 2);
        };
    }

    private static double atmVol(String pair, int tenorDays) {
        double base = BASE_ATM_VOL.getOrDefault(pair, DEFAULT_BASE_VOL);
        return base + 0.35 * Math.log1p(tenorDays / 30.0);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}

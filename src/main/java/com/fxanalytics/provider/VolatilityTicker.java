package com.fxanalytics.provider;

import com.fxanalytics.domain.enums.DeltaBucket;
import com.fxanalytics.domain.vo.Tenor;
import com.fxanalytics.exception.DomainException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * Provider security id for one volatility quote of a currency pair.
 *
 * <ul>
 *   <li>ATM: {@code EURUSDV1M BGN Curncy}, overnight {@code EURUSDVON Curncy}
 *   <li>Risk reversal: {@code EURUSD25R1M BGN Curncy}
 *   <li>Butterfly: {@code EURUSD25B1M BGN Curncy}
 * </ul>
 */
@Value
public class VolatilityTicker {

    public enum Kind {
        ATM,
        RISK_REVERSAL,
        BUTTERFLY
    }

    private static final String PRICING_SOURCE = " BGN";
    private static final String SUFFIX = " Curncy";

    private static final Pattern ATM_PATTERN = Pattern.compile("^([A-Z]{6})V([0-9A-Z]+)( BGN)? Curncy$");
    private static final Pattern WING_PATTERN = Pattern.compile("^([A-Z]{6})(\\d+)([RB])([0-9A-Z]+) BGN Curncy$");

    String pair;
    String tenorLabel;
    Kind kind;

    /** Null for ATM. */
    DeltaBucket bucket;

    public static VolatilityTicker atm(String pair, String tenorLabel) {
        return new VolatilityTicker(normalizePair(pair), tenorLabel, Kind.ATM, null);
    }

    public static VolatilityTicker riskReversal(String pair, DeltaBucket bucket, String tenorLabel) {
        return new VolatilityTicker(normalizePair(pair), tenorLabel, Kind.RISK_REVERSAL, bucket);
    }

    public static VolatilityTicker butterfly(String pair, DeltaBucket bucket, String tenorLabel) {
        return new VolatilityTicker(normalizePair(pair), tenorLabel, Kind.BUTTERFLY, bucket);
    }

    /** ATM followed by the risk reversal and butterfly at every delta bucket. */
    public static List<VolatilityTicker> forTenor(String pair, String tenorLabel) {
        List<VolatilityTicker> tickers = new ArrayList<>();
        tickers.add(atm(pair, tenorLabel));
        for (DeltaBucket bucket : DeltaBucket.values()) {
            tickers.add(riskReversal(pair, bucket, tenorLabel));
            tickers.add(butterfly(pair, bucket, tenorLabel));
        }
        return tickers;
    }

    /** Empty when the id is not a volatility ticker this class builds. */
    public static Optional<VolatilityTicker> parse(String securityId) {
        if (securityId == null) {
            return Optional.empty();
        }
        Matcher atm = ATM_PATTERN.matcher(securityId);
        if (atm.matches()) {
            boolean overnight = "ON".equals(atm.group(2));
            boolean hasSource = atm.group(3) != null;
            if (overnight == hasSource || !isTenor(atm.group(2))) {
                return Optional.empty();
            }
            return Optional.of(atm(atm.group(1), atm.group(2)));
        }
        Matcher wing = WING_PATTERN.matcher(securityId);
        if (wing.matches() && isTenor(wing.group(4))) {
            Optional<DeltaBucket> bucket = DeltaBucket.ofDelta(Integer.parseInt(wing.group(2)));
            if (bucket.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of("R".equals(wing.group(3))
                    ? riskReversal(wing.group(1), bucket.get(), wing.group(4))
                    : butterfly(wing.group(1), bucket.get(), wing.group(4)));
        }
        return Optional.empty();
    }

    public String getSecurityId() {
        return switch (kind) {
            case ATM -> "ON".equals(tenorLabel)
                    ? pair + "V" + tenorLabel + SUFFIX
                    : pair + "V" + tenorLabel + PRICING_SOURCE + SUFFIX;
            case RISK_REVERSAL -> pair + bucket.getDelta() + "R" + tenorLabel + PRICING_SOURCE + SUFFIX;
            case BUTTERFLY -> pair + bucket.getDelta() + "B" + tenorLabel + PRICING_SOURCE + SUFFIX;
        };
    }

    private static String normalizePair(String pair) {
        return pair.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isTenor(String label) {
        try {
            Tenor.parse(label);
            return true;
        } catch (DomainException e) {
            return false;
        }
    }
}

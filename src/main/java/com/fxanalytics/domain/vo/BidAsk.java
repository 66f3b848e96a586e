package com.fxanalytics.domain.vo;

import lombok.Value;

/**
 * A two-sided quote where either side may be absent. A null side means the provider
 * returned nothing for it, which is not the same as a zero quote.
 */
@Value
public class BidAsk {

    public static final BidAsk EMPTY = new BidAsk(null, null);

    Double bid;
    Double ask;

    public static BidAsk of(Double bid, Double ask) {
        if (bid == null && ask == null) {
            return EMPTY;
        }
        return new BidAsk(bid, ask);
    }

    public boolean isComplete() {
        return bid != null && ask != null;
    }

    public int nullCount() {
        return (bid == null ? 1 : 0) + (ask == null ? 1 : 0);
    }

    /** Returns (bid + ask) / 2, or null when either side is missing. */
    public Double mid() {
        return isComplete() ? (bid + ask) / 2.0 : null;
    }

    /** True when both sides are present and bid exceeds ask. */
    public boolean isCrossed() {
        return isComplete() && bid > ask;
    }

    /**
     * Spread as a percentage of mid. Null when a side is missing or the mid is zero.
     */
    public Double spreadPercentOfMid() {
        Double mid = mid();
        if (mid == null || mid == 0.0) {
            return null;
        }
        return (ask - bid) / mid * 100.0;
    }
}

package com.fxanalytics.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One record as returned by the market-data provider for a single security id.
 * Field values may be null; {@code success=false} records carry {@code error} instead.
 */
@Value
@Builder
public class SecurityQuote {

    public static final String PX_LAST = "PX_LAST";
    public static final String PX_BID = "PX_BID";
    public static final String PX_ASK = "PX_ASK";

    String securityId;

    @Builder.Default
    Map<String, Double> fields = Map.of();

    boolean success;
    String error;

    public static SecurityQuote failed(String securityId, String error) {
        return SecurityQuote.builder().securityId(securityId).success(false).error(error).build();
    }

    public Double field(String name) {
        return fields == null ? null : fields.get(name);
    }

    public Double getBid() {
        return field(PX_BID);
    }

    public Double getAsk() {
        return field(PX_ASK);
    }

    public Double getLast() {
        return field(PX_LAST);
    }

    public boolean hasFields() {
        return fields != null && !fields.isEmpty();
    }

    /** A record is "full" when it has a last price or both sides of the market. */
    public boolean hasPriceOrBidAsk() {
        return getLast() != null || (getBid() != null && getAsk() != null);
    }
}

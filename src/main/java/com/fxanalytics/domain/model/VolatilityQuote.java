package com.fxanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fxanalytics.domain.enums.DeltaBucket;
import com.fxanalytics.domain.vo.BidAsk;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Raw implied-volatility quotes for one tenor of a currency pair's surface: ATM plus
 * risk reversal and butterfly ladders at each {@link DeltaBucket}.
 *
 * <p>All values are volatility percentages as quoted (e.g. 7.34). Absent buckets and
 * absent sides are explicit "no quote", never zero. The provider-facing field names
 * ({@code atm_bid}, {@code rr_25d_ask}, ...) come from {@link #namedFields()}, which is
 * also the field universe the quote validator scores against.
 */
@Value
@Builder(toBuilder = true)
public class VolatilityQuote {

    String tenorLabel;

    int tenorDays;

    @Builder.Default
    BidAsk atm = BidAsk.EMPTY;

    @Singular("riskReversal")
    Map<DeltaBucket, BidAsk> riskReversals;

    @Singular("butterfly")
    Map<DeltaBucket, BidAsk> butterflies;

    /**
     * Placeholder used when the provider is unreachable or the breaker is open. Every quote
     * field is null so validation marks it incomplete; callers must not read it as zero vol.
     */
    public static VolatilityQuote missing(String tenorLabel, int tenorDays) {
        return VolatilityQuote.builder().tenorLabel(tenorLabel).tenorDays(tenorDays).build();
    }

    public BidAsk getRiskReversal(DeltaBucket bucket) {
        return riskReversals.getOrDefault(bucket, BidAsk.EMPTY);
    }

    public BidAsk getButterfly(DeltaBucket bucket) {
        return butterflies.getOrDefault(bucket, BidAsk.EMPTY);
    }

    @JsonIgnore
    public Double getAtmBid() {
        return atm.getBid();
    }

    @JsonIgnore
    public Double getAtmAsk() {
        return atm.getAsk();
    }

    public VolatilityQuote withAtm(BidAsk newAtm) {
        return toBuilder().atm(newAtm == null ? BidAsk.EMPTY : newAtm).build();
    }

    /**
     * Every quote field keyed by its provider name, in ladder order. The tenor label and
     * day count are metadata and are not part of this map.
     */
    @JsonIgnore
    public Map<String, Double> namedFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("atm_bid", atm.getBid());
        fields.put("atm_ask", atm.getAsk());
        for (DeltaBucket bucket : DeltaBucket.values()) {
            BidAsk rr = getRiskReversal(bucket);
            BidAsk bf = getButterfly(bucket);
            fields.put("rr_" + bucket.label() + "_bid", rr.getBid());
            fields.put("rr_" + bucket.label() + "_ask", rr.getAsk());
            fields.put("bf_" + bucket.label() + "_bid", bf.getBid());
            fields.put("bf_" + bucket.label() + "_ask", bf.getAsk());
        }
        return Collections.unmodifiableMap(fields);
    }
}

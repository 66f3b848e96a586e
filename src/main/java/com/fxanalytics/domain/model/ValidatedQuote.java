package com.fxanalytics.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A {@link VolatilityQuote} together with its quality score. {@code complete} is true only
 * when the completeness score clears the minimum and both ATM sides are present.
 */
@Value
@Builder(toBuilder = true)
public class ValidatedQuote {

    VolatilityQuote quote;
    QualityMetrics quality;
    boolean complete;

    @Singular
    List<String> missingFields;

    public String getTenorLabel() {
        return quote.getTenorLabel();
    }

    public int getTenorDays() {
        return quote.getTenorDays();
    }
}

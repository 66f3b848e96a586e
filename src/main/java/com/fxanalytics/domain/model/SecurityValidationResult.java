package com.fxanalytics.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Classification of a provider batch. Partial records stay in {@code valid}; the
 * {@code partialData} count exists for observability only.
 */
@Value
@Builder
public class SecurityValidationResult {

    List<SecurityQuote> valid;
    List<SecurityQuote> invalid;
    int totalRequested;
    int successful;
    int failed;
    int partialData;
}

package com.fxanalytics.core.processor;

import com.fxanalytics.domain.model.QualityMetrics;
import com.fxanalytics.domain.model.QualitySummary;
import com.fxanalytics.domain.model.SecurityQuote;
import com.fxanalytics.domain.model.SecurityValidationResult;
import com.fxanalytics.domain.model.ValidatedQuote;
import com.fxanalytics.domain.model.VolatilityQuote;
import com.fxanalytics.domain.vo.BidAsk;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Scores volatility quotes for completeness and consistency.
 *
 * <p>Quality problems never throw: they are recorded as warnings on {@link QualityMetrics}
 * and the caller decides what to show. Only the ATM bid and ask are critical; they alone
 * gate {@link ValidatedQuote#isComplete()} besides the completeness threshold.
 */
@Slf4j
@Component
public class QuoteValidator {

    static final List<String> CRITICAL_FIELDS = List.of("atm_bid", "atm_ask");

    private static final double WIDE_SPREAD_PERCENT = 10.0;
    private static final double COMPLETE_WEIGHT = 0.4;
    private static final double FRESHNESS_WEIGHT = 0.3;
    private static final double ACCURACY_WEIGHT = 0.3;
    private static final int PENALTY_PER_CRITICAL_WARNING = 20;

    private final Clock clock;
    private final long staleThresholdMs;
    private final int minCompletenessScore;

    public QuoteValidator(
            Clock clock,
            @Value("${fxanalytics.validation.stale-threshold-ms:300000}") long staleThresholdMs,
            @Value("${fxanalytics.validation.min-completeness-score:70}") int minCompletenessScore) {
        this.clock = clock;
        this.staleThresholdMs = staleThresholdMs;
        this.minCompletenessScore = minCompletenessScore;
    }

    /** Validates a quote that was updated just now. */
    public ValidatedQuote validate(VolatilityQuote quote) {
        return validate(quote, clock.instant());
    }

    /**
     * Validates a quote against its provider update time.
     *
     * @param lastUpdate when the provider last updated the quote; null is treated as "now"
     */
    public ValidatedQuote validate(VolatilityQuote quote, Instant lastUpdate) {
        Instant now = clock.instant();
        Instant updated = lastUpdate != null ? lastUpdate : now;

        Map<String, Double> fields = quote.namedFields();
        int totalFields = fields.size();
        int nullFields = (int) fields.values().stream().filter(Objects::isNull).count();
        int validFields = totalFields - nullFields;
        int completenessScore = (int) Math.round(100.0 * validFields / totalFields);

        List<String> warnings = new ArrayList<>();
        List<String> missingFields = new ArrayList<>();
        for (String field : CRITICAL_FIELDS) {
            if (fields.get(field) == null) {
                warnings.add("Critical field '" + field + "' is missing");
                missingFields.add(field);
            }
        }

        BidAsk atm = quote.getAtm();
        if (atm.isCrossed()) {
            warnings.add("ATM bid > ask - possible data error");
        }
        Double spreadPercent = atm.spreadPercentOfMid();
        if (spreadPercent != null && spreadPercent > WIDE_SPREAD_PERCENT) {
            warnings.add(String.format(Locale.ROOT, "Wide bid-ask spread: %.2f%%", spreadPercent));
        }

        boolean stale = Duration.between(updated, now).toMillis() > staleThresholdMs;

        QualityMetrics quality = QualityMetrics.builder()
                .totalFields(totalFields)
                .validFields(validFields)
                .nullFields(nullFields)
                .completenessScore(completenessScore)
                .warnings(warnings)
                .stale(stale)
                .timestamp(now)
                .lastUpdate(updated)
                .build();

        boolean complete = completenessScore >= minCompletenessScore && missingFields.isEmpty();

        return ValidatedQuote.builder()
                .quote(quote)
                .quality(quality)
                .complete(complete)
                .missingFields(missingFields)
                .build();
    }

    /**
     * Splits a provider batch into usable and failed records. Records that carry fields but
     * neither a last price nor both sides of the market are kept as valid and counted as
     * partial.
     */
    public SecurityValidationResult validateBatch(List<SecurityQuote> records) {
        List<SecurityQuote> valid = new ArrayList<>();
        List<SecurityQuote> invalid = new ArrayList<>();
        int partialData = 0;

        for (SecurityQuote record : records) {
            if (!record.isSuccess() || record.getError() != null) {
                invalid.add(record);
            } else if (record.hasFields()) {
                if (!record.hasPriceOrBidAsk()) {
                    partialData++;
                }
                valid.add(record);
            } else {
                invalid.add(record);
            }
        }

        if (!invalid.isEmpty()) {
            log.warn("Provider batch: {} of {} records invalid", invalid.size(), records.size());
        }

        return SecurityValidationResult.builder()
                .valid(valid)
                .invalid(invalid)
                .totalRequested(records.size())
                .successful(valid.size())
                .failed(invalid.size())
                .partialData(partialData)
                .build();
    }

    /**
     * Fills a missing ATM side at interior tenors with the average of the two neighbouring
     * tenors' same side; a side the provider did quote is kept. Endpoints are never filled.
     * Points are processed in tenor order, so a filled value can feed the next point. Quality
     * scores stay as computed from the raw quote; only the quote and its warnings change.
     *
     * @return a new list sorted by tenor days
     */
    public List<ValidatedQuote> fillMissingAtm(List<ValidatedQuote> quotes) {
        List<ValidatedQuote> sorted = new ArrayList<>(quotes);
        sorted.sort(Comparator.comparingInt(ValidatedQuote::getTenorDays));

        for (int i = 1; i < sorted.size() - 1; i++) {
            ValidatedQuote current = sorted.get(i);
            BidAsk atm = current.getQuote().getAtm();
            if (atm.isComplete()) {
                continue;
            }
            BidAsk prev = sorted.get(i - 1).getQuote().getAtm();
            BidAsk next = sorted.get(i + 1).getQuote().getAtm();

            Double bid = atm.getBid();
            Double ask = atm.getAsk();
            QualityMetrics.QualityMetricsBuilder quality = current.getQuality().toBuilder();
            boolean filled = false;

            if (bid == null && prev.getBid() != null && next.getBid() != null) {
                bid = (prev.getBid() + next.getBid()) / 2.0;
                quality.warning("ATM bid interpolated");
                filled = true;
            }
            if (ask == null && prev.getAsk() != null && next.getAsk() != null) {
                ask = (prev.getAsk() + next.getAsk()) / 2.0;
                quality.warning("ATM ask interpolated");
                filled = true;
            }

            if (filled) {
                log.debug("Filled ATM at {} from neighbours: bid={}, ask={}", current.getTenorLabel(), bid, ask);
                sorted.set(
                        i,
                        current.toBuilder()
                                .quote(current.getQuote().withAtm(BidAsk.of(bid, ask)))
                                .quality(quality.build())
                                .build());
            }
        }
        return sorted;
    }

    /**
     * Rolls per-tenor quality up into one dashboard score:
     * 40% share of complete records, 30% share of fresh records, 30% accuracy, where
     * accuracy loses 20 points per distinct critical warning.
     */
    public QualitySummary summarize(List<ValidatedQuote> quotes) {
        if (quotes == null || quotes.isEmpty()) {
            return QualitySummary.empty();
        }
        int totalRecords = quotes.size();
        int completeRecords = (int) quotes.stream().filter(ValidatedQuote::isComplete).count();
        int staleRecords =
                (int) quotes.stream().filter(q -> q.getQuality().isStale()).count();
        double averageCompleteness = quotes.stream()
                .mapToInt(q -> q.getQuality().getCompletenessScore())
                .average()
                .orElse(0);

        Set<String> distinct = new LinkedHashSet<>();
        quotes.forEach(q -> distinct.addAll(q.getQuality().getWarnings()));
        List<String> criticalWarnings = distinct.stream()
                .filter(w -> w.contains("Critical") || w.contains("error"))
                .toList();

        double completeScore = 100.0 * completeRecords / totalRecords;
        double freshnessScore = 100.0 * (totalRecords - staleRecords) / totalRecords;
        double accuracyScore = Math.max(0, 100 - criticalWarnings.size() * PENALTY_PER_CRITICAL_WARNING);
        int overallScore = (int) Math.round(completeScore * COMPLETE_WEIGHT
                + freshnessScore * FRESHNESS_WEIGHT
                + accuracyScore * ACCURACY_WEIGHT);

        return QualitySummary.builder()
                .overallScore(overallScore)
                .completeRecords(completeRecords)
                .totalRecords(totalRecords)
                .averageCompleteness(averageCompleteness)
                .staleRecords(staleRecords)
                .criticalWarnings(criticalWarnings)
                .build();
    }
}

package com.fxanalytics.service;

import com.fxanalytics.calendar.TenorCalendarService;
import com.fxanalytics.core.processor.QuoteValidator;
import com.fxanalytics.domain.model.QualitySummary;
import com.fxanalytics.domain.model.SecurityQuote;
import com.fxanalytics.domain.model.SecurityValidationResult;
import com.fxanalytics.domain.model.SurfacePoint;
import com.fxanalytics.domain.model.ValidatedQuote;
import com.fxanalytics.domain.model.VolatilityQuote;
import com.fxanalytics.domain.vo.BidAsk;
import com.fxanalytics.domain.vo.Tenor;
import com.fxanalytics.exception.DomainException;
import com.fxanalytics.provider.VolatilityTicker;
import com.fxanalytics.resilience.BatchResult;
import com.fxanalytics.resilience.ErrorSummary;
import com.fxanalytics.resilience.ProviderErrors;
import com.fxanalytics.resilience.ResilientExecutor;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds a validated volatility surface for a currency pair from provider quotes.
 *
 * <p>Flow: tickers for every requested tenor, resilient chunked fetch, provider-record
 * validation, per-tenor assembly from {@code PX_BID}/{@code PX_ASK}, quote validation,
 * interior ATM gap filling, quality summary. Tenors the provider could not deliver at all
 * get an all-null fallback quote, so the result always has one entry per tenor and a
 * provider outage shows up as incomplete data rather than an error.
 */
@Service
public class VolatilitySurfaceService {

    private static final Logger log = LoggerFactory.getLogger(VolatilitySurfaceService.class);

    private static final Pattern PAIR_PATTERN = Pattern.compile("^[A-Z]{6}$");

    private final MarketDataGateway marketDataGateway;
    private final QuoteValidator quoteValidator;
    private final ResilientExecutor resilientExecutor;
    private final TenorCalendarService tenorCalendarService;
    private final Clock clock;

    public VolatilitySurfaceService(
            MarketDataGateway marketDataGateway,
            QuoteValidator quoteValidator,
            ResilientExecutor resilientExecutor,
            TenorCalendarService tenorCalendarService,
            Clock clock) {
        this.marketDataGateway = marketDataGateway;
        this.quoteValidator = quoteValidator;
        this.resilientExecutor = resilientExecutor;
        this.tenorCalendarService = tenorCalendarService;
        this.clock = clock;
    }

    /**
     * Validated quotes for the pair, one per tenor, sorted by days to expiry.
     *
     * @param tenorLabels tenors to fetch; null or empty means the standard ladder
     * @throws DomainException if the pair or a tenor label is malformed
     */
    public List<ValidatedQuote> getVolatilitySurface(String currencyPair, List<String> tenorLabels) {
        String pair = normalizePair(currencyPair);
        List<Tenor> tenors = resolveTenors(tenorLabels);
        LocalDate tradeDate = LocalDate.now(clock);

        Map<String, VolatilityTicker> tickersById = new LinkedHashMap<>();
        for (Tenor tenor : tenors) {
            VolatilityTicker.forTenor(pair, tenor.getLabel()).forEach(t -> tickersById.put(t.getSecurityId(), t));
        }

        BatchResult<String, SecurityQuote> fetched = marketDataGateway.fetchQuotes(new ArrayList<>(tickersById.keySet()));
        if (!fetched.getBatchErrors().isEmpty()) {
            ErrorSummary errors = ProviderErrors.createErrorSummary(new ArrayList<>(fetched.getBatchErrors().values()));
            log.warn(
                    "{} surface fetch: {} ({} of {} securities failed, recoverable={})",
                    pair,
                    errors.getSummary(),
                    fetched.getFailed().size(),
                    tickersById.size(),
                    errors.isRecoverable());
        }

        SecurityValidationResult records = quoteValidator.validateBatch(fetched.getResults());
        if (records.getPartialData() > 0) {
            log.warn("{} surface fetch: {} partial records", pair, records.getPartialData());
        }

        Map<String, VolatilityQuote.VolatilityQuoteBuilder> builders = new LinkedHashMap<>();
        Set<String> tenorsWithData = new HashSet<>();
        for (Tenor tenor : tenors) {
            builders.put(
                    tenor.getLabel(),
                    VolatilityQuote.builder()
                            .tenorLabel(tenor.getLabel())
                            .tenorDays(tenorCalendarService.daysToExpiry(tradeDate, tenor.getLabel())));
        }
        for (SecurityQuote record : records.getValid()) {
            VolatilityTicker ticker = tickersById.get(record.getSecurityId());
            if (ticker == null) {
                log.debug("Ignoring unrequested security {}", record.getSecurityId());
                continue;
            }
            apply(builders.get(ticker.getTenorLabel()), ticker, BidAsk.of(record.getBid(), record.getAsk()));
            tenorsWithData.add(ticker.getTenorLabel());
        }

        List<ValidatedQuote> validated = new ArrayList<>();
        for (Map.Entry<String, VolatilityQuote.VolatilityQuoteBuilder> entry : builders.entrySet()) {
            VolatilityQuote quote = entry.getValue().build();
            if (!tenorsWithData.contains(entry.getKey())) {
                quote = resilientExecutor.createFallbackQuote(quote.getTenorLabel(), quote.getTenorDays());
            }
            validated.add(quoteValidator.validate(quote));
        }

        List<ValidatedQuote> surface = quoteValidator.fillMissingAtm(validated);
        QualitySummary summary = quoteValidator.summarize(surface);
        log.info(
                "{} surface: quality {} ({} of {} tenors complete, {} stale)",
                pair,
                summary.getOverallScore(),
                summary.getCompleteRecords(),
                summary.getTotalRecords(),
                summary.getStaleRecords());
        if (!summary.getCriticalWarnings().isEmpty()) {
            log.warn("{} surface critical warnings: {}", pair, summary.getCriticalWarnings());
        }
        return surface;
    }

    /** Mid-priced points of the surface that have an ATM quote, for interpolation. */
    public List<SurfacePoint> getSurfacePoints(String currencyPair, List<String> tenorLabels) {
        return toSurfacePoints(getVolatilitySurface(currencyPair, tenorLabels));
    }

    public QualitySummary getQualitySummary(String currencyPair, List<String> tenorLabels) {
        return quoteValidator.summarize(getVolatilitySurface(currencyPair, tenorLabels));
    }

    public static List<SurfacePoint> toSurfacePoints(List<ValidatedQuote> surface) {
        return surface.stream()
                .map(SurfacePoint::from)
                .flatMap(Optional::stream)
                .toList();
    }

    private static void apply(VolatilityQuote.VolatilityQuoteBuilder builder, VolatilityTicker ticker, BidAsk value) {
        switch (ticker.getKind()) {
            case ATM -> builder.atm(value);
            case RISK_REVERSAL -> builder.riskReversal(ticker.getBucket(), value);
            case BUTTERFLY -> builder.butterfly(ticker.getBucket(), value);
        }
    }

    static String normalizePair(String currencyPair) {
        String pair = currencyPair == null ? "" : currencyPair.trim().toUpperCase(Locale.ROOT);
        if (!PAIR_PATTERN.matcher(pair).matches()) {
            throw new DomainException("Currency pair must be six letters, e.g. EURUSD: " + currencyPair);
        }
        return pair;
    }

    private static List<Tenor> resolveTenors(List<String> tenorLabels) {
        if (tenorLabels == null || tenorLabels.isEmpty()) {
            return Tenor.standardLadder();
        }
        return tenorLabels.stream().map(Tenor::parse).distinct().sorted().toList();
    }
}

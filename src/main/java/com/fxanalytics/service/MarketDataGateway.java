package com.fxanalytics.service;

import com.fxanalytics.domain.model.SecurityQuote;
import com.fxanalytics.provider.MarketDataProvider;
import com.fxanalytics.resilience.BatchResult;
import com.fxanalytics.resilience.CircuitBreakerState;
import com.fxanalytics.resilience.ProviderCircuitBreaker;
import com.fxanalytics.resilience.ResilientExecutor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * The only path to the {@link MarketDataProvider}.
 *
 * <p>Ids are split into chunks of {@code fxanalytics.resilience.batch.size}. Chunks are
 * fetched concurrently. Each attempt is time-limited and recorded on the circuit breaker,
 * so a provider that hangs opens it like one that errors. A chunk that still fails is
 * retried id by id so one bad ticker does not blank its whole chunk. Results are joined
 * before returning; their order across chunks is not defined.
 */
@Service
public class MarketDataGateway {

    private static final Logger log = LoggerFactory.getLogger(MarketDataGateway.class);

    private static final String HEALTH_CHECK_ID = "EURUSDV1M BGN Curncy";

    private final MarketDataProvider marketDataProvider;
    private final ProviderCircuitBreaker circuitBreaker;
    private final ResilientExecutor resilientExecutor;
    private final Executor fetchExecutor;
    private final int batchSize;

    public MarketDataGateway(
            MarketDataProvider marketDataProvider,
            ProviderCircuitBreaker circuitBreaker,
            ResilientExecutor resilientExecutor,
            @Qualifier("surfaceFetchExecutor") Executor fetchExecutor,
            @Value("${fxanalytics.resilience.batch.size:50}") int batchSize) {
        this.marketDataProvider = marketDataProvider;
        this.circuitBreaker = circuitBreaker;
        this.resilientExecutor = resilientExecutor.guardedBy(circuitBreaker);
        this.fetchExecutor = fetchExecutor;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Fetches quotes for all ids. Never throws for provider failures: ids that could not be
     * fetched are listed in {@link BatchResult#getFailed()}, and the error of each failed
     * chunk is keyed by chunk index in {@link BatchResult#getBatchErrors()}.
     */
    public BatchResult<String, SecurityQuote> fetchQuotes(List<String> securityIds) {
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < securityIds.size(); i += batchSize) {
            chunks.add(List.copyOf(securityIds.subList(i, Math.min(i + batchSize, securityIds.size()))));
        }
        log.debug("Fetching {} securities in {} chunks", securityIds.size(), chunks.size());

        List<CompletableFuture<BatchResult<String, SecurityQuote>>> futures = chunks.stream()
                .map(chunk -> CompletableFuture.supplyAsync(() -> fetchChunk(chunk), fetchExecutor))
                .toList();

        List<String> successful = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<SecurityQuote> results = new ArrayList<>();
        Map<Integer, Throwable> chunkErrors = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            BatchResult<String, SecurityQuote> chunkResult = futures.get(i).join();
            successful.addAll(chunkResult.getSuccessful());
            failed.addAll(chunkResult.getFailed());
            results.addAll(chunkResult.getResults());
            Throwable chunkError = chunkResult.getBatchErrors().get(0);
            if (chunkError != null) {
                chunkErrors.put(i, chunkError);
            }
        }

        return BatchResult.<String, SecurityQuote>builder()
                .successful(successful)
                .failed(failed)
                .results(results)
                .batchErrors(chunkErrors)
                .build();
    }

    public CircuitBreakerState getCircuitBreakerState() {
        return circuitBreaker.getState();
    }

    /**
     * Checks the provider with a single well-known id. If the check keeps failing, the
     * breaker is reset and the check is tried once more.
     */
    public boolean checkHealth() {
        return resilientExecutor.healthCheckWithRecovery(
                () -> marketDataProvider.fetchQuotes(List.of(HEALTH_CHECK_ID)),
                () -> {
                    log.warn("Provider health check failed, resetting circuit breaker '{}'", circuitBreaker.getName());
                    circuitBreaker.reset();
                });
    }

    private BatchResult<String, SecurityQuote> fetchChunk(List<String> chunk) {
        return resilientExecutor.batchWithRecovery(
                chunk, chunk.size(), marketDataProvider::fetchQuotes);
    }
}

package com.fxanalytics.config;

import com.fxanalytics.resilience.ProviderCircuitBreaker;
import com.fxanalytics.resilience.ResilientExecutor;
import com.fxanalytics.resilience.RetryPolicy;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the resilience layer from {@code fxanalytics.resilience.*}.
 *
 * <p>Two pools: {@code providerExecutor} runs individual time-limited provider attempts,
 * {@code surfaceFetchExecutor} fans chunk fetches out. They are separate so a chunk task
 * waiting on its attempt can never starve the pool that attempt needs. The attempt pool
 * aborts when saturated; an attempt run on the caller thread could not be timed out.
 */
@Configuration
public class ResilienceConfig {

    @Value("${fxanalytics.resilience.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${fxanalytics.resilience.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${fxanalytics.resilience.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${fxanalytics.resilience.retry.max-retries:3}") int maxRetries,
            @Value("${fxanalytics.resilience.retry.initial-delay-ms:1000}") long initialDelayMs,
            @Value("${fxanalytics.resilience.retry.max-delay-ms:10000}") long maxDelayMs,
            @Value("${fxanalytics.resilience.retry.backoff-multiplier:2.0}") double backoffMultiplier,
            @Value("${fxanalytics.resilience.retry.timeout-ms:30000}") long timeoutMs) {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .initialDelayMs(initialDelayMs)
                .maxDelayMs(maxDelayMs)
                .backoffMultiplier(backoffMultiplier)
                .timeoutMs(timeoutMs)
                .build();
    }

    @Bean
    public ProviderCircuitBreaker providerCircuitBreaker(
            @Value("${fxanalytics.resilience.circuit-breaker.threshold:5}") int threshold,
            @Value("${fxanalytics.resilience.circuit-breaker.cooldown-ms:60000}") long cooldownMs) {
        return new ProviderCircuitBreaker("marketDataProvider", threshold, cooldownMs);
    }

    @Bean("providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        return pool("provider-", new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean("surfaceFetchExecutor")
    public ThreadPoolTaskExecutor surfaceFetchExecutor() {
        return pool("surface-fetch-", new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean
    public ResilientExecutor resilientExecutor(
            @Qualifier("providerExecutor") ThreadPoolTaskExecutor providerExecutor,
            RetryPolicy retryPolicy,
            @Value("${fxanalytics.resilience.batch.batch-max-retries:2}") int batchMaxRetries,
            @Value("${fxanalytics.resilience.batch.batch-initial-delay-ms:500}") long batchInitialDelayMs,
            @Value("${fxanalytics.resilience.batch.item-max-retries:1}") int itemMaxRetries,
            @Value("${fxanalytics.resilience.batch.item-initial-delay-ms:200}") long itemInitialDelayMs) {
        RetryPolicy batchPolicy = retryPolicy.toBuilder()
                .maxRetries(batchMaxRetries)
                .initialDelayMs(batchInitialDelayMs)
                .build();
        RetryPolicy itemPolicy = retryPolicy.toBuilder()
                .maxRetries(itemMaxRetries)
                .initialDelayMs(itemInitialDelayMs)
                .build();
        return new ResilientExecutor(providerExecutor, retryPolicy, batchPolicy, itemPolicy);
    }

    private ThreadPoolTaskExecutor pool(String threadNamePrefix, RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}

package com.fxanalytics.resilience;

import com.fxanalytics.domain.model.VolatilityQuote;
import com.fxanalytics.exception.TransientProviderException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry, timeout and partial-batch recovery for provider calls.
 *
 * <p>Every attempt runs on {@code executor} under a Resilience4j {@link TimeLimiter}, so a
 * hung provider call counts as a (retryable) timeout. Each attempt is reduced to an
 * {@link AttemptOutcome}; the loop itself never uses exceptions for control flow. Only
 * failures that {@link ProviderErrors#isRetryable} accepts are retried, with exponential
 * backoff between attempts.
 *
 * <p>A call that times out is cancelled and its worker thread interrupted. An attempt the
 * executor rejects is a retryable failure and never runs on the calling thread.
 *
 * <p>When guarded by a {@link ProviderCircuitBreaker} (see {@link #guardedBy}), the breaker
 * wraps the time-limited attempt, so timeouts and rejections count as breaker failures and
 * an open breaker fails the attempt without submitting it.
 */
public class ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    static final RetryPolicy HEALTH_CHECK_POLICY =
            RetryPolicy.builder().maxRetries(2).initialDelayMs(1000).timeoutMs(5000).build();
    static final RetryPolicy HEALTH_RECHECK_POLICY =
            RetryPolicy.builder().maxRetries(1).timeoutMs(5000).build();

    private final Executor executor;
    private final RetryPolicy defaultPolicy;
    private final RetryPolicy batchPolicy;
    private final RetryPolicy itemPolicy;
    private final ProviderCircuitBreaker circuitBreaker;

    public ResilientExecutor(
            Executor executor, RetryPolicy defaultPolicy, RetryPolicy batchPolicy, RetryPolicy itemPolicy) {
        this(executor, defaultPolicy, batchPolicy, itemPolicy, null);
    }

    private ResilientExecutor(
            Executor executor,
            RetryPolicy defaultPolicy,
            RetryPolicy batchPolicy,
            RetryPolicy itemPolicy,
            ProviderCircuitBreaker circuitBreaker) {
        this.executor = executor;
        this.defaultPolicy = defaultPolicy;
        this.batchPolicy = batchPolicy;
        this.itemPolicy = itemPolicy;
        this.circuitBreaker = circuitBreaker;
    }

    /** Same executor and policies, with every attempt recorded on {@code breaker}. */
    public ResilientExecutor guardedBy(ProviderCircuitBreaker breaker) {
        return new ResilientExecutor(executor, defaultPolicy, batchPolicy, itemPolicy, breaker);
    }

    public <T> RetryResult<T> withRetry(Callable<T> operation) {
        return withRetry(operation, defaultPolicy);
    }

    /**
     * Runs the operation until it succeeds, fails with a non-retryable error, or the
     * attempt budget is spent. Never throws; see {@link RetryResult#getOrThrow()}.
     */
    public <T> RetryResult<T> withRetry(Callable<T> operation, RetryPolicy policy) {
        long start = System.currentTimeMillis();
        int maxAttempts = policy.attemptLimit();
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(policy.getTimeoutMs()))
                .cancelRunningFuture(true)
                .build());

        Throwable lastError = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            AttemptResult<T> result = attempt(operation, timeLimiter);

            if (result.outcome() == AttemptOutcome.SUCCESS) {
                long elapsed = System.currentTimeMillis() - start;
                log.debug("Operation succeeded on attempt {}/{} in {}ms", attempt, maxAttempts, elapsed);
                return RetryResult.success(result.value(), attempt, elapsed);
            }

            lastError = result.error();
            if (result.outcome() == AttemptOutcome.FATAL_FAILURE) {
                log.debug("Attempt {} failed with non-retryable error: {}", attempt, lastError.toString());
                break;
            }
            if (attempt == maxAttempts) {
                break;
            }

            long delay = policy.delayAfterAttempt(attempt);
            log.warn("Attempt {}/{} failed: {}. Retrying in {}ms", attempt, maxAttempts, lastError.getMessage(), delay);
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = e;
                break;
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        return RetryResult.failure(lastError, attempt, elapsed);
    }

    public <T, R> BatchResult<T, R> batchWithRecovery(List<T> items, int batchSize, BatchProcessor<T, R> processor) {
        return batchWithRecovery(items, batchSize, processor, null);
    }

    /**
     * Processes {@code items} in sequential batches of {@code batchSize}. When a whole batch
     * fails, each of its items is retried on its own so one bad item does not take its
     * neighbours down with it.
     *
     * @param onBatchError optional callback, invoked once per failed batch before the
     *                     per-item retries
     */
    public <T, R> BatchResult<T, R> batchWithRecovery(
            List<T> items,
            int batchSize,
            BatchProcessor<T, R> processor,
            BiConsumer<List<T>, Throwable> onBatchError) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be >= 1, got " + batchSize);
        }
        List<T> successful = new ArrayList<>();
        List<T> failed = new ArrayList<>();
        List<R> results = new ArrayList<>();
        Map<Integer, Throwable> batchErrors = new LinkedHashMap<>();

        for (int from = 0, batchIndex = 0; from < items.size(); from += batchSize, batchIndex++) {
            List<T> batch = List.copyOf(items.subList(from, Math.min(from + batchSize, items.size())));

            RetryResult<List<R>> batchResult = withRetry(() -> processor.process(batch), batchPolicy);
            if (batchResult.isSuccess()) {
                successful.addAll(batch);
                addResults(results, batchResult.getData());
                continue;
            }

            Throwable error = batchResult.getError();
            batchErrors.put(batchIndex, error);
            log.warn(
                    "Batch {} ({} items) failed after {} attempts: {}. Retrying items individually",
                    batchIndex,
                    batch.size(),
                    batchResult.getAttempts(),
                    error.getMessage());
            if (onBatchError != null) {
                onBatchError.accept(batch, error);
            }

            for (T item : batch) {
                RetryResult<List<R>> itemResult = withRetry(() -> processor.process(List.of(item)), itemPolicy);
                if (itemResult.isSuccess()) {
                    successful.add(item);
                    addResults(results, itemResult.getData());
                } else {
                    failed.add(item);
                }
            }
        }

        if (!failed.isEmpty()) {
            log.warn("Batch recovery finished: {} succeeded, {} failed", successful.size(), failed.size());
        }
        return BatchResult.<T, R>builder()
                .successful(successful)
                .failed(failed)
                .results(results)
                .batchErrors(batchErrors)
                .build();
    }

    /**
     * Runs the health check with retries; if it still fails, runs {@code recovery} and
     * checks once more.
     *
     * @return whether the service is healthy after any recovery
     */
    public boolean healthCheckWithRecovery(Callable<?> healthCheck, Runnable recovery) {
        RetryResult<?> health = withRetry(healthCheck, HEALTH_CHECK_POLICY);
        if (health.isSuccess()) {
            return true;
        }

        log.warn("Health check failed after {} attempts, attempting recovery", health.getAttempts());
        try {
            recovery.run();
        } catch (RuntimeException e) {
            log.error("Recovery failed", e);
            return false;
        }
        return withRetry(healthCheck, HEALTH_RECHECK_POLICY).isSuccess();
    }

    /**
     * Placeholder for a tenor the provider could not deliver. All quote fields are null,
     * so it validates as incomplete rather than as zero volatility.
     */
    public VolatilityQuote createFallbackQuote(String tenorLabel, int tenorDays) {
        log.warn("Using fallback (empty) quote for tenor {}", tenorLabel);
        return VolatilityQuote.missing(tenorLabel, tenorDays);
    }

    private <T> AttemptResult<T> attempt(Callable<T> operation, TimeLimiter timeLimiter) {
        Callable<T> timed = () -> timeLimiter.executeFutureSupplier(() -> submit(operation));
        try {
            T value = circuitBreaker != null ? circuitBreaker.execute(timed) : timed.call();
            return new AttemptResult<>(AttemptOutcome.SUCCESS, value, null);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            AttemptOutcome outcome =
                    ProviderErrors.isRetryable(cause) ? AttemptOutcome.RETRYABLE_FAILURE : AttemptOutcome.FATAL_FAILURE;
            return new AttemptResult<>(outcome, null, cause);
        }
    }

    private <T> Future<T> submit(Callable<T> operation) {
        FutureTask<T> task = new FutureTask<>(operation);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new TransientProviderException("Provider executor saturated, attempt rejected", e);
        }
        return task;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static <R> void addResults(List<R> results, List<R> batchResults) {
        if (batchResults != null) {
            results.addAll(batchResults);
        }
    }

    private record AttemptResult<T>(AttemptOutcome outcome, T value, Throwable error) {}
}

package com.umitunal.batchq.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Runs a single operation with retry and jittered exponential backoff, outside any queue.
 *
 * <pre>{@code
 * RetryResult<Order> result = RetryExecutor.execute(
 *         () -> client.fetchOrder(id),
 *         RetryOptions.apiCall().withMaxRetries(5).build());
 * }</pre>
 */
public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private RetryExecutor() {
    }

    public static <V> RetryResult<V> execute(Callable<V> operation) {
        return execute(operation, RetryOptions.defaults());
    }

    /**
     * Run {@code operation} until it succeeds, the retry condition rejects a failure, or
     * {@code maxRetries + 1} attempts have been made.
     */
    public static <V> RetryResult<V> execute(Callable<V> operation, RetryOptions options) {
        BackoffCalculator backoff = options.backoff();
        Throwable lastError = null;
        long totalDelay = 0;
        int attempt = 0;

        while (attempt <= options.getMaxRetries()) {
            attempt++;
            try {
                V value = operation.call();
                return RetryResult.success(value, attempt, totalDelay);
            } catch (Exception e) {
                lastError = e;
            }

            if (attempt > options.getMaxRetries() || !options.getRetryCondition().test(lastError)) {
                break;
            }

            long delay = backoff.delay(attempt);
            totalDelay += delay;
            options.getOnRetry().onRetry(attempt, lastError, delay);

            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Retry sleep interrupted after attempt {}", attempt);
                break;
            }
        }

        return RetryResult.failure(lastError, attempt, totalDelay);
    }

    /**
     * Shortcut for {@link RetryOptions#apiCall()}.
     */
    public static <V> RetryResult<V> apiCall(Callable<V> call) {
        return execute(call, RetryOptions.apiCall().build());
    }

    /**
     * Shortcut for {@link RetryOptions#databaseOperation()}.
     */
    public static <V> RetryResult<V> databaseOperation(Callable<V> operation) {
        return execute(operation, RetryOptions.databaseOperation().build());
    }
}

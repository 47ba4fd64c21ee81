package com.umitunal.batchq.retry;

import com.umitunal.batchq.error.ClassifiedError;
import com.umitunal.batchq.error.ErrorClassifier;
import com.umitunal.batchq.error.ErrorType;
import com.umitunal.batchq.error.ProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Configuration for {@link RetryExecutor}.
 */
public class RetryOptions {
    private static final Logger log = LoggerFactory.getLogger(RetryOptions.class);

    private final int maxRetries;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final double backoffFactor;
    private final Predicate<Throwable> retryCondition;
    private final RetryListener onRetry;
    private final Random random;

    private RetryOptions(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.baseDelayMillis = builder.baseDelayMillis;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.backoffFactor = builder.backoffFactor;
        this.retryCondition = builder.retryCondition;
        this.onRetry = builder.onRetry;
        this.random = builder.random;
    }

    public int getMaxRetries() { return maxRetries; }
    public long getBaseDelayMillis() { return baseDelayMillis; }
    public long getMaxDelayMillis() { return maxDelayMillis; }
    public double getBackoffFactor() { return backoffFactor; }
    public Predicate<Throwable> getRetryCondition() { return retryCondition; }
    public RetryListener getOnRetry() { return onRetry; }

    public BackoffCalculator backoff() {
        return new BackoffCalculator(baseDelayMillis, backoffFactor, maxDelayMillis, random);
    }

    public static RetryOptions defaults() {
        return newBuilder().build();
    }

    /**
     * Options for remote API calls: 3 retries from 1s, on network errors, 5xx, 408 and 429.
     */
    public static Builder apiCall() {
        return newBuilder()
                .withMaxRetries(3)
                .withBaseDelay(1000)
                .withRetryCondition(RetryOptions::isTransientApiFailure);
    }

    /**
     * Options for database calls: 2 retries from 500ms, on connection loss and timeouts.
     */
    public static Builder databaseOperation() {
        return newBuilder()
                .withMaxRetries(2)
                .withBaseDelay(500)
                .withRetryCondition(RetryOptions::isTransientDatabaseFailure);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    static boolean isTransientApiFailure(Throwable error) {
        ClassifiedError classified = ErrorClassifier.defaults().classify(error);
        return switch (classified.getType()) {
            case NETWORK, SERVER_ERROR, RATE_LIMIT -> true;
            // Status 408 only, a local timeout is not an API answer
            case TIMEOUT -> hasStatus(error, 408);
            default -> false;
        };
    }

    private static boolean hasStatus(Throwable error, int status) {
        Throwable root = ErrorClassifier.unwrap(error);
        return root instanceof ProcessingException
                && ((ProcessingException) root).getStatusCode().orElse(0) == status;
    }

    static boolean isTransientDatabaseFailure(Throwable error) {
        Throwable root = ErrorClassifier.unwrap(error);
        if (root instanceof ProcessingException && "PGRST301".equals(((ProcessingException) root).getErrorCode())) {
            return true;
        }
        String message = root.getMessage() == null ? "" : root.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("connection") || message.contains("timeout");
    }

    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int attempt, Throwable error, long delayMillis);
    }

    public static class Builder {
        private int maxRetries = 3;
        private long baseDelayMillis = 1000;
        private long maxDelayMillis = 30000;
        private double backoffFactor = 2.0;
        private Predicate<Throwable> retryCondition = RetryOptions::isTransientApiFailure;
        private RetryListener onRetry = (attempt, error, delay) ->
                log.info("Attempt {} failed, retrying in {}ms: {}", attempt, delay, error.getMessage());
        private Random random = new Random();

        private Builder() {
        }

        /**
         * Retries after the first attempt; total attempts are maxRetries + 1.
         * Default: 3
         */
        public Builder withMaxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Default: 1000 ms
         */
        public Builder withBaseDelay(long millis) {
            this.baseDelayMillis = millis;
            return this;
        }

        /**
         * Default: 30000 ms
         */
        public Builder withMaxDelay(long millis) {
            this.maxDelayMillis = millis;
            return this;
        }

        /**
         * Default: 2.0
         */
        public Builder withBackoffFactor(double factor) {
            this.backoffFactor = factor;
            return this;
        }

        public Builder withRetryCondition(Predicate<Throwable> condition) {
            this.retryCondition = Objects.requireNonNull(condition, "condition");
            return this;
        }

        /**
         * Retry on any failure of the given classes.
         */
        public Builder retryOn(ErrorType... types) {
            Set<ErrorType> accepted = EnumSet.noneOf(ErrorType.class);
            accepted.addAll(Arrays.asList(types));
            this.retryCondition = error -> accepted.contains(ErrorClassifier.defaults().classify(error).getType());
            return this;
        }

        public Builder withOnRetry(RetryListener listener) {
            this.onRetry = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public Builder withRandom(Random random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public RetryOptions build() {
            // validates delays
            new BackoffCalculator(baseDelayMillis, backoffFactor, maxDelayMillis, random);
            return new RetryOptions(this);
        }
    }
}

package com.umitunal.batchq.config;

import com.umitunal.batchq.retry.BackoffCalculator;

import java.util.Objects;
import java.util.Random;

/**
 * Configuration for a batch queue: concurrency, retry, backoff and timing.
 */
public class QueueConfig {
    private final int maxConcurrency;
    private final int maxRetries;
    private final long retryDelay;
    private final double backoffFactor;
    private final long maxRetryDelay;
    private final long timeout;
    private final long batchDelay;
    private final Random random;

    private QueueConfig(Builder builder) {
        this.maxConcurrency = builder.maxConcurrency;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.backoffFactor = builder.backoffFactor;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.timeout = builder.timeout;
        this.batchDelay = builder.batchDelay;
        this.random = builder.random;
    }

    public int getMaxConcurrency() { return maxConcurrency; }
    public int getMaxRetries() { return maxRetries; }
    public long getRetryDelay() { return retryDelay; }
    public double getBackoffFactor() { return backoffFactor; }
    public long getMaxRetryDelay() { return maxRetryDelay; }
    public long getTimeout() { return timeout; }
    public long getBatchDelay() { return batchDelay; }

    /**
     * Backoff for item retries, sharing this config's random source.
     */
    public BackoffCalculator newBackoffCalculator() {
        return new BackoffCalculator(retryDelay, backoffFactor, maxRetryDelay, random);
    }

    public static QueueConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
            "QueueConfig{maxConcurrency=%d, maxRetries=%d, retryDelay=%d, backoffFactor=%.1f, " +
            "maxRetryDelay=%d, timeout=%d, batchDelay=%d}",
            maxConcurrency, maxRetries, retryDelay, backoffFactor, maxRetryDelay, timeout, batchDelay
        );
    }

    public static class Builder {
        private int maxConcurrency = 5;
        private int maxRetries = 3;
        private long retryDelay = 1000;
        private double backoffFactor = 2.0;
        private long maxRetryDelay = 30000;
        private long timeout = 300000;
        private long batchDelay = 100;
        private Random random = new Random();

        private Builder() {
        }

        /**
         * Maximum number of items PROCESSING at once.
         * Default: 5
         */
        public Builder withMaxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be >= 1");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        /**
         * Failed attempts allowed per item before it is FAILED, unless the item sets its own.
         * Default: 3
         */
        public Builder withMaxRetries(int maxRetries) {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be >= 1");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Base delay of the retry backoff in milliseconds.
         * Default: 1000 ms
         */
        public Builder withRetryDelay(long millis) {
            requireNonNegative(millis, "retryDelay");
            this.retryDelay = millis;
            return this;
        }

        /**
         * Growth factor of the retry backoff.
         * Default: 2.0
         */
        public Builder withBackoffFactor(double factor) {
            if (factor < 1.0) {
                throw new IllegalArgumentException("backoffFactor must be >= 1.0");
            }
            this.backoffFactor = factor;
            return this;
        }

        /**
         * Cap of the retry backoff in milliseconds.
         * Default: 30000 ms
         */
        public Builder withMaxRetryDelay(long millis) {
            requireNonNegative(millis, "maxRetryDelay");
            this.maxRetryDelay = millis;
            return this;
        }

        /**
         * Per-attempt processing timeout in milliseconds.
         * Default: 300000 ms (5 minutes)
         */
        public Builder withTimeout(long millis) {
            if (millis < 1) {
                throw new IllegalArgumentException("timeout must be >= 1");
            }
            this.timeout = millis;
            return this;
        }

        /**
         * Pause between two batches in milliseconds.
         * Default: 100 ms
         */
        public Builder withBatchDelay(long millis) {
            requireNonNegative(millis, "batchDelay");
            this.batchDelay = millis;
            return this;
        }

        /**
         * Random source for backoff jitter. Pass a seeded instance for reproducible delays.
         */
        public Builder withRandom(Random random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public QueueConfig build() {
            return new QueueConfig(this);
        }

        private static void requireNonNegative(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
        }
    }
}

package com.umitunal.batchq.retry;

import java.util.Objects;
import java.util.Random;

/**
 * Jittered exponential backoff.
 *
 * <pre>
 * delay = min(baseDelay * factor^(attempt - 1) * jitter, maxDelay),  jitter in [0.5, 1.0)
 * </pre>
 *
 * <p>Seed the {@link Random} to make the sequence of delays reproducible.
 */
public class BackoffCalculator {
    private final long baseDelayMillis;
    private final double backoffFactor;
    private final long maxDelayMillis;
    private final Random random;

    public BackoffCalculator(long baseDelayMillis, double backoffFactor, long maxDelayMillis) {
        this(baseDelayMillis, backoffFactor, maxDelayMillis, new Random());
    }

    public BackoffCalculator(long baseDelayMillis, double backoffFactor, long maxDelayMillis, Random random) {
        if (baseDelayMillis < 0 || maxDelayMillis < 0) {
            throw new IllegalArgumentException("Delays must be >= 0");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0");
        }
        this.baseDelayMillis = baseDelayMillis;
        this.backoffFactor = backoffFactor;
        this.maxDelayMillis = maxDelayMillis;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Delay before the retry that follows failed attempt {@code attempt}.
     *
     * @param attempt 1-based attempt number; values below 1 are treated as 1
     * @return delay in milliseconds, never negative
     */
    public long delay(int attempt) {
        int exponent = Math.max(attempt, 1) - 1;
        double exponential = baseDelayMillis * Math.pow(backoffFactor, exponent);
        double jitter;
        synchronized (random) {
            jitter = 0.5 + random.nextDouble() * 0.5;
        }
        return (long) Math.min(exponential * jitter, maxDelayMillis);
    }

    public long getBaseDelayMillis() { return baseDelayMillis; }
    public double getBackoffFactor() { return backoffFactor; }
    public long getMaxDelayMillis() { return maxDelayMillis; }
}

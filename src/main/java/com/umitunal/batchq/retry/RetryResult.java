package com.umitunal.batchq.retry;

/**
 * Outcome of {@link RetryExecutor#execute}.
 *
 * @param <V> the type of the operation's value
 */
public class RetryResult<V> {
    private final boolean success;
    private final V value;
    private final Throwable error;
    private final int attempts;
    private final long totalDelay;

    private RetryResult(boolean success, V value, Throwable error, int attempts, long totalDelay) {
        this.success = success;
        this.value = value;
        this.error = error;
        this.attempts = attempts;
        this.totalDelay = totalDelay;
    }

    static <V> RetryResult<V> success(V value, int attempts, long totalDelay) {
        return new RetryResult<>(true, value, null, attempts, totalDelay);
    }

    static <V> RetryResult<V> failure(Throwable error, int attempts, long totalDelay) {
        return new RetryResult<>(false, null, error, attempts, totalDelay);
    }

    public boolean isSuccess() { return success; }
    public V getValue() { return value; }

    /**
     * The last failure, null on success.
     */
    public Throwable getError() { return error; }

    /**
     * Number of attempts actually made.
     */
    public int getAttempts() { return attempts; }

    /**
     * Sum of the backoff delays slept, in milliseconds.
     */
    public long getTotalDelay() { return totalDelay; }

    @Override
    public String toString() {
        return String.format("RetryResult{success=%s, attempts=%d, totalDelay=%d}", success, attempts, totalDelay);
    }
}

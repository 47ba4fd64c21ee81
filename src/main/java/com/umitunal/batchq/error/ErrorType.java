package com.umitunal.batchq.error;

/**
 * Classes of failure an item can end with.
 */
public enum ErrorType {
    NETWORK(true),
    AUTHENTICATION(false),
    AUTHORIZATION(false),
    RATE_LIMIT(true),
    VALIDATION(false),
    SERVER_ERROR(true),
    TIMEOUT(true),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Checks if a failure of this class is transient and worth another attempt.
     */
    public boolean isRetryable() {
        return retryable;
    }
}

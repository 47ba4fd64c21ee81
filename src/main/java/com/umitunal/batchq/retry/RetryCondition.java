package com.umitunal.batchq.retry;

import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.error.ClassifiedError;

/**
 * Decides whether a failed queue item gets another attempt while it still has retries
 * left. Returning false fails the item immediately.
 */
@FunctionalInterface
public interface RetryCondition {

    boolean shouldRetry(ClassifiedError error, WorkItem<?> item);

    /**
     * Retry every failure until the item's retries are used up.
     */
    static RetryCondition always() {
        return (error, item) -> true;
    }

    /**
     * Retry only NETWORK, RATE_LIMIT, TIMEOUT and SERVER_ERROR failures.
     */
    static RetryCondition retryableOnly() {
        return (error, item) -> error.isRetryable();
    }
}

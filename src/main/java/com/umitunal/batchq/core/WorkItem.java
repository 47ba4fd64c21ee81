package com.umitunal.batchq.core;

import com.umitunal.batchq.error.ErrorType;

import java.util.Map;
import java.util.Set;

/**
 * A work item owned by a queue, with its full state.
 *
 * <p>Identity, payload and scheduling attributes are fixed at submission. Status and
 * bookkeeping fields change only through the owning {@link ItemRegistry}. The transition
 * methods are atomic per item and refuse to leave a terminal status; callers outside the
 * engine get a read-only view.
 *
 * @param <T> the type of the payload
 */
public class WorkItem<T> {
    private final String id;
    private final T payload;
    private final Priority priority;
    private final Set<String> dependencies;
    private final int maxRetries;
    private final Map<String, Object> metadata;
    private final long createdAt;
    private final long sequence;

    private volatile ItemStatus status;
    private volatile long startedAt;
    private volatile long completedAt;
    private volatile int retryCount;
    private volatile long notBefore;
    private volatile String error;
    private volatile ErrorType errorType;
    private volatile Object result;
    private volatile String resolution;

    WorkItem(WorkRequest<T> request, int maxRetries, long sequence) {
        this.id = request.getId();
        this.payload = request.getPayload();
        this.priority = request.getPriority();
        this.dependencies = request.getDependencies();
        this.maxRetries = maxRetries;
        this.metadata = request.getMetadata();
        this.createdAt = System.currentTimeMillis();
        this.sequence = sequence;
        this.status = ItemStatus.PENDING;
        this.retryCount = 0;
    }

    public String getId() { return id; }
    public T getPayload() { return payload; }
    public Priority getPriority() { return priority; }
    public Set<String> getDependencies() { return dependencies; }
    public int getMaxRetries() { return maxRetries; }
    public Map<String, Object> getMetadata() { return metadata; }
    public long getCreatedAt() { return createdAt; }
    public ItemStatus getStatus() { return status; }
    public int getRetryCount() { return retryCount; }
    public String getError() { return error; }
    public ErrorType getErrorType() { return errorType; }
    public Object getResult() { return result; }

    /**
     * Insertion order within the owning queue, used to break createdAt ties.
     */
    public long getSequence() { return sequence; }

    /**
     * Start of the most recent attempt in millis since epoch, 0 if never started.
     */
    public long getStartedAt() { return startedAt; }

    /**
     * Time the item reached a terminal status, 0 while it has not.
     */
    public long getCompletedAt() { return completedAt; }

    /**
     * Earliest time a retry may be selected, 0 when there is no pending backoff.
     */
    public long getNotBefore() { return notBefore; }

    /**
     * Outcome of the error resolver for the last failure, if one ran.
     */
    public String getResolution() { return resolution; }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Checks if the retry backoff, if any, has elapsed.
     */
    public boolean isReady(long now) {
        return now >= notBefore;
    }

    synchronized boolean markProcessing() {
        if (status != ItemStatus.PENDING) {
            return false;
        }
        this.status = ItemStatus.PROCESSING;
        this.startedAt = System.currentTimeMillis();
        this.notBefore = 0;
        return true;
    }

    synchronized boolean markCompleted(Object result) {
        if (status != ItemStatus.PROCESSING) {
            return false;
        }
        this.result = result;
        this.completedAt = System.currentTimeMillis();
        this.status = ItemStatus.COMPLETED;
        return true;
    }

    /**
     * Record a failed attempt.
     *
     * @return the new retry count, or -1 if the item is no longer PROCESSING
     */
    synchronized int recordFailure(String message, ErrorType type) {
        if (status != ItemStatus.PROCESSING) {
            return -1;
        }
        this.error = message;
        this.errorType = type;
        this.retryCount++;
        return retryCount;
    }

    synchronized boolean scheduleRetry(long notBefore) {
        if (status != ItemStatus.PROCESSING || retryCount >= maxRetries) {
            return false;
        }
        this.notBefore = notBefore;
        this.status = ItemStatus.PENDING;
        return true;
    }

    synchronized boolean markFailed() {
        if (status != ItemStatus.PROCESSING) {
            return false;
        }
        this.completedAt = System.currentTimeMillis();
        this.status = ItemStatus.FAILED;
        return true;
    }

    synchronized boolean cancel() {
        if (status != ItemStatus.PENDING && status != ItemStatus.PROCESSING) {
            return false;
        }
        this.completedAt = System.currentTimeMillis();
        this.status = ItemStatus.CANCELLED;
        return true;
    }

    void setResolution(String resolution) {
        this.resolution = resolution;
    }

    @Override
    public String toString() {
        return String.format("WorkItem{id='%s', priority=%s, status=%s, retry=%d/%d, dependencies=%s}",
                id, priority, status, retryCount, maxRetries, dependencies);
    }
}

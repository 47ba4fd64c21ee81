package com.umitunal.batchq.core;

/**
 * Lifecycle states of a work item.
 *
 * <p>PENDING -> PROCESSING -> COMPLETED | PENDING (retry) | FAILED.
 * PENDING or PROCESSING -> CANCELLED only through an explicit stop.
 */
public enum ItemStatus {
    PENDING,     // Waiting for selection
    PROCESSING,  // Handed to a worker
    COMPLETED,   // Processor returned successfully
    FAILED,      // Retries exhausted or short-circuited
    CANCELLED;   // Stopped by the caller

    /**
     * Checks if no further transition can happen from this state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

package com.umitunal.batchq.core;

/**
 * Thrown when a queue is asked to start while a run is already in progress.
 */
public class QueueConflictException extends IllegalStateException {

    public QueueConflictException(String message) {
        super(message);
    }
}

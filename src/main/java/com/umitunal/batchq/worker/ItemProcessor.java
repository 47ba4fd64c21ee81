package com.umitunal.batchq.worker;

import com.umitunal.batchq.core.WorkItem;

/**
 * The work a queue performs for each item.
 *
 * <p>Implementations run on worker threads. When an attempt times out or the queue is
 * stopped, the worker thread is interrupted; processors that check the interrupt flag or
 * use interruptible I/O stop early, others run to completion and their outcome is
 * discarded.
 *
 * @param <T> the type of item payload
 */
@FunctionalInterface
public interface ItemProcessor<T> {

    /**
     * Process an item and return its result.
     *
     * @param item the item to process, in PROCESSING state
     * @return result stored on the item when it completes, may be null
     * @throws Exception if the attempt failed; the failure is classified and may be retried
     */
    Object process(WorkItem<T> item) throws Exception;
}

package com.umitunal.batchq.worker;

import com.umitunal.batchq.core.WorkItem;

/**
 * Notified when an item reaches COMPLETED or FAILED inside a worker pool.
 *
 * @param <T> the type of item payload
 */
@FunctionalInterface
public interface ItemSettledListener<T> {

    void onSettled(WorkItem<T> item);
}

package com.umitunal.batchq.core;

import com.umitunal.batchq.worker.ItemProcessor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Core interface for an in-process priority queue that runs items in bounded batches,
 * gated by dependencies, with per-item timeout and retry.
 *
 * @param <T> the type of item payload
 */
public interface BatchQueue<T> extends AutoCloseable {

    /**
     * Submit items. Each becomes PENDING with a retry count of 0. Re-adding an id replaces
     * the existing record.
     */
    void add(List<WorkRequest<T>> requests);

    /**
     * Submit a single item.
     */
    void addItem(WorkRequest<T> request);

    /**
     * Run until no eligible PENDING item remains or {@link #stop()} is called.
     *
     * @param processor the work to perform for each item
     * @return the items that reached a terminal status during this run, in settle order
     * @throws QueueConflictException if a run is already in progress
     */
    List<WorkItem<T>> start(ItemProcessor<T> processor);

    /**
     * Same as {@link #start(ItemProcessor)}, on a dedicated control thread.
     */
    CompletableFuture<List<WorkItem<T>>> startAsync(ItemProcessor<T> processor);

    /**
     * Cancel every PROCESSING item and halt batch selection.
     */
    void stop();

    /**
     * Remove all items and reset the queue.
     */
    void clear();

    /**
     * Remove COMPLETED items.
     *
     * @return number of items removed
     */
    int clearCompleted();

    List<WorkItem<T>> getItems();

    Optional<WorkItem<T>> getItem(String id);

    /**
     * PENDING items that cannot pass the dependency gate.
     */
    List<WorkItem<T>> getBlockedItems();

    /**
     * Ids of the dependencies keeping an item from running, empty for unknown ids.
     */
    List<String> getUnmetDependencies(String id);

    QueueStats getStats();

    boolean isRunning();
}

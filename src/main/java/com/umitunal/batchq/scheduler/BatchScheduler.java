package com.umitunal.batchq.scheduler;

import com.umitunal.batchq.core.ItemRegistry;
import com.umitunal.batchq.core.ItemStatus;
import com.umitunal.batchq.core.WorkItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;

/**
 * Picks the next batch of eligible items.
 *
 * <p>An item is eligible when it is PENDING, not in flight, past its retry backoff and its
 * dependencies are COMPLETED. Eligible items are ordered by priority (highest first), then
 * creation time, then insertion order, and the batch is cut to the free concurrency slots.
 *
 * @param <T> the type of item payload
 */
public class BatchScheduler<T> {

    /**
     * Selection order: priority descending, then FIFO.
     */
    public static final Comparator<WorkItem<?>> SELECTION_ORDER =
            Comparator.<WorkItem<?>>comparingInt(item -> -item.getPriority().getWeight())
                    .thenComparingLong(WorkItem::getCreatedAt)
                    .thenComparingLong(WorkItem::getSequence);

    private final ItemRegistry<T> registry;
    private final DependencyGate<T> gate;
    private final int maxConcurrency;

    public BatchScheduler(ItemRegistry<T> registry, DependencyGate<T> gate, int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        this.registry = registry;
        this.gate = gate;
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * The items to start now. Empty when nothing is eligible, even if PENDING items remain.
     */
    public List<WorkItem<T>> nextBatch(long now) {
        int slots = maxConcurrency - registry.inFlightCount();
        if (slots <= 0) {
            return List.of();
        }

        List<WorkItem<T>> eligible = new ArrayList<>();
        for (WorkItem<T> item : registry.snapshot()) {
            if (isEligible(item, now)) {
                eligible.add(item);
            }
        }
        eligible.sort(SELECTION_ORDER);

        return eligible.size() <= slots ? eligible : new ArrayList<>(eligible.subList(0, slots));
    }

    public boolean isEligible(WorkItem<T> item, long now) {
        return item.getStatus() == ItemStatus.PENDING
                && !registry.isInFlight(item.getId())
                && item.isReady(now)
                && gate.canRun(item);
    }

    /**
     * Earliest time an item now held back only by its retry backoff becomes eligible.
     */
    public OptionalLong nextRetryTime(long now) {
        long earliest = Long.MAX_VALUE;
        for (WorkItem<T> item : registry.withStatus(ItemStatus.PENDING)) {
            if (!item.isReady(now) && !registry.isInFlight(item.getId()) && gate.canRun(item)) {
                earliest = Math.min(earliest, item.getNotBefore());
            }
        }
        return earliest == Long.MAX_VALUE ? OptionalLong.empty() : OptionalLong.of(earliest);
    }

    /**
     * PENDING items that fail the dependency gate.
     */
    public List<WorkItem<T>> blockedItems() {
        List<WorkItem<T>> blocked = new ArrayList<>();
        for (WorkItem<T> item : registry.withStatus(ItemStatus.PENDING)) {
            if (!gate.canRun(item)) {
                blocked.add(item);
            }
        }
        return blocked;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }
}

package com.umitunal.batchq.core;

import com.umitunal.batchq.error.ErrorType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Item store of one queue plus its in-flight set.
 *
 * <p>Both structures are concurrent, so introspection may read them while a run mutates them.
 *
 * <p>Item status changes only through this class. Each transition applies to an item this
 * registry currently holds and is refused for any other instance, including an item that
 * has since been replaced under the same id.
 *
 * @param <T> the type of item payload
 */
public class ItemRegistry<T> {
    private final ConcurrentMap<String, WorkItem<T>> items = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong(0);

    /**
     * Register a request as a new PENDING item, replacing any item with the same id.
     */
    public WorkItem<T> register(WorkRequest<T> request, int defaultMaxRetries) {
        int maxRetries = request.getMaxRetries() != null ? request.getMaxRetries() : defaultMaxRetries;
        WorkItem<T> item = new WorkItem<>(request, maxRetries, sequence.incrementAndGet());
        items.put(item.getId(), item);
        return item;
    }

    public Optional<WorkItem<T>> get(String id) {
        return Optional.ofNullable(items.get(id));
    }

    public boolean contains(String id) {
        return items.containsKey(id);
    }

    /**
     * Snapshot of all items in insertion order.
     */
    public List<WorkItem<T>> snapshot() {
        List<WorkItem<T>> list = new ArrayList<>(items.values());
        list.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));
        return list;
    }

    public List<WorkItem<T>> withStatus(ItemStatus status) {
        List<WorkItem<T>> list = new ArrayList<>();
        for (WorkItem<T> item : snapshot()) {
            if (item.getStatus() == status) {
                list.add(item);
            }
        }
        return list;
    }

    public boolean anyWithStatus(ItemStatus status) {
        for (WorkItem<T> item : items.values()) {
            if (item.getStatus() == status) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return items.size();
    }

    public int removeIf(Predicate<WorkItem<T>> filter) {
        int removed = 0;
        for (WorkItem<T> item : items.values()) {
            if (filter.test(item) && items.remove(item.getId(), item)) {
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        items.clear();
        inFlight.clear();
    }

    public boolean startAttempt(WorkItem<T> item) {
        return owns(item) && item.markProcessing();
    }

    public boolean complete(WorkItem<T> item, Object result) {
        return owns(item) && item.markCompleted(result);
    }

    /**
     * @return the new retry count, or -1 if the item is not owned or no longer PROCESSING
     */
    public int recordFailure(WorkItem<T> item, String message, ErrorType type) {
        return owns(item) ? item.recordFailure(message, type) : -1;
    }

    public boolean scheduleRetry(WorkItem<T> item, long notBefore) {
        return owns(item) && item.scheduleRetry(notBefore);
    }

    public boolean fail(WorkItem<T> item) {
        return owns(item) && item.markFailed();
    }

    public boolean cancel(WorkItem<T> item) {
        return owns(item) && item.cancel();
    }

    public void recordResolution(WorkItem<T> item, String action) {
        if (owns(item)) {
            item.setResolution(action);
        }
    }

    private boolean owns(WorkItem<T> item) {
        return item != null && items.get(item.getId()) == item;
    }

    public void markInFlight(String id) {
        inFlight.add(id);
    }

    public void releaseInFlight(String id) {
        inFlight.remove(id);
    }

    public boolean isInFlight(String id) {
        return inFlight.contains(id);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public Set<String> inFlightIds() {
        return Collections.unmodifiableSet(inFlight);
    }

    public void clearInFlight() {
        inFlight.clear();
    }
}

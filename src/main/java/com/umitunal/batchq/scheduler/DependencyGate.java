package com.umitunal.batchq.scheduler;

import com.umitunal.batchq.core.ItemRegistry;
import com.umitunal.batchq.core.ItemStatus;
import com.umitunal.batchq.core.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an item's prerequisites are satisfied.
 *
 * @param <T> the type of item payload
 */
public class DependencyGate<T> {
    private final ItemRegistry<T> registry;

    public DependencyGate(ItemRegistry<T> registry) {
        this.registry = registry;
    }

    /**
     * True if every dependency exists and is COMPLETED.
     */
    public boolean canRun(WorkItem<T> item) {
        for (String depId : item.getDependencies()) {
            Optional<WorkItem<T>> dep = registry.get(depId);
            if (dep.isEmpty() || dep.get().getStatus() != ItemStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    /**
     * Dependencies that are missing or not yet COMPLETED.
     */
    public List<String> unmetDependencies(WorkItem<T> item) {
        List<String> unmet = new ArrayList<>();
        for (String depId : item.getDependencies()) {
            Optional<WorkItem<T>> dep = registry.get(depId);
            if (dep.isEmpty() || dep.get().getStatus() != ItemStatus.COMPLETED) {
                unmet.add(depId);
            }
        }
        return unmet;
    }

    /**
     * True if some dependency can never complete: it was never submitted or it ended
     * FAILED or CANCELLED.
     */
    public boolean isPermanentlyBlocked(WorkItem<T> item) {
        for (String depId : item.getDependencies()) {
            Optional<WorkItem<T>> dep = registry.get(depId);
            if (dep.isEmpty()) {
                return true;
            }
            ItemStatus status = dep.get().getStatus();
            if (status == ItemStatus.FAILED || status == ItemStatus.CANCELLED) {
                return true;
            }
        }
        return false;
    }
}

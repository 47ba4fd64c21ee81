package com.umitunal.batchq.serialization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.umitunal.batchq.core.BatchQueue;
import com.umitunal.batchq.core.ItemStatus;
import com.umitunal.batchq.core.Priority;
import com.umitunal.batchq.core.QueueStats;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.error.ErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serializable snapshot of a queue: statistics plus one summary per item.
 * Payloads and results are left out.
 */
public class QueueReport {
    private final long generatedAt;
    private final Stats stats;
    private final List<Item> items;

    @JsonCreator
    public QueueReport(@JsonProperty("generatedAt") long generatedAt,
                       @JsonProperty("stats") Stats stats,
                       @JsonProperty("items") List<Item> items) {
        this.generatedAt = generatedAt;
        this.stats = stats;
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Take a snapshot of the queue.
     */
    public static QueueReport of(BatchQueue<?> queue) {
        return build(queue);
    }

    private static <T> QueueReport build(BatchQueue<T> queue) {
        List<Item> items = new ArrayList<>();
        for (WorkItem<T> item : queue.getItems()) {
            List<String> unmet = item.getStatus() == ItemStatus.PENDING
                    ? queue.getUnmetDependencies(item.getId())
                    : List.of();
            items.add(new Item(item.getId(), item.getPriority(), item.getStatus(), item.getRetryCount(),
                    item.getMaxRetries(), item.getError(), item.getErrorType(), item.getCreatedAt(),
                    item.getStartedAt(), item.getCompletedAt(), item.getDependencies(), unmet,
                    item.getMetadata()));
        }
        return new QueueReport(System.currentTimeMillis(), Stats.from(queue.getStats()), items);
    }

    public long getGeneratedAt() { return generatedAt; }
    public Stats getStats() { return stats; }
    public List<Item> getItems() { return items; }

    public static class Stats {
        private final long total;
        private final long pending;
        private final long processing;
        private final long completed;
        private final long failed;
        private final long cancelled;
        private final long blocked;
        private final double averageProcessingTime;
        private final double throughput;

        @JsonCreator
        public Stats(@JsonProperty("total") long total,
                     @JsonProperty("pending") long pending,
                     @JsonProperty("processing") long processing,
                     @JsonProperty("completed") long completed,
                     @JsonProperty("failed") long failed,
                     @JsonProperty("cancelled") long cancelled,
                     @JsonProperty("blocked") long blocked,
                     @JsonProperty("averageProcessingTime") double averageProcessingTime,
                     @JsonProperty("throughput") double throughput) {
            this.total = total;
            this.pending = pending;
            this.processing = processing;
            this.completed = completed;
            this.failed = failed;
            this.cancelled = cancelled;
            this.blocked = blocked;
            this.averageProcessingTime = averageProcessingTime;
            this.throughput = throughput;
        }

        static Stats from(QueueStats stats) {
            return new Stats(stats.getTotal(), stats.getPending(), stats.getProcessing(), stats.getCompleted(),
                    stats.getFailed(), stats.getCancelled(), stats.getBlocked(),
                    stats.getAverageProcessingTime(), stats.getThroughput());
        }

        public long getTotal() { return total; }
        public long getPending() { return pending; }
        public long getProcessing() { return processing; }
        public long getCompleted() { return completed; }
        public long getFailed() { return failed; }
        public long getCancelled() { return cancelled; }
        public long getBlocked() { return blocked; }
        public double getAverageProcessingTime() { return averageProcessingTime; }
        public double getThroughput() { return throughput; }
    }

    public static class Item {
        private final String id;
        private final Priority priority;
        private final ItemStatus status;
        private final int retryCount;
        private final int maxRetries;
        private final String error;
        private final ErrorType errorType;
        private final long createdAt;
        private final long startedAt;
        private final long completedAt;
        private final Set<String> dependencies;
        private final List<String> unmetDependencies;
        private final Map<String, Object> metadata;

        @JsonCreator
        public Item(@JsonProperty("id") String id,
                    @JsonProperty("priority") Priority priority,
                    @JsonProperty("status") ItemStatus status,
                    @JsonProperty("retryCount") int retryCount,
                    @JsonProperty("maxRetries") int maxRetries,
                    @JsonProperty("error") String error,
                    @JsonProperty("errorType") ErrorType errorType,
                    @JsonProperty("createdAt") long createdAt,
                    @JsonProperty("startedAt") long startedAt,
                    @JsonProperty("completedAt") long completedAt,
                    @JsonProperty("dependencies") Set<String> dependencies,
                    @JsonProperty("unmetDependencies") List<String> unmetDependencies,
                    @JsonProperty("metadata") Map<String, Object> metadata) {
            this.id = id;
            this.priority = priority;
            this.status = status;
            this.retryCount = retryCount;
            this.maxRetries = maxRetries;
            this.error = error;
            this.errorType = errorType;
            this.createdAt = createdAt;
            this.startedAt = startedAt;
            this.completedAt = completedAt;
            this.dependencies = dependencies == null ? Set.of() : dependencies;
            this.unmetDependencies = unmetDependencies == null ? List.of() : unmetDependencies;
            this.metadata = metadata == null ? Map.of() : metadata;
        }

        public String getId() { return id; }
        public Priority getPriority() { return priority; }
        public ItemStatus getStatus() { return status; }
        public int getRetryCount() { return retryCount; }
        public int getMaxRetries() { return maxRetries; }
        public String getError() { return error; }
        public ErrorType getErrorType() { return errorType; }
        public long getCreatedAt() { return createdAt; }
        public long getStartedAt() { return startedAt; }
        public long getCompletedAt() { return completedAt; }
        public Set<String> getDependencies() { return dependencies; }
        public List<String> getUnmetDependencies() { return unmetDependencies; }
        public Map<String, Object> getMetadata() { return metadata; }
    }
}

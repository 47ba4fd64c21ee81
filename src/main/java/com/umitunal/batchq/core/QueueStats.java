package com.umitunal.batchq.core;

import java.util.Objects;

/**
 * Point-in-time statistics for a queue.
 */
public class QueueStats {
    private final long total;
    private final long pending;
    private final long processing;
    private final long completed;
    private final long failed;
    private final long cancelled;
    private final long blocked;
    private final double averageProcessingTime;
    private final double throughput;

    public QueueStats(long total, long pending, long processing, long completed, long failed,
                      long cancelled, long blocked, double averageProcessingTime, double throughput) {
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

    public long getTotal() { return total; }
    public long getPending() { return pending; }
    public long getProcessing() { return processing; }
    public long getCompleted() { return completed; }
    public long getFailed() { return failed; }
    public long getCancelled() { return cancelled; }

    /**
     * PENDING items whose dependencies are not all COMPLETED.
     */
    public long getBlocked() { return blocked; }

    /**
     * Mean of (completedAt - startedAt) over COMPLETED items, in milliseconds.
     */
    public double getAverageProcessingTime() { return averageProcessingTime; }

    /**
     * COMPLETED items per minute over the current or last run.
     */
    public double getThroughput() { return throughput; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueStats)) return false;
        QueueStats that = (QueueStats) o;
        return total == that.total && pending == that.pending && processing == that.processing
                && completed == that.completed && failed == that.failed && cancelled == that.cancelled
                && blocked == that.blocked
                && Double.compare(averageProcessingTime, that.averageProcessingTime) == 0
                && Double.compare(throughput, that.throughput) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(total, pending, processing, completed, failed, cancelled, blocked,
                averageProcessingTime, throughput);
    }

    @Override
    public String toString() {
        return String.format(
            "QueueStats{total=%d, pending=%d, processing=%d, completed=%d, failed=%d, cancelled=%d, " +
            "blocked=%d, avgMs=%.1f, perMinute=%.2f}",
            total, pending, processing, completed, failed, cancelled, blocked,
            averageProcessingTime, throughput
        );
    }
}

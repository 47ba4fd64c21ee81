package com.umitunal.batchq.core;

import java.util.List;

/**
 * Hooks a queue invokes while it runs. Callbacks run on worker or control threads and
 * must not block for long.
 */
public final class QueueCallbacks {

    private QueueCallbacks() {
    }

    @FunctionalInterface
    public interface ProgressCallback<T> {
        /**
         * Called after each successful item.
         *
         * @param completed items completed so far in this run
         * @param total items currently registered
         * @param item the item that just completed
         */
        void onProgress(int completed, int total, WorkItem<T> item);
    }

    @FunctionalInterface
    public interface ErrorCallback<T> {
        /**
         * Called once when an item ends FAILED.
         */
        void onError(Throwable error, WorkItem<T> item);
    }

    @FunctionalInterface
    public interface RetryCallback<T> {
        /**
         * Called when a failed item is put back for another attempt.
         *
         * @param attempt the attempt that failed (1-based)
         * @param delayMillis backoff before the item becomes eligible again
         */
        void onRetry(int attempt, Throwable error, long delayMillis, WorkItem<T> item);
    }

    @FunctionalInterface
    public interface CompleteCallback<T> {
        /**
         * Called when a run ends, with the items settled during it.
         */
        void onComplete(List<WorkItem<T>> settled);
    }
}

package com.umitunal.batchq.worker;

import com.umitunal.batchq.core.ItemRegistry;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.error.ItemTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs batches of items on worker threads, each attempt raced against a timeout.
 *
 * <p>Worker threads are created on demand; the scheduler bounds how many items run at once.
 * A timed out or cancelled attempt interrupts its worker thread.
 *
 * <p>The timer thread only completes futures. Settling an attempt, resolver and callbacks
 * included, runs on a worker thread, so a slow resolver cannot delay another item's timeout.
 *
 * @param <T> the type of item payload
 */
public class WorkerPool<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ItemRegistry<T> registry;
    private final RetryCoordinator<T> retryCoordinator;
    private final ItemSettledListener<T> settledListener;
    private final long timeout;
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final Map<String, Attempt> running = new ConcurrentHashMap<>();

    public WorkerPool(ItemRegistry<T> registry, RetryCoordinator<T> retryCoordinator,
                      ItemSettledListener<T> settledListener, long timeout) {
        this.registry = registry;
        this.retryCoordinator = retryCoordinator;
        this.settledListener = settledListener;
        this.timeout = timeout;
        this.workers = Executors.newCachedThreadPool(daemonThreads("batchq-worker-"));
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("batchq-timer-"));
    }

    /**
     * Start every item of the batch.
     *
     * @return a future that completes once every attempt of the batch has settled
     */
    public CompletableFuture<Void> runBatch(List<WorkItem<T>> batch, ItemProcessor<T> processor) {
        List<CompletableFuture<Void>> settled = new ArrayList<>(batch.size());

        for (WorkItem<T> item : batch) {
            registry.markInFlight(item.getId());
            if (!registry.startAttempt(item)) {
                registry.releaseInFlight(item.getId());
                continue;
            }
            settled.add(processWithTimeout(processor, item)
                    .handleAsync((result, error) -> {
                        settle(item, result, error);
                        return null;
                    }, this::executeSettle));
        }

        return CompletableFuture.allOf(settled.toArray(new CompletableFuture<?>[0]));
    }

    /**
     * Run one attempt; the returned future fails with {@link ItemTimeoutException} if the
     * processor has not finished within the timeout.
     */
    public CompletableFuture<Object> processWithTimeout(ItemProcessor<T> processor, WorkItem<T> item) {
        CompletableFuture<Object> outcome = new CompletableFuture<>();

        Future<?> task;
        try {
            task = workers.submit(() -> {
                try {
                    outcome.complete(processor.process(item));
                } catch (Throwable t) {
                    outcome.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            outcome.completeExceptionally(e);
            return outcome;
        }

        ScheduledFuture<?> timer = timers.schedule(() -> {
            if (outcome.completeExceptionally(new ItemTimeoutException(item.getId(), timeout))) {
                task.cancel(true);
            }
        }, timeout, TimeUnit.MILLISECONDS);

        Attempt attempt = new Attempt(outcome, task);
        running.put(item.getId(), attempt);
        outcome.whenComplete((result, error) -> {
            timer.cancel(false);
            running.remove(item.getId(), attempt);
        });
        return outcome;
    }

    /**
     * Abandon the running attempt of an item, interrupting its worker thread.
     */
    public void cancel(String itemId) {
        Attempt attempt = running.remove(itemId);
        if (attempt != null) {
            attempt.outcome.cancel(false);
            attempt.task.cancel(true);
        }
    }

    public int getRunningCount() {
        return running.size();
    }

    @Override
    public void close() {
        timers.shutdownNow();
        workers.shutdownNow();
    }

    private void settle(WorkItem<T> item, Object result, Throwable error) {
        try {
            if (error == null) {
                if (registry.complete(item, result)) {
                    log.debug("Item {} completed in {}ms", item.getId(), item.getCompletedAt() - item.getStartedAt());
                    settledListener.onSettled(item);
                }
            } else if (error instanceof CancellationException) {
                log.debug("Attempt of item {} cancelled", item.getId());
            } else if (retryCoordinator.handleFailure(item, error) == RetryCoordinator.Outcome.FAILED) {
                settledListener.onSettled(item);
            }
        } catch (RuntimeException e) {
            log.warn("Error while settling item {}", item.getId(), e);
        } finally {
            registry.releaseInFlight(item.getId());
        }
    }

    // after close() the remaining settles run on the calling thread
    private void executeSettle(Runnable command) {
        try {
            workers.execute(command);
        } catch (RejectedExecutionException e) {
            command.run();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Attempt {
        private final CompletableFuture<Object> outcome;
        private final Future<?> task;

        Attempt(CompletableFuture<Object> outcome, Future<?> task) {
            this.outcome = outcome;
            this.task = task;
        }
    }
}

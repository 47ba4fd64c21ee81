package com.umitunal.batchq.queue;

import com.umitunal.batchq.config.QueueConfig;
import com.umitunal.batchq.core.BatchQueue;
import com.umitunal.batchq.core.ItemRegistry;
import com.umitunal.batchq.core.ItemStatus;
import com.umitunal.batchq.core.QueueCallbacks;
import com.umitunal.batchq.core.QueueConflictException;
import com.umitunal.batchq.core.QueueStats;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.core.WorkRequest;
import com.umitunal.batchq.error.ErrorClassifier;
import com.umitunal.batchq.error.ErrorResolver;
import com.umitunal.batchq.retry.RetryCondition;
import com.umitunal.batchq.scheduler.BatchScheduler;
import com.umitunal.batchq.scheduler.DependencyGate;
import com.umitunal.batchq.worker.ItemProcessor;
import com.umitunal.batchq.worker.RetryCoordinator;
import com.umitunal.batchq.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link BatchQueue}.
 *
 * <p>A run is a single control loop: select the next batch, run it on the worker pool,
 * wait for every attempt to settle, pause, repeat. The loop ends when no PENDING item is
 * left, or when the remaining PENDING items can never become eligible (blocked by a
 * dependency that is missing, FAILED or CANCELLED). Items waiting out a retry backoff keep
 * the loop alive until their delay has elapsed.
 *
 * <pre>{@code
 * try (PriorityBatchQueue<Order> queue = PriorityBatchQueue.<Order>builder()
 *         .withConfig(QueueConfig.newBuilder().withMaxConcurrency(3).build())
 *         .onError((error, item) -> alerts.raise(item.getId(), error))
 *         .build()) {
 *     queue.add(BatchTemplates.syncBatch(orders, Priority.HIGH));
 *     List<WorkItem<Order>> settled = queue.start(item -> erp.push(item.getPayload()));
 * }
 * }</pre>
 *
 * @param <T> the type of item payload
 */
public class PriorityBatchQueue<T> implements BatchQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(PriorityBatchQueue.class);

    private final QueueConfig config;
    private final ItemRegistry<T> registry;
    private final DependencyGate<T> gate;
    private final BatchScheduler<T> scheduler;
    private final WorkerPool<T> workerPool;
    private final QueueCallbacks.ProgressCallback<T> onProgress;
    private final QueueCallbacks.CompleteCallback<T> onComplete;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger completedInRun = new AtomicInteger(0);
    private final Object dispatchLock = new Object();
    private final Object pauseLock = new Object();
    private volatile boolean stopRequested;
    private volatile long runStartedAt;
    private volatile long runEndedAt;
    private volatile List<WorkItem<T>> settled = new CopyOnWriteArrayList<>();

    public PriorityBatchQueue() {
        this(QueueConfig.defaults());
    }

    public PriorityBatchQueue(QueueConfig config) {
        this(PriorityBatchQueue.<T>builder().withConfig(config));
    }

    private PriorityBatchQueue(Builder<T> builder) {
        this.config = builder.config;
        this.registry = new ItemRegistry<>();
        this.gate = new DependencyGate<>(registry);
        this.scheduler = new BatchScheduler<>(registry, gate, config.getMaxConcurrency());
        this.onProgress = builder.onProgress;
        this.onComplete = builder.onComplete;

        RetryCoordinator<T> retryCoordinator = new RetryCoordinator<>(registry,
                config.newBackoffCalculator(), builder.classifier, builder.retryCondition,
                builder.resolver, builder.onRetry, builder.onError);
        this.workerPool = new WorkerPool<>(registry, retryCoordinator, this::onSettled, config.getTimeout());
    }

    @Override
    public void add(List<WorkRequest<T>> requests) {
        for (WorkRequest<T> request : requests) {
            WorkItem<T> previous = registry.get(request.getId()).orElse(null);
            registry.register(request, config.getMaxRetries());
            if (previous != null) {
                log.debug("Replaced item {} (was {})", request.getId(), previous.getStatus());
            }
        }
    }

    @Override
    public void addItem(WorkRequest<T> request) {
        add(List.of(request));
    }

    @Override
    public List<WorkItem<T>> start(ItemProcessor<T> processor) {
        Objects.requireNonNull(processor, "processor");
        beginRun();
        return runLoop(processor);
    }

    @Override
    public CompletableFuture<List<WorkItem<T>>> startAsync(ItemProcessor<T> processor) {
        Objects.requireNonNull(processor, "processor");
        beginRun();
        return CompletableFuture.supplyAsync(() -> runLoop(processor), command -> {
            Thread control = new Thread(command, "batchq-control");
            control.setDaemon(true);
            control.start();
        });
    }

    @Override
    public void stop() {
        int cancelled = 0;
        // no batch can be dispatched while in-flight items are being cancelled
        synchronized (dispatchLock) {
            stopRequested = true;
            for (String id : new ArrayList<>(registry.inFlightIds())) {
                Optional<WorkItem<T>> item = registry.get(id);
                if (item.isPresent() && item.get().getStatus() == ItemStatus.PROCESSING
                        && registry.cancel(item.get())) {
                    settled.add(item.get());
                    cancelled++;
                }
                workerPool.cancel(id);
            }
            registry.clearInFlight();
        }

        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
        log.info("Queue stopped, {} item(s) cancelled", cancelled);
    }

    @Override
    public void clear() {
        if (running.get()) {
            stop();
        }
        registry.clear();
    }

    @Override
    public int clearCompleted() {
        return registry.removeIf(item -> item.getStatus() == ItemStatus.COMPLETED);
    }

    @Override
    public List<WorkItem<T>> getItems() {
        return registry.snapshot();
    }

    @Override
    public Optional<WorkItem<T>> getItem(String id) {
        return registry.get(id);
    }

    @Override
    public List<WorkItem<T>> getBlockedItems() {
        return scheduler.blockedItems();
    }

    @Override
    public List<String> getUnmetDependencies(String id) {
        return registry.get(id).map(gate::unmetDependencies).orElse(List.of());
    }

    @Override
    public QueueStats getStats() {
        long total = 0;
        long pending = 0;
        long processing = 0;
        long completed = 0;
        long failed = 0;
        long cancelled = 0;
        long blocked = 0;
        long processingTimeSum = 0;

        for (WorkItem<T> item : registry.snapshot()) {
            total++;
            switch (item.getStatus()) {
                case PENDING -> {
                    pending++;
                    if (!gate.canRun(item)) {
                        blocked++;
                    }
                }
                case PROCESSING -> processing++;
                case COMPLETED -> {
                    completed++;
                    processingTimeSum += item.getCompletedAt() - item.getStartedAt();
                }
                case FAILED -> failed++;
                case CANCELLED -> cancelled++;
            }
        }

        double averageProcessingTime = completed > 0 ? (double) processingTimeSum / completed : 0;
        return new QueueStats(total, pending, processing, completed, failed, cancelled, blocked,
                averageProcessingTime, throughput(completed));
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public QueueConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (running.get()) {
            stop();
        }
        workerPool.close();
    }

    private void beginRun() {
        if (!running.compareAndSet(false, true)) {
            throw new QueueConflictException("Queue is already running");
        }
        stopRequested = false;
        completedInRun.set(0);
        settled = new CopyOnWriteArrayList<>();
        runStartedAt = System.currentTimeMillis();
        runEndedAt = 0;
    }

    private List<WorkItem<T>> runLoop(ItemProcessor<T> processor) {
        log.info("Starting run with {} item(s), {}", registry.size(), config);
        List<WorkItem<T>> runSettled = settled;

        try {
            while (!stopRequested && registry.anyWithStatus(ItemStatus.PENDING)) {
                long now = System.currentTimeMillis();
                List<WorkItem<T>> batch = scheduler.nextBatch(now);

                if (batch.isEmpty()) {
                    OptionalLong retryAt = scheduler.nextRetryTime(now);
                    if (retryAt.isEmpty()) {
                        break;
                    }
                    pause(retryAt.getAsLong() - now);
                    continue;
                }

                if (log.isDebugEnabled()) {
                    log.debug("Running batch {}", batch.stream().map(WorkItem::getId).collect(Collectors.toList()));
                }
                CompletableFuture<Void> batchDone;
                synchronized (dispatchLock) {
                    if (stopRequested) {
                        break;
                    }
                    batchDone = workerPool.runBatch(batch, processor);
                }
                batchDone.join();

                if (!stopRequested && config.getBatchDelay() > 0) {
                    pause(config.getBatchDelay());
                }
            }
        } finally {
            runEndedAt = System.currentTimeMillis();
            running.set(false);
        }

        reportStuckItems();

        List<WorkItem<T>> result = new ArrayList<>(runSettled);
        if (onComplete != null) {
            try {
                onComplete.onComplete(result);
            } catch (RuntimeException e) {
                log.warn("onComplete callback threw", e);
            }
        }
        log.info("Run finished: {}", getStats());
        return result;
    }

    private void onSettled(WorkItem<T> item) {
        settled.add(item);
        if (item.getStatus() != ItemStatus.COMPLETED) {
            return;
        }
        int done = completedInRun.incrementAndGet();
        if (onProgress != null) {
            try {
                onProgress.onProgress(done, registry.size(), item);
            } catch (RuntimeException e) {
                log.warn("onProgress callback threw for item {}", item.getId(), e);
            }
        }
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        long deadline = System.currentTimeMillis() + millis;
        synchronized (pauseLock) {
            long remaining = millis;
            while (!stopRequested && remaining > 0) {
                try {
                    pauseLock.wait(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    stopRequested = true;
                    return;
                }
                remaining = deadline - System.currentTimeMillis();
            }
        }
    }

    private void reportStuckItems() {
        List<WorkItem<T>> stuck = registry.withStatus(ItemStatus.PENDING);
        if (stuck.isEmpty() || stopRequested) {
            return;
        }
        for (WorkItem<T> item : stuck) {
            log.warn("Item {} left PENDING, unmet dependencies: {}", item.getId(), gate.unmetDependencies(item));
        }
    }

    private double throughput(long completed) {
        long started = runStartedAt;
        if (started == 0) {
            return 0;
        }
        long end = running.get() ? System.currentTimeMillis() : runEndedAt;
        double minutes = (end - started) / 60000.0;
        return minutes > 0 ? completed / minutes : 0;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static class Builder<T> {
        private QueueConfig config = QueueConfig.defaults();
        private ErrorClassifier classifier = ErrorClassifier.defaults();
        private RetryCondition retryCondition = RetryCondition.always();
        private ErrorResolver resolver;
        private QueueCallbacks.ProgressCallback<T> onProgress;
        private QueueCallbacks.ErrorCallback<T> onError;
        private QueueCallbacks.RetryCallback<T> onRetry;
        private QueueCallbacks.CompleteCallback<T> onComplete;

        private Builder() {
        }

        public Builder<T> withConfig(QueueConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder<T> withClassifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        /**
         * Default: {@link RetryCondition#always()}
         */
        public Builder<T> withRetryCondition(RetryCondition condition) {
            this.retryCondition = Objects.requireNonNull(condition, "condition");
            return this;
        }

        /**
         * Resolver consulted before each retry. Default: none
         */
        public Builder<T> withErrorResolver(ErrorResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder<T> onProgress(QueueCallbacks.ProgressCallback<T> callback) {
            this.onProgress = callback;
            return this;
        }

        public Builder<T> onError(QueueCallbacks.ErrorCallback<T> callback) {
            this.onError = callback;
            return this;
        }

        public Builder<T> onRetry(QueueCallbacks.RetryCallback<T> callback) {
            this.onRetry = callback;
            return this;
        }

        public Builder<T> onComplete(QueueCallbacks.CompleteCallback<T> callback) {
            this.onComplete = callback;
            return this;
        }

        public PriorityBatchQueue<T> build() {
            return new PriorityBatchQueue<>(this);
        }
    }
}

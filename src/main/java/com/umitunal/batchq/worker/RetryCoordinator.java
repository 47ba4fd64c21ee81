package com.umitunal.batchq.worker;

import com.umitunal.batchq.core.ItemRegistry;
import com.umitunal.batchq.core.QueueCallbacks;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.error.ClassifiedError;
import com.umitunal.batchq.error.ErrorClassifier;
import com.umitunal.batchq.error.ErrorResolver;
import com.umitunal.batchq.error.ResolutionResult;
import com.umitunal.batchq.retry.BackoffCalculator;
import com.umitunal.batchq.retry.RetryCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Handles a failed attempt: classifies the failure, counts the attempt and either puts the
 * item back with a backoff or fails it for good.
 *
 * <p>A retried item stays PENDING with a not-before time of now + backoff, so the scheduler
 * cannot pick it up before the delay has elapsed.
 *
 * @param <T> the type of item payload
 */
public class RetryCoordinator<T> {
    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    /**
     * What became of a failed attempt.
     */
    public enum Outcome {
        RETRY_SCHEDULED,
        FAILED,
        IGNORED  // item left PROCESSING before the failure arrived, e.g. cancelled
    }

    private final ItemRegistry<T> registry;
    private final BackoffCalculator backoff;
    private final ErrorClassifier classifier;
    private final RetryCondition retryCondition;
    private final ErrorResolver resolver;
    private final QueueCallbacks.RetryCallback<T> onRetry;
    private final QueueCallbacks.ErrorCallback<T> onError;

    public RetryCoordinator(ItemRegistry<T> registry, BackoffCalculator backoff, ErrorClassifier classifier,
                            RetryCondition retryCondition, ErrorResolver resolver,
                            QueueCallbacks.RetryCallback<T> onRetry, QueueCallbacks.ErrorCallback<T> onError) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.retryCondition = Objects.requireNonNull(retryCondition, "retryCondition");
        this.resolver = resolver;
        this.onRetry = onRetry;
        this.onError = onError;
    }

    public Outcome handleFailure(WorkItem<T> item, Throwable failure) {
        Throwable error = ErrorClassifier.unwrap(failure);
        ClassifiedError classified = classifier.classify(error);

        int retryCount = registry.recordFailure(item, classified.getMessage(), classified.getType());
        if (retryCount < 0) {
            log.debug("Ignoring failure of item {} in state {}", item.getId(), item.getStatus());
            return Outcome.IGNORED;
        }

        if (retryCount < item.getMaxRetries() && shouldRetry(classified, item)) {
            if (resolver != null) {
                ResolutionResult resolution = resolver.resolve(error, item);
                registry.recordResolution(item, resolution.getAction());
                log.debug("Resolver for item {}: {}", item.getId(), resolution);
            }

            long delay = backoff.delay(retryCount);
            if (!registry.scheduleRetry(item, System.currentTimeMillis() + delay)) {
                return Outcome.IGNORED;
            }
            log.debug("Item {} failed attempt {}/{} ({}), retrying in {}ms",
                    item.getId(), retryCount, item.getMaxRetries(), classified.getType(), delay);
            notifyRetry(retryCount, error, delay, item);
            return Outcome.RETRY_SCHEDULED;
        }

        if (!registry.fail(item)) {
            return Outcome.IGNORED;
        }
        log.warn("Item {} failed after {} attempt(s) with {}: {}",
                item.getId(), retryCount, classified.getType(), classified.getMessage());
        notifyError(error, item);
        return Outcome.FAILED;
    }

    private boolean shouldRetry(ClassifiedError classified, WorkItem<T> item) {
        try {
            return retryCondition.shouldRetry(classified, item);
        } catch (RuntimeException e) {
            log.warn("Retry condition threw for item {}, not retrying", item.getId(), e);
            return false;
        }
    }

    private void notifyRetry(int attempt, Throwable error, long delay, WorkItem<T> item) {
        if (onRetry == null) {
            return;
        }
        try {
            onRetry.onRetry(attempt, error, delay, item);
        } catch (RuntimeException e) {
            log.warn("onRetry callback threw for item {}", item.getId(), e);
        }
    }

    private void notifyError(Throwable error, WorkItem<T> item) {
        if (onError == null) {
            return;
        }
        try {
            onError.onError(error, item);
        } catch (RuntimeException e) {
            log.warn("onError callback threw for item {}", item.getId(), e);
        }
    }
}

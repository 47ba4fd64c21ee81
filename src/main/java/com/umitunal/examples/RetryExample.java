package com.umitunal.examples;

import com.umitunal.batchq.config.QueueConfig;
import com.umitunal.batchq.core.WorkRequest;
import com.umitunal.batchq.error.ProcessingException;
import com.umitunal.batchq.queue.PriorityBatchQueue;
import com.umitunal.batchq.retry.RetryExecutor;
import com.umitunal.batchq.retry.RetryOptions;
import com.umitunal.batchq.retry.RetryResult;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry mechanism example - demonstrates backoff between failed attempts.
 */
public class RetryExample {

    public static void main(String[] args) {
        System.out.println("=== Retry Mechanism Example ===\n");

        QueueConfig config = QueueConfig.newBuilder()
                .withMaxRetries(3)
                .withRetryDelay(100)
                .withBatchDelay(10)
                .build();

        AtomicInteger calls = new AtomicInteger(0);

        try (PriorityBatchQueue<String> queue = PriorityBatchQueue.<String>builder()
                .withConfig(config)
                .onRetry((attempt, error, delay, item) ->
                        System.out.println("  Attempt " + attempt + " failed (" + error.getMessage()
                                + ") - retrying in " + delay + "ms"))
                .onError((error, item) -> System.out.println("  Gave up on " + item.getId()))
                .build()) {

            queue.addItem(WorkRequest.of("flaky-job", "Unreliable API call"));
            System.out.println("Submitted job with max 3 attempts");

            queue.start(item -> {
                if (calls.incrementAndGet() < 3) {
                    throw ProcessingException.withStatus(503, "Service unavailable");
                }
                System.out.println("  Success on attempt " + calls.get());
                return null;
            });

            System.out.println("\n" + queue.getItem("flaky-job").orElseThrow());
            System.out.println(queue.getStats());
        }

        // Same backoff for a single call, outside any queue
        System.out.println("\n--- Single call with RetryExecutor ---");
        AtomicInteger lookups = new AtomicInteger(0);
        RetryResult<String> result = RetryExecutor.execute(() -> {
            if (lookups.incrementAndGet() < 2) {
                throw ProcessingException.withStatus(429, "Too many requests");
            }
            return "customer-42";
        }, RetryOptions.apiCall().withBaseDelay(100).build());

        System.out.println("  " + result + " -> " + result.getValue());
    }
}

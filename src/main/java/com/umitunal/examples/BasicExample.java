package com.umitunal.examples;

import com.umitunal.batchq.config.QueueConfig;
import com.umitunal.batchq.core.Priority;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.core.WorkRequest;
import com.umitunal.batchq.queue.PriorityBatchQueue;

import java.util.List;

/**
 * Basic usage example - items run highest priority first.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Priority Example ===\n");

        QueueConfig config = QueueConfig.newBuilder()
                .withMaxConcurrency(1)
                .withBatchDelay(10)
                .build();

        try (PriorityBatchQueue<String> queue = PriorityBatchQueue.<String>builder()
                .withConfig(config)
                .onProgress((done, total, item) ->
                        System.out.println("  Progress " + done + "/" + total + ": " + item.getId()))
                .build()) {

            queue.addItem(WorkRequest.builder("nightly-report", "Export nightly report")
                    .withPriority(Priority.LOW).build());
            queue.addItem(WorkRequest.builder("stock-level", "Push stock levels")
                    .withPriority(Priority.CRITICAL).build());
            queue.addItem(WorkRequest.builder("new-orders", "Pull new orders")
                    .withPriority(Priority.NORMAL).build());

            System.out.println("Submitted 3 items");

            List<WorkItem<String>> settled = queue.start(item -> {
                System.out.println("  Processing: " + item.getPayload());
                return "ok";
            });

            System.out.println("\nSettled: " + settled.size());
            System.out.println(queue.getStats());
        }
    }
}

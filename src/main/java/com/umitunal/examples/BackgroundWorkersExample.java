package com.umitunal.examples;

import com.umitunal.batchq.config.QueueConfig;
import com.umitunal.batchq.core.BatchTemplates;
import com.umitunal.batchq.core.WorkItem;
import com.umitunal.batchq.core.WorkRequest;
import com.umitunal.batchq.queue.PriorityBatchQueue;
import com.umitunal.batchq.serialization.QueueReport;
import com.umitunal.batchq.serialization.QueueReportCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background run example - an import batch gated on a schema check, run asynchronously.
 */
public class BackgroundWorkersExample {

    public static void main(String[] args) {
        System.out.println("=== Background Run Example ===\n");

        QueueConfig config = QueueConfig.newBuilder()
                .withMaxConcurrency(3)
                .withBatchDelay(10)
                .build();

        try (PriorityBatchQueue<String> queue = new PriorityBatchQueue<>(config)) {

            queue.addItem(WorkRequest.of("schema-check", "Verify ERP schema"));

            List<WorkRequest<String>> imports = new ArrayList<>();
            for (WorkRequest<String> request : BatchTemplates.importBatch(List.of("SKU-1", "SKU-2", "SKU-3", "SKU-4"))) {
                imports.add(WorkRequest.builder(request.getId(), request.getPayload())
                        .withMetadata(request.getMetadata())
                        .dependsOn("schema-check")
                        .build());
            }
            queue.add(imports);

            System.out.println("Submitted " + queue.getItems().size() + " items");

            CompletableFuture<List<WorkItem<String>>> run = queue.startAsync(item -> {
                System.out.println("  " + Thread.currentThread().getName() + " processing: " + item.getPayload());
                Thread.sleep(200);
                return item.getPayload();
            });

            List<WorkItem<String>> settled = run.join();
            System.out.println("\nSettled: " + settled.size());

            System.out.println(new QueueReportCodec().encodeToString(QueueReport.of(queue)));
        }
    }
}

package com.umitunal.batchq.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Factories for the common batch shapes: sync, import and export runs.
 *
 * <p>Ids have the form {@code <type>_<epochMillis>_<index>} and every request carries
 * {@code type} and {@code originalIndex} metadata.
 */
public final class BatchTemplates {

    public static final String SYNC = "sync";
    public static final String IMPORT = "import";
    public static final String EXPORT = "export";

    private BatchTemplates() {
    }

    public static <T> List<WorkRequest<T>> syncBatch(List<T> payloads) {
        return syncBatch(payloads, Priority.NORMAL);
    }

    public static <T> List<WorkRequest<T>> syncBatch(List<T> payloads, Priority priority) {
        return create(SYNC, payloads, priority, 3);
    }

    public static <T> List<WorkRequest<T>> importBatch(List<T> payloads) {
        return importBatch(payloads, Priority.NORMAL);
    }

    public static <T> List<WorkRequest<T>> importBatch(List<T> payloads, Priority priority) {
        return create(IMPORT, payloads, priority, 2);
    }

    public static <T> List<WorkRequest<T>> exportBatch(List<T> queries) {
        return exportBatch(queries, Priority.NORMAL);
    }

    public static <T> List<WorkRequest<T>> exportBatch(List<T> queries, Priority priority) {
        return create(EXPORT, queries, priority, 1);
    }

    private static <T> List<WorkRequest<T>> create(String type, List<T> payloads, Priority priority, int maxRetries) {
        long stamp = System.currentTimeMillis();
        List<WorkRequest<T>> requests = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            requests.add(WorkRequest.builder(type + "_" + stamp + "_" + i, payloads.get(i))
                    .withPriority(priority)
                    .withMaxRetries(maxRetries)
                    .withMetadata("type", type)
                    .withMetadata("originalIndex", i)
                    .build());
        }
        return requests;
    }
}

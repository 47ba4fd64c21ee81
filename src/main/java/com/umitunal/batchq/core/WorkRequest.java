package com.umitunal.batchq.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A unit of work as submitted by the caller, before the queue takes ownership of it.
 *
 * @param <T> the type of the payload
 */
public final class WorkRequest<T> {
    private final String id;
    private final T payload;
    private final Priority priority;
    private final Set<String> dependencies;
    private final Integer maxRetries;
    private final Map<String, Object> metadata;

    private WorkRequest(Builder<T> builder) {
        this.id = builder.id;
        this.payload = builder.payload;
        this.priority = builder.priority;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.maxRetries = builder.maxRetries;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public String getId() { return id; }
    public T getPayload() { return payload; }
    public Priority getPriority() { return priority; }
    public Set<String> getDependencies() { return dependencies; }
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Per-item retry budget, or null to use the queue default.
     */
    public Integer getMaxRetries() { return maxRetries; }

    /**
     * Shortcut for a NORMAL priority request without dependencies.
     */
    public static <T> WorkRequest<T> of(String id, T payload) {
        return new Builder<T>(id, payload).build();
    }

    public static <T> Builder<T> builder(String id, T payload) {
        return new Builder<>(id, payload);
    }

    @Override
    public String toString() {
        return String.format("WorkRequest{id='%s', priority=%s, dependencies=%s}", id, priority, dependencies);
    }

    public static class Builder<T> {
        private final String id;
        private final T payload;
        private Priority priority = Priority.NORMAL;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private Integer maxRetries;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id, T payload) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Item id must not be blank");
            }
            this.id = id;
            this.payload = payload;
        }

        public Builder<T> withPriority(Priority priority) {
            this.priority = Objects.requireNonNull(priority, "priority");
            return this;
        }

        /**
         * Require the given items to be COMPLETED before this one may run.
         */
        public Builder<T> dependsOn(String... ids) {
            for (String dep : ids) {
                dependencies.add(Objects.requireNonNull(dep, "dependency id"));
            }
            return this;
        }

        public Builder<T> withMaxRetries(int maxRetries) {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be >= 1");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder<T> withMetadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public Builder<T> withMetadata(Map<String, ?> values) {
            metadata.putAll(values);
            return this;
        }

        public WorkRequest<T> build() {
            return new WorkRequest<>(this);
        }
    }
}

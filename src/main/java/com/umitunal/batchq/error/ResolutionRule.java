package com.umitunal.batchq.error;

import java.util.Objects;

/**
 * A remedy for one kind of failure: when the error has {@code errorType} and the condition
 * holds, the resolution is attempted.
 *
 * <p>Conditions should be pure. Resolutions may have side effects but must be safe to run
 * again on a later failure of the same item.
 */
public class ResolutionRule {
    private final String id;
    private final ErrorType errorType;
    private final Condition condition;
    private final Resolution resolution;
    private final String description;
    private volatile boolean enabled;

    public ResolutionRule(String id, ErrorType errorType, Condition condition,
                          Resolution resolution, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.resolution = Objects.requireNonNull(resolution, "resolution");
        this.description = description;
        this.enabled = true;
    }

    public String getId() { return id; }
    public ErrorType getErrorType() { return errorType; }
    public Condition getCondition() { return condition; }
    public Resolution getResolution() { return resolution; }
    public String getDescription() { return description; }
    public boolean isEnabled() { return enabled; }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @FunctionalInterface
    public interface Condition {
        boolean test(Throwable error, Object context);
    }

    @FunctionalInterface
    public interface Resolution {
        /**
         * @return true if the cause of the error was remedied
         */
        boolean resolve(Throwable error, Object context) throws Exception;
    }

    @Override
    public String toString() {
        return String.format("ResolutionRule{id='%s', type=%s, enabled=%s}", id, errorType, enabled);
    }
}

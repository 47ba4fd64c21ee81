package com.umitunal.batchq.error;

/**
 * Outcome of an {@link ErrorResolver} pass.
 */
public class ResolutionResult {
    public static final String ACTION_NONE = "none";
    public static final String ACTION_FAILED = "failed";

    private final boolean resolved;
    private final String action;
    private final String message;

    public ResolutionResult(boolean resolved, String action, String message) {
        this.resolved = resolved;
        this.action = action;
        this.message = message;
    }

    public boolean isResolved() { return resolved; }

    /**
     * Id of the rule that resolved the error, or {@value #ACTION_NONE} / {@value #ACTION_FAILED}.
     */
    public String getAction() { return action; }

    public String getMessage() { return message; }

    @Override
    public String toString() {
        return String.format("ResolutionResult{resolved=%s, action='%s'}", resolved, action);
    }
}

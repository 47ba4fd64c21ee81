package com.umitunal.batchq.error;

/**
 * A failure mapped onto {@link ErrorType}, with a message fit for end users.
 */
public class ClassifiedError {
    private final ErrorType type;
    private final String message;
    private final String userMessage;
    private final Throwable originalError;

    public ClassifiedError(ErrorType type, String message, String userMessage, Throwable originalError) {
        this.type = type;
        this.message = message;
        this.userMessage = userMessage;
        this.originalError = originalError;
    }

    public ErrorType getType() { return type; }
    public String getMessage() { return message; }
    public String getUserMessage() { return userMessage; }
    public boolean isRetryable() { return type.isRetryable(); }

    /**
     * The throwable that was classified, null when classification used raw fields.
     */
    public Throwable getOriginalError() { return originalError; }

    @Override
    public String toString() {
        return String.format("ClassifiedError{type=%s, retryable=%s, message='%s'}", type, isRetryable(), message);
    }
}

package com.umitunal.batchq.error;

import java.util.OptionalInt;

/**
 * Failure a processor throws to describe what went wrong with a remote call.
 *
 * <p>Carries the fields the classifier understands: an HTTP-like status code, a provider
 * error code and a network marker.
 */
public class ProcessingException extends Exception {
    private final Integer statusCode;
    private final String errorCode;
    private final boolean networkError;

    public ProcessingException(String message) {
        this(message, null, null, false, null);
    }

    public ProcessingException(String message, Throwable cause) {
        this(message, null, null, false, cause);
    }

    private ProcessingException(String message, Integer statusCode, String errorCode,
                                boolean networkError, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.networkError = networkError;
    }

    /**
     * A failure answered with the given status code.
     */
    public static ProcessingException withStatus(int statusCode, String message) {
        return new ProcessingException(message, statusCode, null, false, null);
    }

    /**
     * A failure identified by a provider error code, for example {@code ETIMEDOUT}.
     */
    public static ProcessingException withCode(String errorCode, String message) {
        return new ProcessingException(message, null, errorCode, false, null);
    }

    /**
     * A failure to reach the remote side at all.
     */
    public static ProcessingException network(String message, Throwable cause) {
        return new ProcessingException(message, null, null, true, cause);
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public String getErrorCode() { return errorCode; }
    public boolean isNetworkError() { return networkError; }
}

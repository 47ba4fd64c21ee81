package com.umitunal.batchq.error;

import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Maps failures onto {@link ErrorType}.
 *
 * <p>Classification walks an ordered list of rules and the first matching rule wins. The
 * default order is:
 * <ol>
 *   <li>network marker ({@link ProcessingException#network}, socket level exceptions,
 *       error code {@code NETWORK_ERROR})
 *   <li>status code: 401, 403, 429, 408/504, 422, then any code &gt;= 500
 *   <li>timeout: {@link TimeoutException}, error code {@code ETIMEDOUT}, or a message
 *       containing "timeout"
 * </ol>
 * Anything else is {@link ErrorType#UNKNOWN}.
 */
public final class ErrorClassifier {

    private static final ErrorClassifier DEFAULT = new ErrorClassifier(defaultRules());

    private final List<Rule> rules;

    public ErrorClassifier(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * The shared classifier with the default rule set. It holds no mutable state.
     */
    public static ErrorClassifier defaults() {
        return DEFAULT;
    }

    /**
     * A classifier that tries {@code rule} before every rule of this one.
     */
    public ErrorClassifier withFirst(Rule rule) {
        List<Rule> combined = new ArrayList<>(rules.size() + 1);
        combined.add(Objects.requireNonNull(rule, "rule"));
        combined.addAll(rules);
        return new ErrorClassifier(combined);
    }

    public List<Rule> getRules() {
        return rules;
    }

    public ClassifiedError classify(Throwable error) {
        return classify(Failure.from(error));
    }

    /**
     * Classify from raw fields, when no throwable is at hand.
     */
    public ClassifiedError classify(String message, Integer statusCode, String errorCode) {
        return classify(new Failure(message, statusCode, errorCode, false, null));
    }

    private ClassifiedError classify(Failure failure) {
        for (Rule rule : rules) {
            if (rule.matches(failure)) {
                return new ClassifiedError(rule.getType(), failure.getMessage(), rule.getUserMessage(), failure.getCause());
            }
        }
        return new ClassifiedError(ErrorType.UNKNOWN, failure.getMessage(),
                "An unexpected error occurred. Please try again or contact support.", failure.getCause());
    }

    /**
     * Strip wrappers added by futures and executors.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static List<Rule> defaultRules() {
        List<Rule> rules = new ArrayList<>();
        rules.add(new Rule("network", Failure::isNetwork, ErrorType.NETWORK,
                "Network connection issue. Please check your internet connection."));
        rules.add(new Rule("status-401", f -> f.hasStatus(401), ErrorType.AUTHENTICATION,
                "Authentication failed. Please check your credentials."));
        rules.add(new Rule("status-403", f -> f.hasStatus(403), ErrorType.AUTHORIZATION,
                "Access denied. You do not have permission for this action."));
        rules.add(new Rule("status-429", f -> f.hasStatus(429), ErrorType.RATE_LIMIT,
                "Too many requests. Please wait a moment and try again."));
        rules.add(new Rule("status-408-504", f -> f.hasStatus(408) || f.hasStatus(504), ErrorType.TIMEOUT,
                "Request timed out. Please try again."));
        rules.add(new Rule("status-422", f -> f.hasStatus(422), ErrorType.VALIDATION,
                "Invalid data provided. Please check your input."));
        rules.add(new Rule("status-5xx", f -> f.getStatusCode() != null && f.getStatusCode() >= 500,
                ErrorType.SERVER_ERROR, "Server error occurred. Please try again later."));
        rules.add(new Rule("timeout", Failure::isTimeout, ErrorType.TIMEOUT,
                "Operation timed out. Please try again."));
        return rules;
    }

    /**
     * One classification rule: a pure predicate over a failure and the type it yields.
     */
    public static final class Rule {
        private final String name;
        private final Predicate<Failure> predicate;
        private final ErrorType type;
        private final String userMessage;

        public Rule(String name, Predicate<Failure> predicate, ErrorType type, String userMessage) {
            this.name = Objects.requireNonNull(name, "name");
            this.predicate = Objects.requireNonNull(predicate, "predicate");
            this.type = Objects.requireNonNull(type, "type");
            this.userMessage = userMessage;
        }

        public String getName() { return name; }
        public ErrorType getType() { return type; }
        public String getUserMessage() { return userMessage; }

        boolean matches(Failure failure) {
            return predicate.test(failure);
        }
    }

    /**
     * The fields of a failure the rules look at.
     */
    public static final class Failure {
        private final String message;
        private final Integer statusCode;
        private final String errorCode;
        private final boolean networkMarker;
        private final Throwable cause;

        Failure(String message, Integer statusCode, String errorCode, boolean networkMarker, Throwable cause) {
            this.message = message == null ? "" : message;
            this.statusCode = statusCode;
            this.errorCode = errorCode;
            this.networkMarker = networkMarker;
            this.cause = cause;
        }

        static Failure from(Throwable error) {
            Throwable root = unwrap(Objects.requireNonNull(error, "error"));
            String message = root.getMessage() != null ? root.getMessage() : root.toString();

            if (root instanceof ProcessingException) {
                ProcessingException pe = (ProcessingException) root;
                Integer status = pe.getStatusCode().isPresent() ? pe.getStatusCode().getAsInt() : null;
                return new Failure(message, status, pe.getErrorCode(), pe.isNetworkError(), root);
            }

            // ConnectException and NoRouteToHostException are SocketExceptions
            boolean network = root instanceof SocketException || root instanceof UnknownHostException;
            return new Failure(message, null, null, network, root);
        }

        public String getMessage() { return message; }
        public Integer getStatusCode() { return statusCode; }
        public String getErrorCode() { return errorCode; }
        public Throwable getCause() { return cause; }

        public boolean hasStatus(int code) {
            return statusCode != null && statusCode == code;
        }

        public boolean isNetwork() {
            return networkMarker || "NETWORK_ERROR".equals(errorCode);
        }

        public boolean isTimeout() {
            return cause instanceof TimeoutException
                    || cause instanceof SocketTimeoutException
                    || "ETIMEDOUT".equals(errorCode)
                    || message.toLowerCase(Locale.ROOT).contains("timeout");
        }
    }
}

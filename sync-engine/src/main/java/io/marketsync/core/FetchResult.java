package io.marketsync.core;

import java.util.Objects;

/**
 * Outcome of one fetch/transform/load call: success, transient failure or permanent failure.
 * Failures always carry a non-null error text.
 */
public record FetchResult(Outcome outcome, int rowsWritten, String error) {
    public enum Outcome {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE
    }

    static final String UNKNOWN_ERROR = "unknown error";

    public FetchResult {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == Outcome.SUCCESS) {
            error = null;
        } else {
            rowsWritten = 0;
            if (error == null || error.isBlank()) error = UNKNOWN_ERROR;
        }
    }

    public static FetchResult success(int rowsWritten) {
        return new FetchResult(Outcome.SUCCESS, rowsWritten, null);
    }

    public static FetchResult transientFailure(String error) {
        return new FetchResult(Outcome.TRANSIENT_FAILURE, 0, error);
    }

    /** Uses the exception's message, or its class name when it has none. */
    public static FetchResult transientFailure(Throwable cause) {
        return transientFailure(describe(cause));
    }

    public static FetchResult permanentFailure(String error) {
        return new FetchResult(Outcome.PERMANENT_FAILURE, 0, error);
    }

    public static FetchResult permanentFailure(Throwable cause) {
        return permanentFailure(describe(cause));
    }

    public boolean isSuccess() { return outcome == Outcome.SUCCESS; }

    public boolean isTransientFailure() { return outcome == Outcome.TRANSIENT_FAILURE; }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getName() : message;
    }
}

package io.sokrates.model;

/**
 * Classified failure of one execution attempt.
 */
public record TaskFailure(String message, FailureKind kind) {
    public TaskFailure {
        message = message == null || message.isBlank() ? "unknown error" : message;
        kind = kind == null ? FailureKind.TRANSIENT : kind;
    }

    public static TaskFailure transientFailure(String message) {
        return new TaskFailure(message, FailureKind.TRANSIENT);
    }

    public static TaskFailure permanentFailure(String message) {
        return new TaskFailure(message, FailureKind.PERMANENT);
    }

    public boolean retryable() {
        return kind == FailureKind.TRANSIENT;
    }
}

package io.sokrates.error;

import io.sokrates.model.FailureKind;

/**
 * Raised by task handlers to report a classified failure.
 */
public abstract class TaskFailureException extends Exception {
    protected TaskFailureException(String message) {
        super(message);
    }

    protected TaskFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}

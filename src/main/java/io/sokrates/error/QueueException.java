package io.sokrates.error;

/**
 * Base of the errors surfaced by the operations API; each maps to a distinct exit code.
 */
public abstract class QueueException extends RuntimeException {
    private final ErrorCode code;

    protected QueueException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected QueueException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}

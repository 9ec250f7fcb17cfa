package io.sokrates.error;

public final class InvalidStateException extends QueueException {
    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}

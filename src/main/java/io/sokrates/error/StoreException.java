package io.sokrates.error;

public final class StoreException extends QueueException {
    public StoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_ERROR, message, cause);
    }
}

package io.sokrates.error;

import java.util.Locale;

public enum ErrorCode {
    INVALID_INPUT(2),
    NOT_FOUND(3),
    INVALID_STATE(4),
    STORE_ERROR(5);

    private final int exitCode;

    ErrorCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

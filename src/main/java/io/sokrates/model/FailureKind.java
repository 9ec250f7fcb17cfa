package io.sokrates.model;

import java.util.Locale;

public enum FailureKind {
    /** Network timeout, rate limit: eligible for retry. */
    TRANSIENT,
    /** Malformed payload, unsupported kind: never retried. */
    PERMANENT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FailureKind fromNullable(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return FailureKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

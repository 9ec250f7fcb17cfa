package io.sokrates.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task lifecycle states.
 *
 * <p>{@code FAILED} is terminal only when no retry is scheduled; see {@link Task#isTerminal()}.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    public Set<TaskStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED);
            case FAILED -> EnumSet.of(PENDING);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    /**
     * Whether a task in this status may be removed without {@code --force}.
     */
    public boolean isSettled() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        String value = raw.trim();
        for (TaskStatus s : values()) {
            if (s.name().equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + raw
                + " (expected one of pending|running|completed|failed|cancelled)");
    }
}

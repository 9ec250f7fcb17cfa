package io.sokrates.model;

import java.util.Locale;

public enum Priority {
    URGENT("urgent", 3),
    HIGH("high", 2),
    NORMAL("normal", 1),
    LOW("low", 0);

    private final String wireName;
    private final int rank;

    Priority(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Dequeue rank; higher runs first.
     */
    public int rank() {
        return rank;
    }

    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        String value = raw.trim();
        for (Priority p : values()) {
            if (p.name().equalsIgnoreCase(value) || p.wireName.equalsIgnoreCase(value)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw
                + " (expected one of urgent|high|normal|low)");
    }

    public static Priority fromRank(int rank) {
        for (Priority p : values()) {
            if (p.rank == rank) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }

    @Override
    public String toString() {
        return wireName.toLowerCase(Locale.ROOT);
    }
}

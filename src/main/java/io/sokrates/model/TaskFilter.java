package io.sokrates.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Conjunctive task filter. {@code null} fields do not constrain; the time range is
 * {@code [createdFromMs, createdToMs)}.
 */
public record TaskFilter(
        Set<TaskStatus> statuses,
        Priority priority,
        String kind,
        Long createdFromMs,
        Long createdToMs,
        int limit,
        int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public TaskFilter {
        statuses = statuses == null || statuses.isEmpty() ? Set.of() : Set.copyOf(statuses);
        kind = kind == null || kind.isBlank() ? null : kind.trim();
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
        offset = Math.max(0, offset);
    }

    public static TaskFilter all() {
        return new TaskFilter(Set.of(), null, null, null, null, DEFAULT_LIMIT, 0);
    }

    public static TaskFilter byStatus(TaskStatus first, TaskStatus... rest) {
        return all().withStatuses(EnumSet.of(first, rest));
    }

    public TaskFilter withStatuses(Set<TaskStatus> value) {
        return new TaskFilter(value, priority, kind, createdFromMs, createdToMs, limit, offset);
    }

    public TaskFilter withPriority(Priority value) {
        return new TaskFilter(statuses, value, kind, createdFromMs, createdToMs, limit, offset);
    }

    public TaskFilter withKind(String value) {
        return new TaskFilter(statuses, priority, value, createdFromMs, createdToMs, limit, offset);
    }

    public TaskFilter withCreatedBetween(Long fromMs, Long toMs) {
        return new TaskFilter(statuses, priority, kind, fromMs, toMs, limit, offset);
    }

    public TaskFilter withPage(int newLimit, int newOffset) {
        return new TaskFilter(statuses, priority, kind, createdFromMs, createdToMs, newLimit, newOffset);
    }
}

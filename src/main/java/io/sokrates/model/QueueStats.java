package io.sokrates.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task counts per status, keyed by wire name.
 */
public record QueueStats(Map<String, Integer> byStatus, int total) {
    public static QueueStats of(Map<TaskStatus, Integer> counts) {
        Map<String, Integer> out = new LinkedHashMap<>();
        int total = 0;
        for (TaskStatus s : TaskStatus.values()) {
            int n = counts.getOrDefault(s, 0);
            out.put(s.wireName(), n);
            total += n;
        }
        return new QueueStats(out, total);
    }

    public int count(TaskStatus status) {
        return byStatus.getOrDefault(status.wireName(), 0);
    }
}

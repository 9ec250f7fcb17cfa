package io.sokrates.model;

public record TaskSummary(
        String taskId,
        String kind,
        String priority,
        String status,
        int attempts,
        int maxAttempts,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
    public static TaskSummary of(Task t) {
        return new TaskSummary(
                t.id(),
                t.kind(),
                t.priority().wireName(),
                t.status().wireName(),
                t.attempts(),
                t.maxAttempts(),
                t.error(),
                t.createdAtMs(),
                t.updatedAtMs()
        );
    }
}

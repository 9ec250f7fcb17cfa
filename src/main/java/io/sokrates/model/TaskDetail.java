package io.sokrates.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.security.SensitiveDataMasker;

/**
 * Status view of one task. Payload, result and claim fields are only filled in verbose mode.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskDetail(
        String taskId,
        String kind,
        String priority,
        String status,
        boolean terminal,
        int attempts,
        int maxAttempts,
        long createdAtMs,
        long updatedAtMs,
        Long startedAtMs,
        Long finishedAtMs,
        Long retryAtMs,
        String error,
        String errorKind,
        boolean cancelRequested,
        String result,
        JsonNode payload,
        String lockOwner,
        Long lockExpiryMs
) {
    public static TaskDetail of(Task t, boolean verbose) {
        return new TaskDetail(
                t.id(),
                t.kind(),
                t.priority().wireName(),
                t.status().wireName(),
                t.isTerminal(),
                t.attempts(),
                t.maxAttempts(),
                t.createdAtMs(),
                t.updatedAtMs(),
                t.startedAtMs(),
                t.finishedAtMs(),
                t.retryAtMs(),
                t.error(),
                t.errorKind() == null ? null : t.errorKind().wireName(),
                t.cancelRequested(),
                verbose ? t.result() : null,
                verbose ? SensitiveDataMasker.masked(t.payload()) : null,
                verbose ? t.lockOwner() : null,
                verbose ? t.lockExpiryMs() : null
        );
    }
}

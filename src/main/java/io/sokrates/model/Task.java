package io.sokrates.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.error.InvalidStateException;

/**
 * One queued unit of LLM-processing work, exactly as persisted in the {@code tasks} table.
 *
 * <p>Transition methods return a new record and reject moves the state machine does not allow.
 * {@code updatedAtMs} is refreshed on every transition and {@code finishedAtMs} is written once,
 * when the task becomes terminal.
 */
public record Task(
        String id,
        String kind,
        JsonNode payload,
        Priority priority,
        TaskStatus status,
        int attempts,
        int maxAttempts,
        long createdAtMs,
        long updatedAtMs,
        Long startedAtMs,
        Long finishedAtMs,
        Long retryAtMs,
        String result,
        String error,
        FailureKind errorKind,
        String lockOwner,
        Long lockExpiryMs,
        boolean cancelRequested
) {
    public boolean isTerminal() {
        return switch (status) {
            case COMPLETED, CANCELLED -> true;
            case FAILED -> retryAtMs == null;
            case PENDING, RUNNING -> false;
        };
    }

    public boolean attemptsRemaining() {
        return attempts < maxAttempts;
    }

    public boolean awaitingRetry() {
        return status == TaskStatus.FAILED && retryAtMs != null;
    }

    public Task markRunning(String owner, long nowMs, long leaseMs) {
        requireTransition(TaskStatus.RUNNING);
        if (!attemptsRemaining()) {
            throw new InvalidStateException("Task " + id + " has no attempts left (" + attempts + "/" + maxAttempts + ")");
        }
        return new Task(id, kind, payload, priority, TaskStatus.RUNNING, attempts + 1, maxAttempts,
                createdAtMs, nowMs, nowMs, finishedAtMs, null, result, error, errorKind,
                owner, nowMs + leaseMs, false);
    }

    public Task markCompleted(String output, long nowMs) {
        requireTransition(TaskStatus.COMPLETED);
        return new Task(id, kind, payload, priority, TaskStatus.COMPLETED, attempts, maxAttempts,
                createdAtMs, nowMs, startedAtMs, finishOnce(nowMs), null, output, error, errorKind,
                null, null, cancelRequested);
    }

    /**
     * @param nextRetryAtMs when the retry becomes due, or {@code null} for a terminal failure
     */
    public Task markFailed(String message, FailureKind kind, Long nextRetryAtMs, long nowMs) {
        requireTransition(TaskStatus.FAILED);
        return new Task(id, this.kind, payload, priority, TaskStatus.FAILED, attempts, maxAttempts,
                createdAtMs, nowMs, startedAtMs, nextRetryAtMs == null ? finishOnce(nowMs) : finishedAtMs,
                nextRetryAtMs, result, message, kind, null, null, cancelRequested);
    }

    /**
     * Retry transition {@code failed -> pending}; the last error is kept for auditing.
     */
    public Task markRetryPending(long nowMs) {
        requireTransition(TaskStatus.PENDING);
        if (retryAtMs == null) {
            throw new InvalidStateException("Task " + id + " failed terminally and has no retry scheduled");
        }
        return new Task(id, kind, payload, priority, TaskStatus.PENDING, attempts, maxAttempts,
                createdAtMs, nowMs, startedAtMs, finishedAtMs, null, result, error, errorKind,
                null, null, false);
    }

    public Task markCancelled(long nowMs) {
        if (status != TaskStatus.PENDING) {
            throw new InvalidStateException("Only pending tasks can be cancelled, task " + id + " is " + status.wireName());
        }
        return new Task(id, kind, payload, priority, TaskStatus.CANCELLED, attempts, maxAttempts,
                createdAtMs, nowMs, startedAtMs, finishOnce(nowMs), null, result, "cancelled by user", null,
                null, null, true);
    }

    /**
     * Cooperative stop flag for a running task; the status does not change.
     */
    public Task withCancelRequested(long nowMs) {
        if (status != TaskStatus.RUNNING) {
            throw new InvalidStateException("Stop can only be requested for a running task, task " + id + " is " + status.wireName());
        }
        return new Task(id, kind, payload, priority, status, attempts, maxAttempts,
                createdAtMs, nowMs, startedAtMs, finishedAtMs, retryAtMs, result, error, errorKind,
                lockOwner, lockExpiryMs, true);
    }

    /**
     * User-initiated requeue of a terminal failed or cancelled task. Starts a fresh attempt budget.
     */
    public Task requeued(long nowMs) {
        boolean allowed = status == TaskStatus.CANCELLED || (status == TaskStatus.FAILED && retryAtMs == null);
        if (!allowed) {
            throw new InvalidStateException("Only terminal failed or cancelled tasks can be requeued, task "
                    + id + " is " + status.wireName());
        }
        return new Task(id, kind, payload, priority, TaskStatus.PENDING, 0, maxAttempts,
                createdAtMs, nowMs, null, null, null, null, null, null, null, null, false);
    }

    private Long finishOnce(long nowMs) {
        return finishedAtMs == null ? nowMs : finishedAtMs;
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateException("Illegal transition for task " + id + ": "
                    + status.wireName() + " -> " + next.wireName());
        }
    }
}

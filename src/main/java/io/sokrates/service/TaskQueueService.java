package io.sokrates.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.error.InvalidStateException;
import io.sokrates.error.TaskNotFoundException;
import io.sokrates.error.ValidationException;
import io.sokrates.handler.HandlerRegistry;
import io.sokrates.model.NewTask;
import io.sokrates.model.Priority;
import io.sokrates.model.QueueStats;
import io.sokrates.model.Task;
import io.sokrates.model.TaskDetail;
import io.sokrates.model.TaskFilter;
import io.sokrates.model.TaskStatus;
import io.sokrates.model.TaskSummary;
import io.sokrates.observability.AuditLogger;
import io.sokrates.storage.TaskStore;
import io.sokrates.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operations API of the queue. Every call is audited and goes straight to the store.
 */
public final class TaskQueueService {
    private static final Logger log = LoggerFactory.getLogger(TaskQueueService.class);

    private final TaskStore store;
    private final HandlerRegistry registry;
    private final int defaultMaxAttempts;
    private final AuditLogger audit;
    private final Clock clock;
    private final String actor;

    public TaskQueueService(TaskStore store, HandlerRegistry registry, int defaultMaxAttempts, AuditLogger audit,
                            Clock clock, String actor) {
        this.store = store;
        this.registry = registry;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.audit = audit;
        this.clock = clock;
        this.actor = actor == null || actor.isBlank() ? "cli" : actor;
    }

    /**
     * CLI-facing variant taking raw JSON and a priority name.
     */
    public String add(String kind, String payloadJson, String priority, Integer maxAttempts) {
        JsonNode payload;
        Priority p;
        try {
            payload = Jsons.parseObject(payloadJson);
            p = Priority.fromString(priority);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        return add(kind, payload, p, maxAttempts);
    }

    /**
     * @param maxAttempts retry ceiling, or {@code null} for the configured default
     * @return the new task id
     */
    public String add(String kind, JsonNode payload, Priority priority, Integer maxAttempts) {
        if (kind == null || kind.isBlank()) {
            throw new ValidationException("kind must not be blank");
        }
        String k = kind.trim();
        if (!registry.supports(k)) {
            throw new ValidationException("Unsupported task kind: " + k + " (supported: " + String.join(", ", registry.kinds()) + ")");
        }
        JsonNode body = payload == null || payload.isNull() ? Jsons.mapper().createObjectNode() : payload;
        if (!body.isObject()) {
            throw new ValidationException("payload must be a JSON object, got " + body.getNodeType());
        }
        int attempts = maxAttempts == null ? defaultMaxAttempts : maxAttempts;
        if (attempts < 1) {
            throw new ValidationException("max attempts must be >= 1, got " + attempts);
        }
        Priority p = priority == null ? Priority.NORMAL : priority;
        String id = "tsk_" + UUID.randomUUID();
        store.create(new NewTask(id, k, body, p, attempts, clock.millis()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", k);
        details.put("priority", p.wireName());
        details.put("max_attempts", attempts);
        details.put("payload", body);
        audit("task.add", id, "ok", details);
        return id;
    }

    public List<TaskSummary> list(TaskFilter filter) {
        List<TaskSummary> out = store.list(filter).stream().map(TaskSummary::of).toList();
        audit("task.list", null, "ok", Map.of("returned", out.size()));
        return out;
    }

    public TaskDetail status(String taskId, boolean verbose) {
        Task task = store.get(taskId).orElseThrow(() -> notFound("task.status", taskId));
        audit("task.status", taskId, "ok", Map.of("status", task.status().wireName()));
        return TaskDetail.of(task, verbose);
    }

    /**
     * Deletes a task. Pending and running tasks need {@code force}.
     *
     * @throws TaskNotFoundException when the id is unknown, including a second remove of the same id
     */
    public boolean remove(String taskId, boolean force) {
        Task removed = store.delete(taskId, t -> {
            if (!force && (t.status() == TaskStatus.PENDING || t.status() == TaskStatus.RUNNING)) {
                audit("task.remove", taskId, "rejected", Map.of("status", t.status().wireName()));
                throw new InvalidStateException("Task " + taskId + " is " + t.status().wireName()
                        + "; use force to remove it anyway");
            }
        }).orElseThrow(() -> notFound("task.remove", taskId));
        audit("task.remove", taskId, "ok", Map.of("status", removed.status().wireName(), "force", force));
        return true;
    }

    /**
     * Pending (or awaiting retry) tasks become cancelled. A running task only gets its stop flag raised;
     * the handler decides whether to honour it.
     */
    public TaskDetail cancel(String taskId) {
        long now = clock.millis();
        Task updated = store.update(taskId, t -> switch (t.status()) {
            case PENDING -> t.markCancelled(now);
            case RUNNING -> t.cancelRequested() ? t : t.withCancelRequested(now);
            case FAILED -> {
                if (!t.awaitingRetry()) {
                    throw new InvalidStateException("Task " + taskId + " already failed terminally");
                }
                yield t.markRetryPending(now).markCancelled(now);
            }
            case COMPLETED, CANCELLED -> throw new InvalidStateException("Task " + taskId + " is already "
                    + t.status().wireName());
        }).orElseThrow(() -> notFound("task.cancel", taskId));
        audit("task.cancel", taskId, updated.status() == TaskStatus.RUNNING ? "stop_requested" : "cancelled", Map.of());
        return TaskDetail.of(updated, false);
    }

    /**
     * Puts a terminal failed or cancelled task back in the queue with a fresh attempt budget.
     */
    public TaskDetail requeue(String taskId) {
        long now = clock.millis();
        Task updated = store.update(taskId, t -> t.requeued(now))
                .orElseThrow(() -> notFound("task.requeue", taskId));
        audit("task.requeue", taskId, "ok", Map.of());
        return TaskDetail.of(updated, false);
    }

    public QueueStats stats() {
        QueueStats stats = QueueStats.of(store.countByStatus());
        audit("queue.stats", null, "ok", Map.of("total", stats.total()));
        return stats;
    }

    /**
     * Deletes terminal tasks that finished more than {@code olderThanDays} days ago.
     */
    public int purge(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new ValidationException("older-than days must be >= 0, got " + olderThanDays);
        }
        long cutoff = clock.millis() - Duration.ofDays(olderThanDays).toMillis();
        int purged = store.purgeFinishedBefore(cutoff);
        audit("queue.purge", null, "ok", Map.of("older_than_days", olderThanDays, "purged", purged));
        return purged;
    }

    public List<String> kinds() {
        return List.copyOf(registry.kinds());
    }

    private TaskNotFoundException notFound(String action, String taskId) {
        audit(action, taskId, "not_found", Map.of());
        return new TaskNotFoundException(taskId);
    }

    // Best effort: the operation has already taken effect when its entry is written.
    private void audit(String action, String taskId, String result, Map<String, Object> details) {
        try {
            audit.log(AuditLogger.AuditEvent.of(action, actor, taskId, result, details));
        } catch (RuntimeException e) {
            log.warn("Audit entry {} for task {} not written: {}", action, taskId, e.getMessage());
        }
    }
}

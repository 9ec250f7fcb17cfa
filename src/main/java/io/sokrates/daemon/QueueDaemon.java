package io.sokrates.daemon;

import io.sokrates.config.QueueSettings;
import io.sokrates.error.StoreException;
import io.sokrates.executor.Outcome;
import io.sokrates.executor.TaskExecutor;
import io.sokrates.model.Task;
import io.sokrates.observability.AuditLogger;
import io.sokrates.retry.RetryPolicy;
import io.sokrates.storage.QueueIndex;
import io.sokrates.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The poll loop: claims the most eligible task, runs it, records the outcome and polls again.
 *
 * <p>Execution is serialized. The only other thread is the heartbeat, which extends the lease of the
 * in-flight task and refreshes the process marker.
 */
public final class QueueDaemon {
    private static final Logger log = LoggerFactory.getLogger(QueueDaemon.class);
    static final String RECLAIM_REASON = "claim expired: daemon stopped or crashed while running the task";

    private final TaskStore store;
    private final QueueIndex index;
    private final TaskExecutor executor;
    private final QueueSettings settings;
    private final RetryPolicy retryPolicy;
    private final DaemonMarker marker;
    private final AuditLogger audit;
    private final String owner;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<String> inFlight = new AtomicReference<>();
    private final Object wakeup = new Object();
    private volatile long lastPollAtMs;
    private long lastReclaimAtMs;

    public QueueDaemon(TaskStore store, QueueIndex index, TaskExecutor executor, QueueSettings settings,
                       DaemonMarker marker, AuditLogger audit, String owner, Clock clock) {
        this.store = store;
        this.index = index;
        this.executor = executor;
        this.settings = settings;
        this.retryPolicy = settings.retryPolicy();
        this.marker = marker;
        this.audit = audit;
        this.owner = owner;
        this.clock = clock;
    }

    public static String defaultOwner() {
        return "daemon-" + ProcessHandle.current().pid();
    }

    public String owner() {
        return owner;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long lastPollAtMs() {
        return lastPollAtMs;
    }

    /**
     * Recovers claims left behind by a previous daemon whose lease has run out.
     *
     * @return number of tasks recovered
     */
    public int recoverExpiredClaims() {
        long now = clock.millis();
        List<Task> expired = index.findExpiredClaims(now);
        int recovered = 0;
        for (Task task : expired) {
            try {
                TaskStore.FailureResolution r = store.recoverExpired(task.id(), now, RECLAIM_REASON);
                if (r.outcome() == TaskStore.FailureOutcome.STALE_CLAIM) {
                    continue;
                }
                recovered++;
                if (r.outcome() == TaskStore.FailureOutcome.RETRY_SCHEDULED) {
                    log.info("Recovered task {} from expired claim of {} (attempt {} of {})",
                            task.id(), task.lockOwner(), task.attempts(), task.maxAttempts());
                } else {
                    log.warn("Task {} failed permanently after {} attempts (claim of {} expired)",
                            task.id(), task.attempts(), task.lockOwner());
                }
                auditTask("task.recover", task.id(), r.outcome().name().toLowerCase(Locale.ROOT),
                        Map.of("previous_owner", String.valueOf(task.lockOwner()), "attempts", task.attempts()));
            } catch (StoreException e) {
                log.error("Failed to recover task {}", task.id(), e);
            }
        }
        lastReclaimAtMs = now;
        return recovered;
    }

    /**
     * One loop iteration: release due retries, reclaim expired claims when due, then claim and run at most one task.
     */
    public Iteration runOnce() {
        long now = clock.millis();
        lastPollAtMs = now;
        int released = index.releaseDueRetries(now);
        if (released > 0) {
            log.info("Released {} task(s) whose retry backoff elapsed", released);
        }
        if (now - lastReclaimAtMs >= settings.reclaimIntervalMs()) {
            recoverExpiredClaims();
            purgeExpired(now);
        }

        Optional<Task> claimed = index.claimNext(owner, now, settings.leaseTimeoutMs());
        if (claimed.isEmpty()) {
            return Iteration.idle();
        }
        Task task = claimed.get();
        inFlight.set(task.id());
        try {
            log.info("Running task {} ({}, {}) attempt {} of {}", task.id(), task.kind(),
                    task.priority().wireName(), task.attempts(), task.maxAttempts());
            Outcome outcome = executor.execute(task, () -> store.isCancelRequested(task.id()));
            return persist(task, outcome);
        } finally {
            inFlight.set(null);
        }
    }

    private Iteration persist(Task task, Outcome outcome) {
        long now = clock.millis();
        if (outcome.success()) {
            boolean stored = store.complete(task.id(), owner, outcome.output(), now);
            if (!stored) {
                log.warn("Result of task {} discarded: claim no longer held by {}", task.id(), owner);
                auditTask("task.execute", task.id(), "stale_claim", Map.of("attempt", task.attempts()));
                return new Iteration(true, task.id(), "stale_claim");
            }
            auditTask("task.execute", task.id(), "completed", Map.of("attempt", task.attempts()));
            return new Iteration(true, task.id(), "completed");
        }
        TaskStore.FailureResolution r = store.fail(task.id(), owner, outcome.failure(), retryPolicy, now);
        String result = switch (r.outcome()) {
            case RETRY_SCHEDULED -> "retry_scheduled";
            case FAILED_TERMINAL -> "failed";
            case STALE_CLAIM -> "stale_claim";
        };
        if (r.outcome() == TaskStore.FailureOutcome.RETRY_SCHEDULED) {
            log.info("Task {} will retry in {} ms", task.id(), r.nextRetryAtMs() - now);
        } else if (r.outcome() == TaskStore.FailureOutcome.FAILED_TERMINAL) {
            log.warn("Task {} failed terminally: {}", task.id(), outcome.failure().message());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", task.attempts());
        details.put("error", outcome.failure().message());
        details.put("error_kind", outcome.failure().kind().wireName());
        auditTask("task.execute", task.id(), result, details);
        return new Iteration(true, task.id(), result);
    }

    private void purgeExpired(long now) {
        if (settings.retentionDays() <= 0) {
            return;
        }
        int purged = store.purgeFinishedBefore(now - Duration.ofDays(settings.retentionDays()).toMillis());
        if (purged > 0) {
            log.info("Purged {} finished task(s) older than {} days", purged, settings.retentionDays());
        }
    }

    /**
     * Blocks until {@link #requestStop()}. The in-flight task always finishes before the loop exits.
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Daemon loop already running");
        }
        long pid = ProcessHandle.current().pid();
        if (marker != null) {
            marker.create(DaemonMarker.forCurrentProcess(clock.millis()));
        }
        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sokrates-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long beatMs = Math.max(100L, settings.leaseTimeoutMs() / 3L);
        heartbeat.scheduleAtFixedRate(() -> beat(pid), beatMs, beatMs, TimeUnit.MILLISECONDS);
        log.info("Daemon {} started (poll {} ms, lease {} ms)", owner, settings.pollIntervalMs(), settings.leaseTimeoutMs());
        try {
            try {
                int recovered = recoverExpiredClaims();
                if (recovered > 0) {
                    log.info("Startup recovery handled {} expired claim(s)", recovered);
                }
            } catch (RuntimeException e) {
                log.error("Startup recovery failed; expired claims are retried on the next reclaim", e);
            }
            while (!stopRequested.get()) {
                boolean processed = false;
                try {
                    processed = runOnce().processed();
                } catch (StoreException e) {
                    log.error("Store error in poll loop; continuing", e);
                } catch (RuntimeException e) {
                    log.error("Unexpected error in poll loop; continuing", e);
                }
                if (!processed && !stopRequested.get()) {
                    sleepUntilNextPoll();
                }
            }
        } finally {
            heartbeat.shutdownNow();
            if (marker != null) {
                marker.clearIfOwned(pid);
            }
            running.set(false);
            log.info("Daemon {} stopped", owner);
        }
    }

    public void requestStop() {
        stopRequested.set(true);
        synchronized (wakeup) {
            wakeup.notifyAll();
        }
    }

    private void sleepUntilNextPoll() {
        synchronized (wakeup) {
            try {
                wakeup.wait(settings.pollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopRequested.set(true);
            }
        }
    }

    private void beat(long pid) {
        long now = clock.millis();
        try {
            String taskId = inFlight.get();
            if (taskId != null && !index.extendLease(taskId, owner, now, settings.leaseTimeoutMs())) {
                log.warn("Lease of task {} could not be extended; another daemon may have reclaimed it", taskId);
            }
            if (marker != null) {
                marker.refresh(pid, now, lastPollAtMs == 0L ? null : lastPollAtMs);
            }
        } catch (RuntimeException e) {
            log.error("Heartbeat failed", e);
        }
    }

    private void auditTask(String action, String taskId, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, owner, taskId, result, details));
        } catch (RuntimeException e) {
            log.warn("Audit entry {} for task {} not written: {}", action, taskId, e.getMessage());
        }
    }

    public record Iteration(boolean processed, String taskId, String result) {
        public static Iteration idle() {
            return new Iteration(false, null, "idle");
        }
    }
}

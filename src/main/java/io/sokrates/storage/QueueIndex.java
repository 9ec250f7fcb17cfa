package io.sokrates.storage;

import io.sokrates.error.StoreException;
import io.sokrates.model.Task;
import io.sokrates.model.TaskStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Eligibility order and claiming over the {@code tasks} table.
 *
 * <p>Order is strict: higher priority first, then oldest {@code created_at_ms}, then insertion order.
 * Low-priority work can starve while higher-priority work keeps arriving.
 */
public final class QueueIndex {
    private static final String ELIGIBLE_SQL = "SELECT " + TaskStore.COLUMNS
            + " FROM tasks WHERE status=? ORDER BY priority_rank DESC, created_at_ms ASC, rowid ASC LIMIT 1";

    private final TaskStore store;

    public QueueIndex(TaskStore store) {
        this.store = store;
    }

    /**
     * Peeks at the next pending task without claiming it.
     */
    public Optional<Task> nextEligible() {
        try (Connection c = store.database().openConnection()) {
            return selectEligible(c);
        } catch (SQLException e) {
            throw new StoreException("Failed to read queue head", e);
        }
    }

    /**
     * Selects the queue head and marks it running in one transaction. The write is a compare-and-set
     * on {@code status='PENDING'}, so a task is handed to at most one claimant.
     */
    public Optional<Task> claimNext(String owner, long nowMs, long leaseMs) {
        return store.inTransaction("claim next task", c -> {
            Optional<Task> head = selectEligible(c);
            if (head.isEmpty()) {
                return Optional.empty();
            }
            Task running = head.get().markRunning(owner, nowMs, leaseMs);
            if (!TaskStore.write(c, running, TaskStatus.PENDING)) {
                return Optional.empty();
            }
            return Optional.of(running);
        });
    }

    /**
     * Claims one specific task.
     *
     * @return false when the task is unknown or no longer pending
     */
    public boolean claim(String taskId, String owner, long nowMs, long leaseMs) {
        return store.inTransaction("claim task " + taskId, c -> {
            Optional<Task> current = TaskStore.read(c, taskId);
            if (current.isEmpty() || current.get().status() != TaskStatus.PENDING
                    || !current.get().attemptsRemaining()) {
                return false;
            }
            return TaskStore.write(c, current.get().markRunning(owner, nowMs, leaseMs), TaskStatus.PENDING);
        });
    }

    /**
     * Heartbeat: pushes the lease of a running task forward, fenced on the owner.
     */
    public boolean extendLease(String taskId, String owner, long nowMs, long leaseMs) {
        String sql = "UPDATE tasks SET lock_expiry_ms=? WHERE task_id=? AND status=? AND lock_owner=?";
        try (Connection c = store.database().openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs + leaseMs);
            ps.setString(2, taskId);
            ps.setString(3, TaskStatus.RUNNING.name());
            ps.setString(4, owner);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to extend lease of task " + taskId, e);
        }
    }

    /**
     * Moves failed tasks whose backoff has elapsed back to pending.
     *
     * @return number of tasks released
     */
    public int releaseDueRetries(long nowMs) {
        return store.inTransaction("release due retries", c -> {
            List<Task> due = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT " + TaskStore.COLUMNS
                    + " FROM tasks WHERE status=? AND retry_at_ms IS NOT NULL AND retry_at_ms<=? ORDER BY retry_at_ms")) {
                ps.setString(1, TaskStatus.FAILED.name());
                ps.setLong(2, nowMs);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        due.add(TaskStore.readTask(rs));
                    }
                }
            }
            int released = 0;
            for (Task t : due) {
                if (TaskStore.write(c, t.markRetryPending(nowMs), TaskStatus.FAILED)) {
                    released++;
                }
            }
            return released;
        });
    }

    /**
     * Running tasks whose lease ran out: their claimant crashed or stalled.
     */
    public List<Task> findExpiredClaims(long nowMs) {
        String sql = "SELECT " + TaskStore.COLUMNS
                + " FROM tasks WHERE status=? AND (lock_expiry_ms IS NULL OR lock_expiry_ms<=?) ORDER BY lock_expiry_ms";
        List<Task> out = new ArrayList<>();
        try (Connection c = store.database().openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TaskStatus.RUNNING.name());
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(TaskStore.readTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to find expired claims", e);
        }
    }

    private static Optional<Task> selectEligible(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(ELIGIBLE_SQL)) {
            ps.setString(1, TaskStatus.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(TaskStore.readTask(rs));
            }
        }
    }
}

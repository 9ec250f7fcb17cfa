package io.sokrates.storage;

import io.sokrates.error.StoreException;
import io.sokrates.model.FailureKind;
import io.sokrates.model.NewTask;
import io.sokrates.model.Priority;
import io.sokrates.model.Task;
import io.sokrates.model.TaskFailure;
import io.sokrates.model.TaskFilter;
import io.sokrates.model.TaskStatus;
import io.sokrates.retry.RetryPolicy;
import io.sokrates.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Durable task records. The database is the only source of truth; nothing is cached.
 *
 * <p>Outcome writes ({@link #complete}, {@link #fail}) are fenced on the claim owner, so a daemon whose
 * lease was reclaimed cannot overwrite the newer attempt.
 */
public final class TaskStore {
    static final String COLUMNS = "task_id,kind,payload,priority,priority_rank,status,attempts,max_attempts,"
            + "created_at_ms,updated_at_ms,started_at_ms,finished_at_ms,retry_at_ms,result,error,error_kind,"
            + "lock_owner,lock_expiry_ms,cancel_requested";

    private final Database database;

    public TaskStore(Database database) {
        this.database = database;
    }

    Database database() {
        return database;
    }

    public String create(NewTask t) {
        String sql = "INSERT INTO tasks(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.id());
            ps.setString(2, t.kind());
            ps.setString(3, Jsons.toCompactJson(t.payload()));
            ps.setString(4, t.priority().name());
            ps.setInt(5, t.priority().rank());
            ps.setString(6, TaskStatus.PENDING.name());
            ps.setInt(7, 0);
            ps.setInt(8, t.maxAttempts());
            ps.setLong(9, t.createdAtMs());
            ps.setLong(10, t.createdAtMs());
            ps.setNull(11, Types.INTEGER);
            ps.setNull(12, Types.INTEGER);
            ps.setNull(13, Types.INTEGER);
            ps.setNull(14, Types.VARCHAR);
            ps.setNull(15, Types.VARCHAR);
            ps.setNull(16, Types.VARCHAR);
            ps.setNull(17, Types.VARCHAR);
            ps.setNull(18, Types.INTEGER);
            ps.setInt(19, 0);
            ps.executeUpdate();
            return t.id();
        } catch (SQLException e) {
            throw new StoreException("Failed to create task " + t.id(), e);
        }
    }

    public Optional<Task> get(String taskId) {
        try (Connection c = database.openConnection()) {
            return read(c, taskId);
        } catch (SQLException e) {
            throw new StoreException("Failed to read task " + taskId, e);
        }
    }

    /**
     * Read-modify-write of one record inside a single {@code BEGIN IMMEDIATE} transaction.
     * When {@code mutation} throws, nothing is written and the exception propagates. Returning the
     * same instance skips the write.
     *
     * @return the stored record after the update, or empty when the id is unknown
     */
    public Optional<Task> update(String taskId, UnaryOperator<Task> mutation) {
        return inTransaction("update task " + taskId, c -> {
            Optional<Task> current = read(c, taskId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            Task before = current.get();
            Task after = mutation.apply(before);
            if (after == null || after == before) {
                return current;
            }
            write(c, after, before.status());
            return Optional.of(after);
        });
    }

    public boolean delete(String taskId) {
        return delete(taskId, t -> { }).isPresent();
    }

    /**
     * Deletes the record after {@code precondition} accepted it, atomically with the check.
     *
     * @return the removed record, or empty when the id is unknown
     */
    public Optional<Task> delete(String taskId, Consumer<Task> precondition) {
        return inTransaction("delete task " + taskId, c -> {
            Optional<Task> current = read(c, taskId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            precondition.accept(current.get());
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM tasks WHERE task_id=?")) {
                ps.setString(1, taskId);
                ps.executeUpdate();
            }
            return current;
        });
    }

    /**
     * Filtered listing, newest first.
     */
    public List<Task> list(TaskFilter filter) {
        TaskFilter f = filter == null ? TaskFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM tasks WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (!f.statuses().isEmpty()) {
            sql.append(" AND status IN (");
            int i = 0;
            for (TaskStatus s : f.statuses()) {
                sql.append(i++ == 0 ? "?" : ",?");
                args.add(s.name());
            }
            sql.append(")");
        }
        if (f.priority() != null) {
            sql.append(" AND priority_rank=?");
            args.add(f.priority().rank());
        }
        if (f.kind() != null) {
            sql.append(" AND kind=?");
            args.add(f.kind());
        }
        if (f.createdFromMs() != null) {
            sql.append(" AND created_at_ms>=?");
            args.add(f.createdFromMs());
        }
        if (f.createdToMs() != null) {
            sql.append(" AND created_at_ms<?");
            args.add(f.createdToMs());
        }
        sql.append(" ORDER BY created_at_ms DESC, rowid DESC LIMIT ? OFFSET ?");
        args.add(f.limit());
        args.add(f.offset());

        List<Task> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list tasks", e);
        }
    }

    public Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> out = new EnumMap<>(TaskStatus.class);
        for (TaskStatus s : TaskStatus.values()) {
            out.put(s, 0);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status, COUNT(*) AS n FROM tasks GROUP BY status");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks", e);
        }
    }

    /**
     * Removes terminal tasks that finished before {@code cutoffMs}. Failed tasks still awaiting a retry are kept.
     */
    public int purgeFinishedBefore(long cutoffMs) {
        String sql = """
                DELETE FROM tasks
                WHERE finished_at_ms IS NOT NULL AND finished_at_ms < ?
                  AND (status IN (?, ?) OR (status = ? AND retry_at_ms IS NULL))
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoffMs);
            ps.setString(2, TaskStatus.COMPLETED.name());
            ps.setString(3, TaskStatus.CANCELLED.name());
            ps.setString(4, TaskStatus.FAILED.name());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to purge finished tasks", e);
        }
    }

    public boolean isCancelRequested(String taskId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT cancel_requested FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt("cancel_requested") != 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read cancel flag of task " + taskId, e);
        }
    }

    /**
     * {@code running -> completed}, only while {@code owner} still holds the claim.
     */
    public boolean complete(String taskId, String owner, String result, long nowMs) {
        return inTransaction("complete task " + taskId, c -> {
            Optional<Task> current = read(c, taskId);
            if (current.isEmpty() || !heldBy(current.get(), owner)) {
                return false;
            }
            return write(c, current.get().markCompleted(result, nowMs), TaskStatus.RUNNING);
        });
    }

    /**
     * {@code running -> failed}, with a retry scheduled when the failure is transient and attempts remain.
     * Permanent failures are terminal regardless of the attempt count.
     */
    public FailureResolution fail(String taskId, String owner, TaskFailure failure, RetryPolicy policy, long nowMs) {
        return inTransaction("fail task " + taskId, c -> {
            Optional<Task> current = read(c, taskId);
            if (current.isEmpty() || !heldBy(current.get(), owner)) {
                return FailureResolution.staleClaim();
            }
            Task t = current.get();
            if (failure.retryable() && t.attemptsRemaining()) {
                long delay = policy.delayMs(t.attempts(), bound -> ThreadLocalRandom.current().nextLong(bound));
                long retryAt = nowMs + delay;
                write(c, t.markFailed(failure.message(), failure.kind(), retryAt, nowMs), TaskStatus.RUNNING);
                return FailureResolution.retryScheduled(t.attempts(), retryAt);
            }
            write(c, t.markFailed(failure.message(), failure.kind(), null, nowMs), TaskStatus.RUNNING);
            return FailureResolution.failedTerminal(t.attempts());
        });
    }

    /**
     * Crash recovery for a claim whose lease ran out: the interrupted attempt counts as a transient
     * failure and, when attempts remain, the task goes straight back to pending without backoff.
     */
    public FailureResolution recoverExpired(String taskId, long nowMs, String reason) {
        return inTransaction("recover task " + taskId, c -> {
            Optional<Task> current = read(c, taskId);
            if (current.isEmpty()) {
                return FailureResolution.staleClaim();
            }
            Task t = current.get();
            if (t.status() != TaskStatus.RUNNING || (t.lockExpiryMs() != null && t.lockExpiryMs() > nowMs)) {
                return FailureResolution.staleClaim();
            }
            if (t.attemptsRemaining()) {
                Task pending = t.markFailed(reason, FailureKind.TRANSIENT, nowMs, nowMs).markRetryPending(nowMs);
                write(c, pending, TaskStatus.RUNNING);
                return FailureResolution.retryScheduled(t.attempts(), nowMs);
            }
            write(c, t.markFailed(reason, FailureKind.TRANSIENT, null, nowMs), TaskStatus.RUNNING);
            return FailureResolution.failedTerminal(t.attempts());
        });
    }

    private static boolean heldBy(Task t, String owner) {
        return t.status() == TaskStatus.RUNNING && owner != null && owner.equals(t.lockOwner());
    }

    <R> R inTransaction(String what, TxWork<R> work) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                R out = work.run(c);
                c.commit();
                return out;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + what, e);
        }
    }

    static Optional<Task> read(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readTask(rs));
            }
        }
    }

    /**
     * Compare-and-set write of every mutable column.
     *
     * @return false when the stored status is no longer {@code expectedStatus}
     */
    static boolean write(Connection c, Task t, TaskStatus expectedStatus) throws SQLException {
        String sql = """
                UPDATE tasks SET status=?,attempts=?,max_attempts=?,updated_at_ms=?,started_at_ms=?,finished_at_ms=?,
                    retry_at_ms=?,result=?,error=?,error_kind=?,lock_owner=?,lock_expiry_ms=?,cancel_requested=?
                WHERE task_id=? AND status=?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.status().name());
            ps.setInt(2, t.attempts());
            ps.setInt(3, t.maxAttempts());
            ps.setLong(4, t.updatedAtMs());
            setNullableLong(ps, 5, t.startedAtMs());
            setNullableLong(ps, 6, t.finishedAtMs());
            setNullableLong(ps, 7, t.retryAtMs());
            ps.setString(8, t.result());
            ps.setString(9, t.error());
            ps.setString(10, t.errorKind() == null ? null : t.errorKind().name());
            ps.setString(11, t.lockOwner());
            setNullableLong(ps, 12, t.lockExpiryMs());
            ps.setInt(13, t.cancelRequested() ? 1 : 0);
            ps.setString(14, t.id());
            ps.setString(15, expectedStatus.name());
            return ps.executeUpdate() == 1;
        }
    }

    static Task readTask(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("task_id"),
                rs.getString("kind"),
                Jsons.parseObject(rs.getString("payload")),
                Priority.valueOf(rs.getString("priority")),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "finished_at_ms"),
                nullableLong(rs, "retry_at_ms"),
                rs.getString("result"),
                rs.getString("error"),
                FailureKind.fromNullable(rs.getString("error_kind")),
                rs.getString("lock_owner"),
                nullableLong(rs, "lock_expiry_ms"),
                rs.getInt("cancel_requested") != 0
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    @FunctionalInterface
    interface TxWork<R> {
        R run(Connection c) throws SQLException;
    }

    public enum FailureOutcome {
        RETRY_SCHEDULED,
        FAILED_TERMINAL,
        STALE_CLAIM
    }

    public record FailureResolution(FailureOutcome outcome, int attempts, Long nextRetryAtMs) {
        public static FailureResolution retryScheduled(int attempts, long nextRetryAtMs) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, attempts, nextRetryAtMs);
        }

        public static FailureResolution failedTerminal(int attempts) {
            return new FailureResolution(FailureOutcome.FAILED_TERMINAL, attempts, null);
        }

        public static FailureResolution staleClaim() {
            return new FailureResolution(FailureOutcome.STALE_CLAIM, 0, null);
        }
    }
}

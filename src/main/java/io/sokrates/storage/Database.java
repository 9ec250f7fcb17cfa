package io.sokrates.storage;

import io.sokrates.config.SokratesConfig;
import io.sokrates.error.StoreException;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the SQLite file and its schema.
 *
 * <p>Every connection runs in WAL mode with a busy timeout, and {@code setAutoCommit(false)} opens a
 * {@code BEGIN IMMEDIATE} transaction, so a read-modify-write holds the write lock from its first read.
 */
public final class Database {
    static final int BUSY_TIMEOUT_MS = 10_000;

    private final Path dbFile;
    private final String jdbcUrl;
    private final SQLiteConfig sqliteConfig;

    public Database(SokratesConfig config) {
        this(config.dbFile());
    }

    public Database(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile;
        this.sqliteConfig = new SQLiteConfig();
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqliteConfig.setBusyTimeout(BUSY_TIMEOUT_MS);
    }

    public Path dbFile() {
        return dbFile;
    }

    public void init() {
        initDirectories();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, sqliteConfig.toProperties());
    }

    private void initDirectories() {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("Failed to create database directory " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        task_id TEXT PRIMARY KEY,
                        kind TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        priority TEXT NOT NULL,
                        priority_rank INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        max_attempts INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        retry_at_ms INTEGER,
                        result TEXT,
                        error TEXT,
                        error_kind TEXT,
                        lock_owner TEXT,
                        lock_expiry_ms INTEGER,
                        cancel_requested INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize schema in " + dbFile, e);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20250301_001_queue_indexes",
                "Indexes for queue order, lease expiry and retry release",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_tasks_queue ON tasks(status, priority_rank, created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_tasks_lease ON tasks(status, lock_expiry_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_tasks_retry ON tasks(status, retry_at_ms)"
                )
        ));
        steps.add(new MigrationStep(
                "20250301_002_listing_indexes",
                "Indexes for list filters",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_tasks_kind ON tasks(kind)",
                        "CREATE INDEX IF NOT EXISTS idx_tasks_created ON tasks(created_at_ms)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement ps = conn.prepareStatement(
                     "INSERT OR REPLACE INTO schema_migrations(version,description,applied_at_ms,success) VALUES(?,?,?,1)")) {
            for (String sql : step.statements()) {
                st.execute(sql);
            }
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private record MigrationStep(String version, String description, List<String> statements) {
    }
}

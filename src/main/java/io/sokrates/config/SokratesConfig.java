package io.sokrates.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import io.sokrates.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Resolved configuration: file locations under the per-user home directory plus queue and LLM settings.
 *
 * <p>Resolution order, last wins: built-in defaults, {@code settings.json} in the home directory,
 * {@code SOKRATES_*} environment variables.
 */
public final class SokratesConfig {
    public static final String DEFAULT_HOME_DIR = ".sokrates";
    public static final String SETTINGS_FILE = "settings.json";

    public static final long DEFAULT_POLL_INTERVAL_MS = 15_000L;
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_RECLAIM_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_STOP_TIMEOUT_MS = 60_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_JITTER_MS = 250L;

    public static final String DEFAULT_API_ENDPOINT = "http://localhost:1234/v1";
    public static final String DEFAULT_API_KEY = "notrequired";
    public static final String DEFAULT_MODEL = "qwen/qwen3-8b";
    public static final double DEFAULT_MODEL_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 20_000;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 300_000L;

    static final String ENV_HOME = "SOKRATES_HOME";
    static final String ENV_API_ENDPOINT = "SOKRATES_API_ENDPOINT";
    static final String ENV_API_KEY = "SOKRATES_API_KEY";
    static final String ENV_DEFAULT_MODEL = "SOKRATES_DEFAULT_MODEL";
    static final String ENV_DEFAULT_MODEL_TEMPERATURE = "SOKRATES_DEFAULT_MODEL_TEMPERATURE";
    static final String ENV_DATABASE_PATH = "SOKRATES_DATABASE_PATH";
    static final String ENV_DAEMON_LOGFILE_PATH = "SOKRATES_TASK_QUEUE_DAEMON_LOGFILE_PATH";
    static final String ENV_DAEMON_PROCESSING_INTERVAL = "SOKRATES_TASK_QUEUE_DAEMON_PROCESSING_INTERVAL";

    private static final DateTimeFormatter RESULT_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm");

    private final Path rootDir;
    private final Path dbFile;
    private final Path daemonLogFile;
    private final QueueSettings queue;
    private final LlmSettings llm;

    public SokratesConfig(Path rootDir, Path dbFile, Path daemonLogFile, QueueSettings queue, LlmSettings llm) {
        this.rootDir = rootDir;
        this.dbFile = dbFile;
        this.daemonLogFile = daemonLogFile;
        this.queue = queue;
        this.llm = llm;
    }

    public static SokratesConfig load() {
        return load(null, System.getenv());
    }

    /**
     * @param home explicit home directory (for example from {@code --home}); overrides {@code SOKRATES_HOME}
     */
    public static SokratesConfig load(String home, Map<String, String> env) {
        Map<String, String> vars = env == null ? Map.of() : env;
        Path root = resolveRoot(home, vars);
        SettingsFile file = readSettingsFile(root.resolve(SETTINGS_FILE));

        QueueSettings queue = mergeQueue(file.queue(), vars);
        LlmSettings llm = mergeLlm(file.llm(), vars);

        Path db = pathOrDefault(vars.get(ENV_DATABASE_PATH), root.resolve("sokrates_database.sqlite"));
        Path log = pathOrDefault(vars.get(ENV_DAEMON_LOGFILE_PATH), root.resolve("logs").resolve("daemon.log"));
        return new SokratesConfig(root, db, log, queue, llm);
    }

    /**
     * Config rooted at {@code root} with built-in defaults only; environment and settings file are ignored.
     */
    public static SokratesConfig fromRoot(Path root) {
        Path base = root.toAbsolutePath().normalize();
        return new SokratesConfig(
                base,
                base.resolve("sokrates_database.sqlite"),
                base.resolve("logs").resolve("daemon.log"),
                QueueSettings.defaults(),
                LlmSettings.defaults()
        );
    }

    public SokratesConfig withQueue(QueueSettings value) {
        return new SokratesConfig(rootDir, dbFile, daemonLogFile, value, llm);
    }

    public SokratesConfig withLlm(LlmSettings value) {
        return new SokratesConfig(rootDir, dbFile, daemonLogFile, queue, value);
    }

    private static Path resolveRoot(String home, Map<String, String> env) {
        String raw = home;
        if (raw == null || raw.isBlank()) {
            raw = env.get(ENV_HOME);
        }
        Path resolved = raw == null || raw.isBlank()
                ? Paths.get(System.getProperty("user.home"), DEFAULT_HOME_DIR)
                : Paths.get(raw.trim());
        return resolved.toAbsolutePath().normalize();
    }

    private static SettingsFile readSettingsFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return SettingsFile.EMPTY;
        }
        ObjectReader reader = Jsons.mapper()
                .readerFor(SettingsFile.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            SettingsFile parsed = reader.readValue(file.toFile());
            return parsed == null ? SettingsFile.EMPTY : parsed;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    private static QueueSettings mergeQueue(QueueSection section, Map<String, String> env) {
        QueueSettings d = QueueSettings.defaults();
        QueueSection s = section == null ? QueueSection.EMPTY : section;
        long pollMs = pick(s.pollIntervalMs(), d.pollIntervalMs());
        String intervalSeconds = env.get(ENV_DAEMON_PROCESSING_INTERVAL);
        if (intervalSeconds != null && !intervalSeconds.isBlank()) {
            pollMs = parseLong(ENV_DAEMON_PROCESSING_INTERVAL, intervalSeconds) * 1_000L;
        }
        return new QueueSettings(
                pollMs,
                pick(s.leaseTimeoutMs(), d.leaseTimeoutMs()),
                pick(s.reclaimIntervalMs(), d.reclaimIntervalMs()),
                pick(s.stopTimeoutMs(), d.stopTimeoutMs()),
                s.maxAttempts() == null ? d.defaultMaxAttempts() : s.maxAttempts(),
                pick(s.baseBackoffMs(), d.baseBackoffMs()),
                pick(s.maxBackoffMs(), d.maxBackoffMs()),
                pick(s.jitterMs(), d.jitterMs()),
                s.retentionDays() == null ? d.retentionDays() : s.retentionDays()
        );
    }

    private static LlmSettings mergeLlm(LlmSection section, Map<String, String> env) {
        LlmSettings d = LlmSettings.defaults();
        LlmSection s = section == null ? LlmSection.EMPTY : section;
        String endpoint = firstNonBlank(env.get(ENV_API_ENDPOINT), s.apiEndpoint(), d.apiEndpoint());
        String apiKey = firstNonBlank(env.get(ENV_API_KEY), s.apiKey(), d.apiKey());
        String model = firstNonBlank(env.get(ENV_DEFAULT_MODEL), s.defaultModel(), d.defaultModel());
        double temperature = s.temperature() == null ? d.temperature() : s.temperature();
        String rawTemperature = env.get(ENV_DEFAULT_MODEL_TEMPERATURE);
        if (rawTemperature != null && !rawTemperature.isBlank()) {
            try {
                temperature = Double.parseDouble(rawTemperature.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_DEFAULT_MODEL_TEMPERATURE + " is not a number: " + rawTemperature, e);
            }
        }
        return new LlmSettings(
                endpoint,
                apiKey,
                model,
                temperature,
                s.maxTokens() == null ? d.maxTokens() : s.maxTokens(),
                pick(s.requestTimeoutMs(), d.requestTimeoutMs())
        );
    }

    private static long pick(Long value, long fallback) {
        return value == null ? fallback : value;
    }

    private static long parseLong(String name, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + raw, e);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    private static Path pathOrDefault(String raw, Path fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Paths.get(raw.trim()).toAbsolutePath().normalize();
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return dbFile;
    }

    public Path daemonLogFile() {
        return daemonLogFile;
    }

    public Path logsDir() {
        return rootDir.resolve("logs");
    }

    public Path auditFile() {
        return logsDir().resolve("audit.log");
    }

    public Path daemonMarkerFile() {
        return rootDir.resolve("daemon.pid.json");
    }

    public Path resultsRoot() {
        return rootDir.resolve("tasks").resolve("results");
    }

    /**
     * Per-run result directory, {@code tasks/results/yyyy-MM-dd_HH-mm}.
     */
    public Path resultsDirFor(LocalDateTime time) {
        return resultsRoot().resolve(RESULT_DIR_FORMAT.format(time));
    }

    public QueueSettings queue() {
        return queue;
    }

    public LlmSettings llm() {
        return llm;
    }

    record SettingsFile(QueueSection queue, LlmSection llm) {
        static final SettingsFile EMPTY = new SettingsFile(null, null);
    }

    record QueueSection(
            Long pollIntervalMs,
            Long leaseTimeoutMs,
            Long reclaimIntervalMs,
            Long stopTimeoutMs,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long jitterMs,
            Integer retentionDays
    ) {
        static final QueueSection EMPTY = new QueueSection(null, null, null, null, null, null, null, null, null);
    }

    record LlmSection(
            String apiEndpoint,
            String apiKey,
            String defaultModel,
            Double temperature,
            Integer maxTokens,
            Long requestTimeoutMs
    ) {
        static final LlmSection EMPTY = new LlmSection(null, null, null, null, null, null);
    }
}

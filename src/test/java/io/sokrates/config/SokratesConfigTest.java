package io.sokrates.config;

import io.sokrates.testing.TempDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;

final class SokratesConfigTest {

    @Test
    void defaultsApplyWithoutSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-config-defaults-");
        try {
            SokratesConfig config = SokratesConfig.load(root.toString(), Map.of());
            Assertions.assertEquals(root.toAbsolutePath().normalize(), config.rootDir());
            Assertions.assertEquals(config.rootDir().resolve("sokrates_database.sqlite"), config.dbFile());
            Assertions.assertEquals(config.rootDir().resolve("logs").resolve("daemon.log"), config.daemonLogFile());
            Assertions.assertEquals(SokratesConfig.DEFAULT_POLL_INTERVAL_MS, config.queue().pollIntervalMs());
            Assertions.assertEquals(SokratesConfig.DEFAULT_MAX_ATTEMPTS, config.queue().defaultMaxAttempts());
            Assertions.assertEquals(SokratesConfig.DEFAULT_MODEL, config.llm().defaultModel());
            Assertions.assertEquals(SokratesConfig.DEFAULT_API_ENDPOINT, config.llm().apiEndpoint());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void environmentOverridesSettingsFile() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-config-env-");
        try {
            Files.writeString(root.resolve(SokratesConfig.SETTINGS_FILE), """
                    {
                      "queue": {"pollIntervalMs": 500, "maxAttempts": 5, "unknownKey": true},
                      "llm": {"defaultModel": "file-model", "apiEndpoint": "http://file:1/v1", "maxTokens": 99}
                    }
                    """, StandardCharsets.UTF_8);
            Path db = root.resolve("custom.sqlite");
            SokratesConfig config = SokratesConfig.load(root.toString(), Map.of(
                    SokratesConfig.ENV_DEFAULT_MODEL, "env-model",
                    SokratesConfig.ENV_DAEMON_PROCESSING_INTERVAL, "2",
                    SokratesConfig.ENV_DATABASE_PATH, db.toString(),
                    SokratesConfig.ENV_DEFAULT_MODEL_TEMPERATURE, "0.2"
            ));
            Assertions.assertEquals(2_000L, config.queue().pollIntervalMs());
            Assertions.assertEquals(5, config.queue().defaultMaxAttempts());
            Assertions.assertEquals("env-model", config.llm().defaultModel());
            Assertions.assertEquals("http://file:1/v1", config.llm().apiEndpoint());
            Assertions.assertEquals(99, config.llm().maxTokens());
            Assertions.assertEquals(0.2, config.llm().temperature(), 1e-9);
            Assertions.assertEquals(db.toAbsolutePath().normalize(), config.dbFile());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void homeEnvironmentVariableUsedWhenNoExplicitHome() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-config-home-");
        try {
            SokratesConfig config = SokratesConfig.load(null, Map.of(SokratesConfig.ENV_HOME, root.toString()));
            Assertions.assertEquals(root.toAbsolutePath().normalize(), config.rootDir());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void invalidNumbersAreRejected() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-config-invalid-");
        try {
            Assertions.assertThrows(IllegalArgumentException.class, () -> SokratesConfig.load(root.toString(),
                    Map.of(SokratesConfig.ENV_DAEMON_PROCESSING_INTERVAL, "soon")));
            Assertions.assertThrows(IllegalArgumentException.class, () -> SokratesConfig.load(root.toString(),
                    Map.of(SokratesConfig.ENV_DEFAULT_MODEL_TEMPERATURE, "warm")));
            Assertions.assertThrows(IllegalArgumentException.class, () -> QueueSettings.defaults().withPollIntervalMs(1L));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void resultDirectoryIsTimestamped() {
        SokratesConfig config = SokratesConfig.fromRoot(Path.of("/tmp/sokrates-home"));
        Path dir = config.resultsDirFor(LocalDateTime.of(2025, 3, 1, 9, 5));
        Assertions.assertEquals(config.rootDir().resolve("tasks").resolve("results").resolve("2025-03-01_09-05"), dir);
    }
}

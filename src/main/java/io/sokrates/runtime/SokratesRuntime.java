package io.sokrates.runtime;

import io.sokrates.config.SokratesConfig;
import io.sokrates.daemon.DaemonManager;
import io.sokrates.daemon.DaemonMarker;
import io.sokrates.daemon.QueueDaemon;
import io.sokrates.executor.TaskExecutor;
import io.sokrates.handler.HandlerRegistry;
import io.sokrates.handler.PromptTemplates;
import io.sokrates.llm.LlmClient;
import io.sokrates.llm.OpenAiCompatibleClient;
import io.sokrates.observability.AuditLogger;
import io.sokrates.service.TaskQueueService;
import io.sokrates.storage.Database;
import io.sokrates.storage.QueueIndex;
import io.sokrates.storage.TaskStore;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Wires the queue components for one home directory.
 */
public final class SokratesRuntime {
    private final SokratesConfig config;
    private final Database database;
    private final TaskStore taskStore;
    private final QueueIndex queueIndex;
    private final HandlerRegistry handlers;
    private final Clock clock;
    private AuditLogger auditLogger;

    public SokratesRuntime(SokratesConfig config) {
        this(config, new OpenAiCompatibleClient(config.llm()), Clock.systemUTC());
    }

    public SokratesRuntime(SokratesConfig config, LlmClient llmClient, Clock clock) {
        this(config, HandlerRegistry.withDefaults(llmClient, config.llm(), new PromptTemplates(),
                () -> config.resultsDirFor(LocalDateTime.now(clock))), clock);
    }

    public SokratesRuntime(SokratesConfig config, HandlerRegistry handlers, Clock clock) {
        this.config = config;
        this.database = new Database(config);
        this.taskStore = new TaskStore(database);
        this.queueIndex = new QueueIndex(taskStore);
        this.handlers = handlers;
        this.clock = clock;
    }

    public SokratesRuntime init() {
        database.init();
        this.auditLogger = new AuditLogger(config.auditFile());
        return this;
    }

    public SokratesConfig config() {
        return config;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public QueueIndex queueIndex() {
        return queueIndex;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public AuditLogger auditLogger() {
        requireInit();
        return auditLogger;
    }

    public TaskQueueService service(String actor) {
        requireInit();
        return new TaskQueueService(taskStore, handlers, config.queue().defaultMaxAttempts(), auditLogger, clock, actor);
    }

    /**
     * @param withMarker whether the daemon registers itself in the process marker file
     */
    public QueueDaemon daemon(boolean withMarker) {
        requireInit();
        DaemonMarker marker = withMarker ? new DaemonMarker(config.daemonMarkerFile()) : null;
        return new QueueDaemon(taskStore, queueIndex, new TaskExecutor(handlers), config.queue(), marker,
                auditLogger, QueueDaemon.defaultOwner(), clock);
    }

    public DaemonManager daemonManager() {
        return new DaemonManager(config, new DaemonMarker(config.daemonMarkerFile()), clock);
    }

    private void requireInit() {
        if (auditLogger == null) {
            throw new IllegalStateException("Runtime not initialized; call init() first");
        }
    }
}

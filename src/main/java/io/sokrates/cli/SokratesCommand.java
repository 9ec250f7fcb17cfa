package io.sokrates.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sokrates.config.SokratesConfig;
import io.sokrates.daemon.DaemonManager;
import io.sokrates.daemon.QueueDaemon;
import io.sokrates.error.QueueException;
import io.sokrates.error.ValidationException;
import io.sokrates.model.Priority;
import io.sokrates.model.TaskFilter;
import io.sokrates.model.TaskStatus;
import io.sokrates.runtime.SokratesRuntime;
import io.sokrates.service.TaskQueueService;
import io.sokrates.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

@Command(
        name = "sokrates",
        mixinStandardHelpOptions = true,
        version = "sokrates 0.3.0",
        description = "Persistent prioritized task queue for LLM jobs",
        subcommands = {
                SokratesCommand.AddCommand.class,
                SokratesCommand.ListCommand.class,
                SokratesCommand.StatusCommand.class,
                SokratesCommand.RemoveCommand.class,
                SokratesCommand.CancelCommand.class,
                SokratesCommand.RequeueCommand.class,
                SokratesCommand.StatsCommand.class,
                SokratesCommand.PurgeCommand.class,
                SokratesCommand.KindsCommand.class,
                SokratesCommand.DaemonCommand.class
        }
)
public final class SokratesCommand implements Runnable {
    public static final int EXIT_GENERIC = 1;

    @Option(names = {"--home"}, description = "Home directory (default: $SOKRATES_HOME or ~/.sokrates)")
    String home;

    private final Function<SokratesConfig, SokratesRuntime> runtimeFactory;
    private final Map<String, String> env;

    public SokratesCommand() {
        this(SokratesRuntime::new, System.getenv());
    }

    public SokratesCommand(Function<SokratesConfig, SokratesRuntime> runtimeFactory, Map<String, String> env) {
        this.runtimeFactory = runtimeFactory;
        this.env = env;
    }

    /**
     * Command line with exit-code mapping: queue errors carry their own code, everything else exits 1.
     * Errors are printed to stderr as {@code {"error": kind, "message": text}}.
     */
    public static CommandLine newCommandLine(SokratesCommand root) {
        CommandLine cmd = new CommandLine(root);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            String kind;
            int code;
            if (ex instanceof QueueException qe) {
                kind = qe.code().wireName();
                code = qe.code().exitCode();
            } else if (ex instanceof IllegalArgumentException) {
                kind = "invalid_input";
                code = commandLine.getCommandSpec().exitCodeOnInvalidInput();
            } else {
                kind = "internal";
                code = EXIT_GENERIC;
            }
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("error", kind);
            err.put("message", ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
            commandLine.getErr().println(Jsons.toCompactJson(err));
            commandLine.getErr().flush();
            return code;
        });
        return cmd;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: add | list | status | remove | cancel | requeue | stats | purge | kinds | daemon");
    }

    SokratesConfig config() {
        return SokratesConfig.load(home, env);
    }

    SokratesRuntime runtime() {
        return runtimeFactory.apply(config()).init();
    }

    TaskQueueService service() {
        return runtime().service("cli");
    }

    static void print(Object value) {
        System.out.println(Jsons.toJson(value));
    }

    @Command(name = "add", description = "Add a task to the queue")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Option(names = {"--kind"}, required = true, description = "Task kind, see 'kinds'")
        String kind;

        @Option(names = {"--payload"}, description = "Task payload as a JSON object")
        String payload;

        @Option(names = {"--prompt"}, description = "Shortcut for --payload '{\"prompt\": ...}'")
        String prompt;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "low|normal|high|urgent")
        String priority;

        @Option(names = {"--max-attempts"}, description = "Retry ceiling (default from settings)")
        Integer maxAttempts;

        @Override
        public Integer call() {
            if (payload != null && prompt != null) {
                throw new ValidationException("use either --payload or --prompt, not both");
            }
            String body = payload;
            if (prompt != null) {
                ObjectNode node = Jsons.mapper().createObjectNode();
                node.put("prompt", prompt);
                body = Jsons.toCompactJson(node);
            }
            String id = parent.service().add(kind, body, priority, maxAttempts);
            print(Map.of("taskId", id, "status", TaskStatus.PENDING.wireName()));
            return 0;
        }
    }

    @Command(name = "list", description = "List tasks, newest first")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Option(names = {"--status"}, split = ",", description = "Filter by status (comma separated)")
        List<String> statuses;

        @Option(names = {"--priority"}, description = "Filter by priority")
        String priority;

        @Option(names = {"--kind"}, description = "Filter by kind")
        String kind;

        @Option(names = {"--since"}, description = "Created at or after: ISO instant, yyyy-MM-dd or epoch ms")
        String since;

        @Option(names = {"--until"}, description = "Created before: ISO instant, yyyy-MM-dd or epoch ms")
        String until;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Pagination offset")
        int offset;

        @Override
        public Integer call() {
            TaskFilter filter;
            try {
                Set<TaskStatus> wanted = EnumSet.noneOf(TaskStatus.class);
                if (statuses != null) {
                    for (String s : statuses) {
                        wanted.add(TaskStatus.fromString(s));
                    }
                }
                filter = TaskFilter.all()
                        .withStatuses(wanted)
                        .withPriority(priority == null ? null : Priority.fromString(priority))
                        .withKind(kind)
                        .withCreatedBetween(parseTime(since), parseTime(until))
                        .withPage(limit, offset);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage(), e);
            }
            print(parent.service().list(filter));
            return 0;
        }
    }

    @Command(name = "status", description = "Show one task")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--verbose", "-v"}, description = "Include payload, result and claim fields")
        boolean verbose;

        @Override
        public Integer call() {
            print(parent.service().status(taskId, verbose));
            return 0;
        }
    }

    @Command(name = "remove", description = "Delete a task")
    static final class RemoveCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--force"}, description = "Also remove pending or running tasks")
        boolean force;

        @Override
        public Integer call() {
            parent.service().remove(taskId, force);
            print(Map.of("taskId", taskId, "removed", true));
            return 0;
        }
    }

    @Command(name = "cancel", description = "Cancel a pending task or ask a running one to stop")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            print(parent.service().cancel(taskId));
            return 0;
        }
    }

    @Command(name = "requeue", description = "Queue a failed or cancelled task again")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            print(parent.service().requeue(taskId));
            return 0;
        }
    }

    @Command(name = "stats", description = "Task counts per status")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Override
        public Integer call() {
            print(parent.service().stats());
            return 0;
        }
    }

    @Command(name = "purge", description = "Delete finished tasks older than N days")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Option(names = {"--older-than-days"}, required = true, description = "Age threshold in days")
        int olderThanDays;

        @Override
        public Integer call() {
            int purged = parent.service().purge(olderThanDays);
            print(Map.of("purged", purged));
            return 0;
        }
    }

    @Command(name = "kinds", description = "List supported task kinds")
    static final class KindsCommand implements Callable<Integer> {
        @ParentCommand
        SokratesCommand parent;

        @Override
        public Integer call() {
            print(parent.service().kinds());
            return 0;
        }
    }

    @Command(
            name = "daemon",
            description = "Manage the background daemon",
            subcommands = {
                    DaemonStartCommand.class,
                    DaemonStopCommand.class,
                    DaemonRestartCommand.class,
                    DaemonStatusCommand.class,
                    DaemonRunCommand.class
            }
    )
    static final class DaemonCommand implements Runnable {
        @ParentCommand
        SokratesCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: start | stop | restart | status | run");
        }

        DaemonManager manager() {
            return parent.runtime().daemonManager();
        }
    }

    @Command(name = "start", description = "Start the daemon in the background")
    static final class DaemonStartCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            print(daemon.manager().start());
            return 0;
        }
    }

    @Command(name = "stop", description = "Stop the background daemon")
    static final class DaemonStopCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            DaemonManager.DaemonStatus before = daemon.manager().stop();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("stopped", before.running());
            out.put("pid", before.pid());
            print(out);
            return 0;
        }
    }

    @Command(name = "restart", description = "Stop, then start the daemon")
    static final class DaemonRestartCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            print(daemon.manager().restart());
            return 0;
        }
    }

    @Command(name = "status", description = "Show daemon status")
    static final class DaemonStatusCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            print(daemon.manager().status());
            return 0;
        }
    }

    @Command(name = "run", description = "Run the daemon loop in the foreground")
    static final class DaemonRunCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Option(names = {"--once"}, defaultValue = "false", description = "Recover expired claims, process at most one task and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            SokratesRuntime runtime = daemon.parent.runtime();
            if (once) {
                QueueDaemon loop = runtime.daemon(false);
                loop.recoverExpiredClaims();
                print(loop.runOnce());
                return 0;
            }
            QueueDaemon loop = runtime.daemon(true);
            CountDownLatch finished = new CountDownLatch(1);
            long stopTimeoutMs = runtime.config().queue().stopTimeoutMs();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                loop.requestStop();
                try {
                    finished.await(stopTimeoutMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "sokrates-shutdown-hook"));
            try {
                loop.run();
            } finally {
                finished.countDown();
            }
            return 0;
        }
    }

    static Long parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim();
        if (v.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(v);
        }
        try {
            return Instant.parse(v).toEpochMilli();
        } catch (DateTimeParseException ignored) {
            // fall through to a plain date
        }
        try {
            return LocalDate.parse(v).atStartOfDay(ZoneId.systemDefault()).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognized time '" + raw + "' (expected ISO instant, yyyy-MM-dd or epoch ms)", e);
        }
    }
}

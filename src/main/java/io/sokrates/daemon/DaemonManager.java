package io.sokrates.daemon;

import io.sokrates.config.SokratesConfig;
import io.sokrates.error.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts, stops and inspects the background daemon process through its marker file.
 */
public final class DaemonManager {
    private static final Logger log = LoggerFactory.getLogger(DaemonManager.class);
    static final String MAIN_CLASS = "io.sokrates.Main";
    private static final long START_WAIT_MS = 10_000L;
    private static final long FORCE_KILL_WAIT_MS = 5_000L;

    private final SokratesConfig config;
    private final DaemonMarker marker;
    private final Clock clock;

    public DaemonManager(SokratesConfig config) {
        this(config, new DaemonMarker(config.daemonMarkerFile()), Clock.systemUTC());
    }

    public DaemonManager(SokratesConfig config, DaemonMarker marker, Clock clock) {
        this.config = config;
        this.marker = marker;
        this.clock = clock;
    }

    public DaemonStatus status() {
        Optional<DaemonMarker.Info> live = marker.readLive();
        if (live.isEmpty()) {
            return DaemonStatus.notRunning();
        }
        DaemonMarker.Info info = live.get();
        return new DaemonStatus(true, info.pid(), Math.max(0L, clock.millis() - info.startedAtMs()),
                info.startedAtMs(), info.heartbeatAtMs(), info.lastPollAtMs());
    }

    /**
     * Spawns {@code daemon run} as a detached JVM with output appended to the daemon log file.
     */
    public DaemonStatus start() {
        Optional<DaemonMarker.Info> live = marker.readLive();
        if (live.isPresent()) {
            throw new InvalidStateException("Daemon already running with pid " + live.get().pid());
        }
        Path logFile = config.daemonLogFile();
        Process process;
        try {
            Files.createDirectories(logFile.toAbsolutePath().getParent());
            ProcessBuilder pb = new ProcessBuilder(daemonCommand())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()))
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            process = pb.start();
        } catch (IOException e) {
            throw new RuntimeException("Failed to start daemon process", e);
        }
        log.info("Spawned daemon pid {} (log {})", process.pid(), logFile);

        long deadline = System.currentTimeMillis() + START_WAIT_MS;
        while (System.currentTimeMillis() < deadline) {
            Optional<DaemonMarker.Info> info = marker.read();
            if (info.isPresent() && info.get().pid() == process.pid()) {
                return status();
            }
            if (!process.isAlive()) {
                throw new IllegalStateException("Daemon exited during startup with code " + process.exitValue()
                        + "; see " + logFile);
            }
            sleep(100L);
        }
        throw new IllegalStateException("Daemon pid " + process.pid() + " did not register within "
                + START_WAIT_MS + " ms; see " + logFile);
    }

    /**
     * Asks the daemon to stop (SIGTERM) so the in-flight task can finish, then kills it after the stop timeout.
     *
     * @return the status before stopping
     */
    public DaemonStatus stop() {
        DaemonStatus before = status();
        if (!before.running()) {
            return before;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(before.pid());
        if (handle.isPresent()) {
            ProcessHandle process = handle.get();
            process.destroy();
            if (!awaitExit(process, config.queue().stopTimeoutMs())) {
                log.warn("Daemon pid {} did not stop within {} ms; killing it", before.pid(), config.queue().stopTimeoutMs());
                process.destroyForcibly();
                if (!awaitExit(process, FORCE_KILL_WAIT_MS)) {
                    throw new IllegalStateException("Daemon pid " + before.pid() + " survived a forced kill");
                }
            }
        }
        marker.clearIfOwned(before.pid());
        return before;
    }

    public DaemonStatus restart() {
        stop();
        return start();
    }

    List<String> daemonCommand() {
        String javaBin = ProcessHandle.current().info().command()
                .orElse(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        List<String> cmd = new ArrayList<>();
        cmd.add(javaBin);
        cmd.add("-Dsokrates.log.level=INFO");
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(MAIN_CLASS);
        cmd.add("--home");
        cmd.add(config.rootDir().toString());
        cmd.add("daemon");
        cmd.add("run");
        return cmd;
    }

    private static boolean awaitExit(ProcessHandle process, long timeoutMs) {
        try {
            process.onExit().get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return !process.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed waiting for pid " + process.pid(), e);
        }
    }

    private static File nullDevice() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return new File(os.contains("win") ? "NUL" : "/dev/null");
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for daemon", e);
        }
    }

    public record DaemonStatus(boolean running, Long pid, Long uptimeMs, Long startedAtMs, Long heartbeatAtMs,
                               Long lastPollAtMs) {
        public static DaemonStatus notRunning() {
            return new DaemonStatus(false, null, null, null, null, null);
        }
    }
}

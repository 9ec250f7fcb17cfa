package io.sokrates.daemon;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.sokrates.error.InvalidStateException;
import io.sokrates.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Process marker file recording the running daemon.
 *
 * <p>A marker is live only when its pid exists and that process started at the recorded instant, so a
 * pid reused by an unrelated process after a crash does not count as a running daemon.
 */
public final class DaemonMarker {
    private static final Logger log = LoggerFactory.getLogger(DaemonMarker.class);
    private static final long START_INSTANT_TOLERANCE_MS = 1_000L;

    private final Path file;

    public DaemonMarker(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public static Info forCurrentProcess(long nowMs) {
        ProcessHandle self = ProcessHandle.current();
        Long startMs = self.info().startInstant().map(Instant::toEpochMilli).orElse(null);
        return new Info(self.pid(), startMs, nowMs, nowMs, null);
    }

    /**
     * Atomically creates the marker; a live daemon already recorded is an error, a stale marker is replaced.
     */
    public void create(Info info) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create marker directory for " + file, e);
        }
        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                Files.writeString(file, Jsons.toCompactJson(info), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return;
            } catch (FileAlreadyExistsException e) {
                Optional<Info> existing = read();
                if (existing.isPresent() && isAlive(existing.get())) {
                    throw new InvalidStateException("Daemon already running with pid " + existing.get().pid());
                }
                log.warn("Removing stale daemon marker {} ({})", file, existing.map(i -> "pid " + i.pid()).orElse("unreadable"));
                clear();
            } catch (IOException e) {
                throw new RuntimeException("Failed to write daemon marker " + file, e);
            }
        }
        throw new InvalidStateException("Another daemon claimed marker " + file + " concurrently");
    }

    public Optional<Info> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().readValue(raw, Info.class));
        } catch (IOException e) {
            log.warn("Unreadable daemon marker {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Marker of a live daemon. A stale marker is deleted and reported as absent.
     */
    public Optional<Info> readLive() {
        Optional<Info> info = read();
        if (info.isPresent() && isAlive(info.get())) {
            return info;
        }
        if (Files.exists(file)) {
            log.info("Clearing stale daemon marker {}", file);
            clear();
        }
        return Optional.empty();
    }

    /**
     * Rewrites the heartbeat fields, only while the marker still belongs to {@code pid}.
     */
    public void refresh(long pid, long heartbeatAtMs, Long lastPollAtMs) {
        Optional<Info> current = read();
        if (current.isEmpty() || current.get().pid() != pid) {
            return;
        }
        Info next = current.get().withHeartbeat(heartbeatAtMs, lastPollAtMs);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, Jsons.toCompactJson(next), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to refresh daemon marker " + file, e);
        }
    }

    /**
     * Deletes the marker only if it still names {@code pid}.
     */
    public void clearIfOwned(long pid) {
        Optional<Info> current = read();
        if (current.isPresent() && current.get().pid() == pid) {
            clear();
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete daemon marker " + file, e);
        }
    }

    public static boolean isAlive(Info info) {
        Optional<ProcessHandle> handle = ProcessHandle.of(info.pid());
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return false;
        }
        if (info.processStartMs() == null) {
            return true;
        }
        Optional<Instant> actualStart = handle.get().info().startInstant();
        // Platforms without start instants fall back to the pid check.
        return actualStart
                .map(start -> Math.abs(start.toEpochMilli() - info.processStartMs()) <= START_INSTANT_TOLERANCE_MS)
                .orElse(true);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Info(long pid, Long processStartMs, long startedAtMs, long heartbeatAtMs, Long lastPollAtMs) {
        public Info withHeartbeat(long heartbeat, Long lastPoll) {
            return new Info(pid, processStartMs, startedAtMs, heartbeat, lastPoll == null ? lastPollAtMs : lastPoll);
        }
    }
}

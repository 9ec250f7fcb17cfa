package io.sokrates.daemon;

import io.sokrates.config.SokratesConfig;
import io.sokrates.error.InvalidStateException;
import io.sokrates.testing.MutableClock;
import io.sokrates.testing.TempDirs;
import io.sokrates.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class DaemonMarkerTest {

    @Test
    void liveMarkerBlocksSecondDaemonAndRefreshKeepsOwner() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-marker-live-");
        try {
            DaemonMarker marker = new DaemonMarker(root.resolve("daemon.pid.json"));
            DaemonMarker.Info self = DaemonMarker.forCurrentProcess(1_000L);
            marker.create(self);
            Assertions.assertTrue(DaemonMarker.isAlive(self));
            Assertions.assertThrows(InvalidStateException.class, () -> marker.create(self));

            marker.refresh(self.pid(), 2_000L, 1_900L);
            DaemonMarker.Info refreshed = marker.readLive().orElseThrow();
            Assertions.assertEquals(2_000L, refreshed.heartbeatAtMs());
            Assertions.assertEquals(1_900L, refreshed.lastPollAtMs());
            Assertions.assertEquals(1_000L, refreshed.startedAtMs());

            marker.refresh(self.pid() + 1L, 3_000L, null);
            Assertions.assertEquals(2_000L, marker.read().orElseThrow().heartbeatAtMs());

            marker.clearIfOwned(self.pid() + 1L);
            Assertions.assertTrue(marker.read().isPresent());
            marker.clearIfOwned(self.pid());
            Assertions.assertTrue(marker.read().isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void reusedPidWithDifferentStartInstantIsStale() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-marker-reused-");
        try {
            DaemonMarker marker = new DaemonMarker(root.resolve("daemon.pid.json"));
            DaemonMarker.Info self = DaemonMarker.forCurrentProcess(1_000L);
            Long start = self.processStartMs();
            if (start == null) {
                return;
            }
            DaemonMarker.Info impostor = new DaemonMarker.Info(self.pid(), start - 60_000L, 1_000L, 1_000L, null);
            Files.writeString(marker.file(), Jsons.toCompactJson(impostor), StandardCharsets.UTF_8);

            Assertions.assertFalse(DaemonMarker.isAlive(impostor));
            Assertions.assertTrue(marker.readLive().isEmpty());
            Assertions.assertFalse(Files.exists(marker.file()));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void staleMarkerReportsNotRunningAndIsReplacedOnCreate() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-marker-stale-");
        try {
            SokratesConfig config = SokratesConfig.fromRoot(root);
            DaemonMarker marker = new DaemonMarker(config.daemonMarkerFile());
            long deadPid = deadPid();
            Files.writeString(marker.file(), Jsons.toCompactJson(
                    new DaemonMarker.Info(deadPid, null, 1_000L, 1_000L, null)), StandardCharsets.UTF_8);

            DaemonManager manager = new DaemonManager(config, marker, new MutableClock(5_000L));
            DaemonManager.DaemonStatus status = manager.status();
            Assertions.assertFalse(status.running());
            Assertions.assertNull(status.pid());
            Assertions.assertFalse(Files.exists(marker.file()));

            DaemonManager.DaemonStatus stopped = manager.stop();
            Assertions.assertFalse(stopped.running());

            Files.writeString(marker.file(), "{not json", StandardCharsets.UTF_8);
            marker.create(DaemonMarker.forCurrentProcess(6_000L));
            Assertions.assertEquals(ProcessHandle.current().pid(), marker.read().orElseThrow().pid());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void statusReportsUptimeFromMarker() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-marker-status-");
        try {
            SokratesConfig config = SokratesConfig.fromRoot(root);
            DaemonMarker marker = new DaemonMarker(config.daemonMarkerFile());
            marker.create(DaemonMarker.forCurrentProcess(1_000L));
            DaemonManager.DaemonStatus status = new DaemonManager(config, marker, new MutableClock(4_000L)).status();
            Assertions.assertTrue(status.running());
            Assertions.assertEquals(3_000L, status.uptimeMs());
            Assertions.assertEquals(1_000L, status.startedAtMs());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void spawnedDaemonRunsMainWithHome() {
        SokratesConfig config = SokratesConfig.fromRoot(Path.of("/tmp/sokrates-home"));
        List<String> cmd = new DaemonManager(config).daemonCommand();
        int main = cmd.indexOf(DaemonManager.MAIN_CLASS);
        Assertions.assertTrue(main > 0);
        Assertions.assertEquals(List.of("--home", config.rootDir().toString(), "daemon", "run"),
                cmd.subList(main + 1, cmd.size()));
        Assertions.assertTrue(cmd.contains("-cp"));
    }

    private static long deadPid() {
        long pid = 4_000_000L;
        while (ProcessHandle.of(pid).isPresent()) {
            pid++;
        }
        return pid;
    }
}

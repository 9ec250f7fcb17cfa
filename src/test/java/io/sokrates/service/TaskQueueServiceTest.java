package io.sokrates.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.sokrates.config.SokratesConfig;
import io.sokrates.error.InvalidStateException;
import io.sokrates.error.TaskNotFoundException;
import io.sokrates.error.ValidationException;
import io.sokrates.model.FailureKind;
import io.sokrates.model.Priority;
import io.sokrates.model.QueueStats;
import io.sokrates.model.TaskDetail;
import io.sokrates.model.TaskFailure;
import io.sokrates.model.TaskFilter;
import io.sokrates.model.TaskStatus;
import io.sokrates.model.TaskSummary;
import io.sokrates.retry.RetryPolicy;
import io.sokrates.runtime.SokratesRuntime;
import io.sokrates.testing.MutableClock;
import io.sokrates.testing.ScriptedLlmClient;
import io.sokrates.testing.TempDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class TaskQueueServiceTest {
    private static final long START_MS = 1_700_000_000_000L;
    private static final RetryPolicy NO_JITTER = new RetryPolicy(3, 1_000L, 1_000L, 0L);

    private static SokratesRuntime runtime(Path root, MutableClock clock) {
        return new SokratesRuntime(SokratesConfig.fromRoot(root), new ScriptedLlmClient(), clock).init();
    }

    @Test
    void addThenStatusRoundTrips() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-add-");
        try {
            MutableClock clock = new MutableClock(START_MS);
            TaskQueueService service = runtime(root, clock).service("tester");

            String id = service.add("send-prompt", "{\"prompt\":\"hello\",\"api_key\":\"abc\"}", "high", 4);
            Assertions.assertTrue(id.startsWith("tsk_"));

            TaskDetail brief = service.status(id, false);
            Assertions.assertEquals("send-prompt", brief.kind());
            Assertions.assertEquals("high", brief.priority());
            Assertions.assertEquals("pending", brief.status());
            Assertions.assertEquals(0, brief.attempts());
            Assertions.assertEquals(4, brief.maxAttempts());
            Assertions.assertEquals(START_MS, brief.createdAtMs());
            Assertions.assertNull(brief.payload());

            TaskDetail verbose = service.status(id, true);
            Assertions.assertEquals("hello", verbose.payload().get("prompt").asText());
            Assertions.assertEquals("***", verbose.payload().get("api_key").asText());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void addUsesDefaultsAndValidatesInput() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-validate-");
        try {
            TaskQueueService service = runtime(root, new MutableClock(START_MS)).service("tester");
            String id = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            TaskDetail detail = service.status(id, false);
            Assertions.assertEquals("normal", detail.priority());
            Assertions.assertEquals(SokratesConfig.DEFAULT_MAX_ATTEMPTS, detail.maxAttempts());

            Assertions.assertThrows(ValidationException.class, () -> service.add("shell", "{}", null, null));
            Assertions.assertThrows(ValidationException.class, () -> service.add(" ", "{}", null, null));
            Assertions.assertThrows(ValidationException.class, () -> service.add("send-prompt", "[1,2]", null, null));
            Assertions.assertThrows(ValidationException.class, () -> service.add("send-prompt", "{oops", null, null));
            Assertions.assertThrows(ValidationException.class, () -> service.add("send-prompt", "{}", "critical", null));
            Assertions.assertThrows(ValidationException.class, () -> service.add("send-prompt", "{}", "low", 0));
            Assertions.assertEquals(1, service.stats().total());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void removeHonoursForceAndReportsMissingIds() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-remove-");
        try {
            MutableClock clock = new MutableClock(START_MS);
            SokratesRuntime runtime = runtime(root, clock);
            TaskQueueService service = runtime.service("tester");

            String pending = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            Assertions.assertThrows(InvalidStateException.class, () -> service.remove(pending, false));
            Assertions.assertTrue(service.remove(pending, true));
            Assertions.assertThrows(TaskNotFoundException.class, () -> service.remove(pending, true));

            String running = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            Assertions.assertTrue(runtime.queueIndex().claim(running, "d", clock.millis(), 60_000L));
            Assertions.assertThrows(InvalidStateException.class, () -> service.remove(running, false));
            Assertions.assertEquals(TaskStatus.RUNNING, runtime.taskStore().get(running).orElseThrow().status());
            Assertions.assertTrue(service.remove(running, true));
            Assertions.assertTrue(service.list(TaskFilter.all()).stream().noneMatch(t -> t.taskId().equals(running)));

            String done = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            Assertions.assertTrue(runtime.queueIndex().claim(done, "d", clock.millis(), 60_000L));
            Assertions.assertTrue(runtime.taskStore().complete(done, "d", "ok", clock.millis()));
            Assertions.assertTrue(service.remove(done, false));

            Assertions.assertThrows(TaskNotFoundException.class, () -> service.status("tsk_unknown", false));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void cancelCoversEveryStatus() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-cancel-");
        try {
            MutableClock clock = new MutableClock(START_MS);
            SokratesRuntime runtime = runtime(root, clock);
            TaskQueueService service = runtime.service("tester");

            String pending = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            TaskDetail cancelled = service.cancel(pending);
            Assertions.assertEquals("cancelled", cancelled.status());
            Assertions.assertTrue(cancelled.terminal());
            Assertions.assertThrows(InvalidStateException.class, () -> service.cancel(pending));

            String running = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            Assertions.assertTrue(runtime.queueIndex().claim(running, "d", clock.millis(), 60_000L));
            TaskDetail flagged = service.cancel(running);
            Assertions.assertEquals("running", flagged.status());
            Assertions.assertTrue(flagged.cancelRequested());
            Assertions.assertTrue(runtime.taskStore().isCancelRequested(running));

            String retrying = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            Assertions.assertTrue(runtime.queueIndex().claim(retrying, "d", clock.millis(), 60_000L));
            runtime.taskStore().fail(retrying, "d", TaskFailure.transientFailure("503"), NO_JITTER, clock.millis());
            Assertions.assertEquals("cancelled", service.cancel(retrying).status());

            String terminal = service.add("send-prompt", "{\"prompt\":\"x\"}", null, 1);
            Assertions.assertTrue(runtime.queueIndex().claim(terminal, "d", clock.millis(), 60_000L));
            runtime.taskStore().fail(terminal, "d", new TaskFailure("bad", FailureKind.PERMANENT), NO_JITTER, clock.millis());
            Assertions.assertThrows(InvalidStateException.class, () -> service.cancel(terminal));

            Assertions.assertThrows(TaskNotFoundException.class, () -> service.cancel("tsk_unknown"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void requeueGivesTerminalTasksAFreshBudget() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-requeue-");
        try {
            MutableClock clock = new MutableClock(START_MS);
            SokratesRuntime runtime = runtime(root, clock);
            TaskQueueService service = runtime.service("tester");

            String id = service.add("send-prompt", "{\"prompt\":\"x\"}", null, 1);
            Assertions.assertThrows(InvalidStateException.class, () -> service.requeue(id));
            Assertions.assertTrue(runtime.queueIndex().claim(id, "d", clock.millis(), 60_000L));
            runtime.taskStore().fail(id, "d", TaskFailure.transientFailure("503"), NO_JITTER, clock.millis());

            TaskDetail requeued = service.requeue(id);
            Assertions.assertEquals("pending", requeued.status());
            Assertions.assertEquals(0, requeued.attempts());
            Assertions.assertNull(requeued.error());
            Assertions.assertThrows(TaskNotFoundException.class, () -> service.requeue("tsk_unknown"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void listStatsPurgeAndKinds() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-list-");
        try {
            MutableClock clock = new MutableClock(START_MS);
            SokratesRuntime runtime = runtime(root, clock);
            TaskQueueService service = runtime.service("tester");

            String first = service.add("send-prompt", "{\"prompt\":\"a\"}", "low", null);
            clock.advance(10L);
            String second = service.add("refine", "{\"prompt\":\"b\"}", "urgent", null);
            service.cancel(first);

            List<TaskSummary> all = service.list(TaskFilter.all());
            Assertions.assertEquals(List.of(second, first), all.stream().map(TaskSummary::taskId).toList());
            List<TaskSummary> refine = service.list(TaskFilter.all().withKind("refine"));
            Assertions.assertEquals(List.of(second), refine.stream().map(TaskSummary::taskId).toList());
            Assertions.assertEquals(1, service.list(TaskFilter.all().withPriority(Priority.LOW)).size());

            QueueStats stats = service.stats();
            Assertions.assertEquals(2, stats.total());
            Assertions.assertEquals(1, stats.count(TaskStatus.PENDING));
            Assertions.assertEquals(1, stats.count(TaskStatus.CANCELLED));

            Assertions.assertEquals(0, service.purge(1));
            clock.advance(Duration.ofDays(2).toMillis());
            Assertions.assertEquals(1, service.purge(1));
            Assertions.assertThrows(ValidationException.class, () -> service.purge(-1));
            Assertions.assertEquals(1, service.stats().total());

            Assertions.assertTrue(service.kinds().contains("send-prompt"));
            Assertions.assertTrue(service.kinds().contains("execute-tasks"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void operationsAreAudited() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-audit-");
        try {
            SokratesRuntime runtime = runtime(root, new MutableClock(START_MS));
            TaskQueueService service = runtime.service("tester");
            String id = service.add("send-prompt", "{\"prompt\":\"x\",\"token\":\"t0p\"}", null, null);
            Assertions.assertThrows(TaskNotFoundException.class, () -> service.remove("tsk_unknown", false));

            List<JsonNode> entries = runtime.auditLogger().tail(10);
            JsonNode add = entries.get(0);
            Assertions.assertEquals("task.add", add.get("action").asText());
            Assertions.assertEquals("tester", add.get("actor").asText());
            Assertions.assertEquals(id, add.get("task_id").asText());
            Assertions.assertEquals("***", add.get("details").get("payload").get("token").asText());

            JsonNode miss = entries.get(entries.size() - 1);
            Assertions.assertEquals("task.remove", miss.get("action").asText());
            Assertions.assertEquals("not_found", miss.get("result").asText());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void auditFailureDoesNotFailAnOperationThatTookEffect() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-service-audit-down-");
        try {
            SokratesRuntime runtime = runtime(root, new MutableClock(START_MS));
            Path auditFile = runtime.auditLogger().auditFile();
            Files.delete(auditFile);
            Files.createDirectory(auditFile);
            TaskQueueService service = runtime.service("tester");

            String id = service.add("send-prompt", "{\"prompt\":\"x\"}", null, null);
            Assertions.assertEquals("pending", service.status(id, false).status());
            Assertions.assertEquals("cancelled", service.cancel(id).status());
            Assertions.assertThrows(TaskNotFoundException.class, () -> service.status("tsk_unknown", false));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }
}

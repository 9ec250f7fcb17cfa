package io.sokrates.storage;

import io.sokrates.config.SokratesConfig;
import io.sokrates.model.NewTask;
import io.sokrates.model.Priority;
import io.sokrates.model.Task;
import io.sokrates.model.TaskStatus;
import io.sokrates.testing.TempDirs;
import io.sokrates.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class QueueIndexTest {

    private static TaskStore openStore(Path root) {
        Database db = new Database(SokratesConfig.fromRoot(root));
        db.init();
        return new TaskStore(db);
    }

    private static String add(TaskStore store, String id, Priority priority, long createdAtMs) {
        return store.create(new NewTask(id, "send-prompt", Jsons.parseObject("{\"prompt\":\"p\"}"),
                priority, 3, createdAtMs));
    }

    @Test
    void claimsByPriorityThenAgeThenInsertionOrder() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-index-order-");
        try {
            TaskStore store = openStore(root);
            QueueIndex index = new QueueIndex(store);
            add(store, "low-old", Priority.LOW, 1_000L);
            add(store, "normal-b", Priority.NORMAL, 2_000L);
            add(store, "normal-a", Priority.NORMAL, 1_500L);
            add(store, "normal-tie-1", Priority.NORMAL, 2_500L);
            add(store, "normal-tie-2", Priority.NORMAL, 2_500L);
            add(store, "urgent", Priority.URGENT, 9_000L);
            add(store, "high", Priority.HIGH, 8_000L);

            Assertions.assertEquals("urgent", index.nextEligible().orElseThrow().id());

            List<String> order = new ArrayList<>();
            Optional<Task> next;
            while ((next = index.claimNext("d", 10_000L, 60_000L)).isPresent()) {
                order.add(next.get().id());
            }
            Assertions.assertEquals(List.of("urgent", "high", "normal-a", "normal-b", "normal-tie-1",
                    "normal-tie-2", "low-old"), order);
            Assertions.assertTrue(index.nextEligible().isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void claimSkipsRunningAndWaitingTasks() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-index-skip-");
        try {
            TaskStore store = openStore(root);
            QueueIndex index = new QueueIndex(store);
            add(store, "a", Priority.URGENT, 1_000L);
            add(store, "b", Priority.LOW, 2_000L);

            Task claimed = index.claimNext("d", 3_000L, 60_000L).orElseThrow();
            Assertions.assertEquals("a", claimed.id());
            Assertions.assertEquals(TaskStatus.RUNNING, claimed.status());
            Assertions.assertEquals(1, claimed.attempts());
            Assertions.assertEquals(63_000L, claimed.lockExpiryMs());
            Assertions.assertFalse(index.claim("a", "other", 3_000L, 60_000L));

            Assertions.assertEquals("b", index.claimNext("d", 3_000L, 60_000L).orElseThrow().id());
            Assertions.assertTrue(index.claimNext("d", 3_000L, 60_000L).isEmpty());
            Assertions.assertFalse(index.claim("missing", "d", 3_000L, 60_000L));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void leaseExtensionIsFencedOnOwner() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-index-lease-");
        try {
            TaskStore store = openStore(root);
            QueueIndex index = new QueueIndex(store);
            add(store, "a", Priority.NORMAL, 1_000L);
            Assertions.assertTrue(index.claim("a", "owner", 2_000L, 1_000L));

            Assertions.assertFalse(index.extendLease("a", "intruder", 2_500L, 1_000L));
            Assertions.assertTrue(index.extendLease("a", "owner", 2_500L, 1_000L));
            Assertions.assertEquals(3_500L, store.get("a").orElseThrow().lockExpiryMs());
            Assertions.assertTrue(index.findExpiredClaims(3_000L).isEmpty());
            Assertions.assertEquals(1, index.findExpiredClaims(3_500L).size());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void concurrentClaimantsNeverShareATask() throws Exception {
        Path root = Files.createTempDirectory("sokrates-test-index-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            TaskStore store = openStore(root);
            int tasks = 20;
            for (int i = 0; i < tasks; i++) {
                add(store, "t" + i, Priority.NORMAL, 1_000L + i);
            }
            Set<String> claimed = ConcurrentHashMap.newKeySet();
            List<String> duplicates = new ArrayList<>();
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> futures = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                String owner = "daemon-" + w;
                futures.add(pool.submit(() -> {
                    QueueIndex index = new QueueIndex(store);
                    start.await();
                    int mine = 0;
                    Optional<Task> next;
                    while ((next = index.claimNext(owner, 5_000L, 60_000L)).isPresent()) {
                        if (!claimed.add(next.get().id())) {
                            synchronized (duplicates) {
                                duplicates.add(next.get().id());
                            }
                        }
                        mine++;
                    }
                    return mine;
                }));
            }
            start.countDown();
            int total = 0;
            for (Future<Integer> f : futures) {
                total += f.get(60, TimeUnit.SECONDS);
            }
            Assertions.assertTrue(duplicates.isEmpty(), "claimed twice: " + duplicates);
            Assertions.assertEquals(tasks, total);
            Assertions.assertEquals(tasks, claimed.size());
            Assertions.assertEquals(tasks, store.countByStatus().get(TaskStatus.RUNNING));
        } finally {
            pool.shutdownNow();
            TempDirs.deleteRecursively(root);
        }
    }
}

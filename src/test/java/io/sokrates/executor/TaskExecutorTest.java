package io.sokrates.executor;

import io.sokrates.error.PermanentTaskException;
import io.sokrates.error.TransientTaskException;
import io.sokrates.handler.HandlerRegistry;
import io.sokrates.handler.TaskContext;
import io.sokrates.handler.TaskHandler;
import io.sokrates.model.FailureKind;
import io.sokrates.model.Priority;
import io.sokrates.model.Task;
import io.sokrates.model.TaskStatus;
import io.sokrates.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

final class TaskExecutorTest {

    private static Task running(String kind) {
        return new Task("tsk_exec", kind, Jsons.parseObject("{\"prompt\":\"hello\"}"), Priority.NORMAL,
                TaskStatus.RUNNING, 1, 3, 1L, 1L, 1L, null, null, null, null, null, "d", 100L, false);
    }

    private static TaskHandler handler(String kind, ThrowingBody body) {
        return new TaskHandler() {
            @Override
            public String kind() {
                return kind;
            }

            @Override
            public String handle(TaskContext context) throws Exception {
                return body.run(context);
            }
        };
    }

    @FunctionalInterface
    private interface ThrowingBody {
        String run(TaskContext context) throws Exception;
    }

    @Test
    void successReturnsHandlerOutput() {
        HandlerRegistry registry = new HandlerRegistry()
                .register(handler("echo", ctx -> ctx.requireText("prompt") + "!"));
        Outcome outcome = new TaskExecutor(registry).execute(running("echo"), () -> false);
        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals("hello!", outcome.output());
        Assertions.assertNull(outcome.failure());
    }

    @Test
    void unknownKindIsPermanent() {
        Outcome outcome = new TaskExecutor(new HandlerRegistry()).execute(running("nope"), () -> false);
        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals(FailureKind.PERMANENT, outcome.failure().kind());
        Assertions.assertEquals("unsupported task kind: nope", outcome.failure().message());
    }

    @Test
    void handlerExceptionsAreClassified() {
        HandlerRegistry registry = new HandlerRegistry()
                .register(handler("transient", ctx -> {
                    throw new TransientTaskException("rate limited");
                }))
                .register(handler("permanent", ctx -> {
                    throw new PermanentTaskException("bad request");
                }))
                .register(handler("io", ctx -> {
                    throw new IOException("connection reset");
                }))
                .register(handler("bad-payload", ctx -> ctx.requireText("missing")))
                .register(handler("npe", ctx -> {
                    throw new NullPointerException();
                }));
        TaskExecutor executor = new TaskExecutor(registry);

        Outcome t = executor.execute(running("transient"), () -> false);
        Assertions.assertEquals(FailureKind.TRANSIENT, t.failure().kind());
        Assertions.assertEquals("rate limited", t.failure().message());

        Assertions.assertEquals(FailureKind.PERMANENT, executor.execute(running("permanent"), () -> false).failure().kind());
        Assertions.assertEquals(FailureKind.TRANSIENT, executor.execute(running("io"), () -> false).failure().kind());

        Outcome payload = executor.execute(running("bad-payload"), () -> false);
        Assertions.assertEquals(FailureKind.PERMANENT, payload.failure().kind());
        Assertions.assertTrue(payload.failure().message().contains("missing"));

        Outcome npe = executor.execute(running("npe"), () -> false);
        Assertions.assertEquals(FailureKind.TRANSIENT, npe.failure().kind());
        Assertions.assertEquals("NullPointerException", npe.failure().message());
    }

    @Test
    void honouredStopRequestIsPermanentFailure() {
        AtomicBoolean stop = new AtomicBoolean(false);
        HandlerRegistry registry = new HandlerRegistry().register(handler("long", ctx -> {
            stop.set(true);
            ctx.throwIfCancelRequested();
            return "unreachable";
        }));
        Outcome outcome = new TaskExecutor(registry).execute(running("long"), stop::get);
        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals(FailureKind.PERMANENT, outcome.failure().kind());
        Assertions.assertEquals("cancelled on request", outcome.failure().message());
    }
}

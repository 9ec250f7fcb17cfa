package io.sokrates.executor;

import io.sokrates.error.TaskCancelledException;
import io.sokrates.error.TaskFailureException;
import io.sokrates.handler.HandlerRegistry;
import io.sokrates.handler.TaskContext;
import io.sokrates.handler.TaskHandler;
import io.sokrates.model.FailureKind;
import io.sokrates.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Runs one claimed task through the handler registered for its kind and classifies the result.
 * Nothing thrown by a handler escapes {@link #execute}.
 */
public final class TaskExecutor {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final HandlerRegistry registry;

    public TaskExecutor(HandlerRegistry registry) {
        this.registry = registry;
    }

    public Outcome execute(Task task, BooleanSupplier cancelRequested) {
        Optional<TaskHandler> handler = registry.find(task.kind());
        if (handler.isEmpty()) {
            return Outcome.fail("unsupported task kind: " + task.kind(), FailureKind.PERMANENT);
        }
        TaskContext ctx = new TaskContext(task.id(), task.kind(), task.payload(), task.attempts(), cancelRequested);
        long started = System.currentTimeMillis();
        try {
            String output = handler.get().handle(ctx);
            log.info("Task {} ({}) succeeded in {} ms", task.id(), task.kind(), System.currentTimeMillis() - started);
            return Outcome.ok(output);
        } catch (TaskCancelledException e) {
            log.info("Task {} stopped on request", task.id());
            return Outcome.fail("cancelled on request", FailureKind.PERMANENT);
        } catch (Throwable t) {
            FailureKind kind = classify(t);
            log.warn("Task {} ({}) failed on attempt {}: {} [{}]", task.id(), task.kind(), task.attempts(),
                    describe(t), kind.wireName());
            if (t instanceof VirtualMachineError vme) {
                throw vme;
            }
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return Outcome.fail(describe(t), kind);
        }
    }

    static FailureKind classify(Throwable t) {
        if (t instanceof TaskFailureException tfe) {
            return tfe.kind();
        }
        if (t instanceof IOException || t instanceof TimeoutException) {
            return FailureKind.TRANSIENT;
        }
        if (t instanceof IllegalArgumentException || t instanceof LinkageError) {
            return FailureKind.PERMANENT;
        }
        return FailureKind.TRANSIENT;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return message;
    }
}

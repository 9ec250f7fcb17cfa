package io.sokrates.error;

/**
 * Thrown by a handler that noticed a stop request for its running task.
 */
public final class TaskCancelledException extends PermanentTaskException {
    public TaskCancelledException(String taskId) {
        super("cancelled on request: " + taskId);
    }
}

package io.sokrates.handler;

/**
 * Executes one task kind. Handlers classify their own failures by throwing
 * {@link io.sokrates.error.TransientTaskException} or {@link io.sokrates.error.PermanentTaskException};
 * anything else is classified by the executor.
 */
public interface TaskHandler {
    String kind();

    /**
     * @return the result text stored on the task
     */
    String handle(TaskContext context) throws Exception;
}

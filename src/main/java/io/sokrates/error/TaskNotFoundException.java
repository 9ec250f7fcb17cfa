package io.sokrates.error;

public final class TaskNotFoundException extends QueueException {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super(ErrorCode.NOT_FOUND, "Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}

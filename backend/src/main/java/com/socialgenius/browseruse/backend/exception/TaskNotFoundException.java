package com.socialgenius.browseruse.backend.exception;

/**
 * No task with the given id exists, either because it was never created or because
 * it was swept after its retention window.
 */
public class TaskNotFoundException extends RuntimeException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}

package org.neuralchilli.pressroom.core;

import java.util.UUID;

/**
 * Exception thrown when a task ID is unknown, or its record has been evicted.
 */
public class TaskNotFoundException extends RuntimeException {

    private final UUID taskId;

    public TaskNotFoundException(UUID taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }
}

package org.neuralchilli.pressroom.service;

import org.neuralchilli.pressroom.domain.TaskStatus;

import java.util.UUID;

/**
 * Exception thrown when results are requested for a task that has not
 * finished.
 */
public class TaskNotReadyException extends RuntimeException {

    private final UUID taskId;
    private final TaskStatus status;

    public TaskNotReadyException(UUID taskId, TaskStatus status) {
        super("Task " + taskId + " is not finished yet (status: " + status + ")");
        this.taskId = taskId;
        this.status = status;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public TaskStatus getStatus() {
        return status;
    }
}

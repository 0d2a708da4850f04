package org.neuralchilli.pressroom.service;

import java.util.UUID;

/**
 * Exception thrown when the work queue is full. The rejected task's record
 * is kept, marked CANCELLED.
 */
public class QueueCapacityExceededException extends RuntimeException {

    private final UUID taskId;

    public QueueCapacityExceededException(UUID taskId, int capacity) {
        super("Work queue is full (capacity " + capacity + "), task " + taskId + " rejected");
        this.taskId = taskId;
    }

    public UUID getTaskId() {
        return taskId;
    }
}

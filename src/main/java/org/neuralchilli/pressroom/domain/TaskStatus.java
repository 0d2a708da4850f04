package org.neuralchilli.pressroom.domain;

/**
 * Lifecycle status of a pipeline task.
 */
public enum TaskStatus {
    /**
     * Task created and queued, waiting for a worker slot
     */
    PENDING,

    /**
     * A worker is driving the task through its stages
     */
    RUNNING,

    /**
     * Every requested stage succeeded
     */
    COMPLETED,

    /**
     * A stage failed permanently or exhausted its retries
     */
    FAILED,

    /**
     * Cancelled by a caller or by shutdown
     */
    CANCELLED;

    /**
     * Check if this is a terminal state (task finished)
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check whether moving to the given status is a legal forward step.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}

package org.neuralchilli.pressroom.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Published on every status change of a task. {@code from} is null when the
 * task has just been created.
 */
public record TaskTransitionEvent(
        UUID taskId,
        TaskStatus from,
        TaskStatus to,
        Instant at
) {

    public static final String ADDRESS = "pipeline.task.transition";

    public TaskTransitionEvent {
        if (taskId == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        if (to == null) {
            throw new IllegalArgumentException("Target status cannot be null");
        }
        if (at == null) {
            at = Instant.now();
        }
    }

    public static TaskTransitionEvent of(UUID taskId, TaskStatus from, TaskStatus to) {
        return new TaskTransitionEvent(taskId, from, to, Instant.now());
    }
}

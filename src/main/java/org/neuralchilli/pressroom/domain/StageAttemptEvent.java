package org.neuralchilli.pressroom.domain;

import java.util.UUID;

/**
 * Published once per stage run, after the last attempt.
 */
public record StageAttemptEvent(
        UUID taskId,
        Stage stage,
        boolean success,
        int attempts,
        long durationMillis
) {

    public static final String ADDRESS = "pipeline.stage.finished";

    public StageAttemptEvent {
        if (taskId == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("Stage cannot be null");
        }
    }
}

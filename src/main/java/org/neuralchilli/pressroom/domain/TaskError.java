package org.neuralchilli.pressroom.domain;

import java.time.Instant;

/**
 * The first unrecoverable failure of a task.
 */
public record TaskError(
        Stage stage,
        FailureReason reason,
        String message,
        int attempts,
        Instant occurredAt
) {

    public TaskError {
        if (stage == null) {
            throw new IllegalArgumentException("Failed stage cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("Failure reason cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("Attempts cannot be negative");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("Occurred at cannot be null");
        }

        message = message != null ? message : "";
    }

    public static TaskError of(Stage stage, FailureReason reason, String message, int attempts) {
        return new TaskError(stage, reason, message, attempts, Instant.now());
    }
}

package org.neuralchilli.pressroom.domain;

import java.util.UUID;

/**
 * What a cancel request did. A running task reports RUNNING as its current
 * status until it reaches its next stage boundary.
 */
public record CancelOutcome(
        UUID taskId,
        TaskStatus previousStatus,
        TaskStatus currentStatus
) {

    /**
     * Check if the request changed anything
     */
    public boolean accepted() {
        return !previousStatus.isTerminal();
    }
}

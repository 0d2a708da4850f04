package org.neuralchilli.pressroom.service;

import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Progress of a task, as returned by a status query.
 */
public record TaskStatusView(
        UUID taskId,
        TaskStatus status,
        List<Stage> requestedStages,
        List<Stage> completedStages,
        Stage currentStage,
        boolean cancelRequested,
        Instant updatedAt
) {

    static TaskStatusView of(TaskRecord task) {
        return new TaskStatusView(
                task.id(),
                task.status(),
                task.requestedStages(),
                task.completedStages(),
                task.currentStage(),
                task.cancelRequested(),
                task.updatedAt()
        );
    }

    /**
     * Human-readable progress, e.g. "Step 2/3: Analyzing content".
     */
    public String progressMessage() {
        return switch (status) {
            case PENDING -> "Waiting to start";
            case RUNNING -> currentStage != null
                    ? "Step " + (requestedStages.indexOf(currentStage) + 1) + "/" + requestedStages.size()
                    + ": " + currentStage.description()
                    : "Starting";
            case COMPLETED -> "Completed";
            case FAILED -> "Failed";
            case CANCELLED -> "Cancelled";
        };
    }
}

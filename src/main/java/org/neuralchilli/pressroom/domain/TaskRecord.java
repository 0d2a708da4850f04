package org.neuralchilli.pressroom.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable state of one pipeline run. Stored in Hazelcast and replaced
 * wholesale on every transition; instances are never mutated.
 */
public record TaskRecord(
        UUID id,
        TaskStatus status,
        List<Stage> requestedStages,
        PipelineRequest request,
        Map<Stage, StageOutput> stageOutputs,
        TaskError error,
        Stage currentStage,
        boolean cancelRequested,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt
) {

    public TaskRecord {
        if (id == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (requestedStages == null || requestedStages.isEmpty()) {
            throw new IllegalArgumentException("Requested stages cannot be null or empty");
        }
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created at cannot be null");
        }
        if (error != null && status != TaskStatus.FAILED) {
            throw new IllegalArgumentException("Only a failed task carries an error, status: " + status);
        }

        requestedStages = List.copyOf(requestedStages);

        // EnumMap keeps outputs in pipeline order
        EnumMap<Stage, StageOutput> outputs = new EnumMap<>(Stage.class);
        if (stageOutputs != null) {
            outputs.putAll(stageOutputs);
        }
        stageOutputs = Collections.unmodifiableMap(outputs);

        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Create a new pending task
     */
    public static TaskRecord create(List<Stage> requestedStages, PipelineRequest request) {
        Instant now = Instant.now();
        return new TaskRecord(
                UUID.randomUUID(),
                TaskStatus.PENDING,
                requestedStages,
                request,
                Map.of(),
                null,
                null,
                false,
                now,
                now,
                null,
                null
        );
    }

    /**
     * Claim the task for execution
     */
    public TaskRecord start() {
        requireTransition(TaskStatus.RUNNING);
        Instant now = Instant.now();
        return new TaskRecord(
                id, TaskStatus.RUNNING, requestedStages, request, stageOutputs, null,
                null, cancelRequested, createdAt, now, now, null
        );
    }

    /**
     * Record which stage is in flight
     */
    public TaskRecord beginStage(Stage stage) {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Cannot begin stage " + stage + " of task in status: " + status);
        }
        requireRequested(stage);
        return new TaskRecord(
                id, status, requestedStages, request, stageOutputs, null,
                stage, cancelRequested, createdAt, Instant.now(), startedAt, null
        );
    }

    /**
     * Append the output of a finished stage. Outputs are written once, in
     * pipeline order, and only for requested stages.
     */
    public TaskRecord withStageOutput(StageOutput output) {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Cannot record output of task in status: " + status);
        }
        Stage stage = output.stage();
        requireRequested(stage);
        if (stageOutputs.containsKey(stage)) {
            throw new IllegalStateException("Output of stage " + stage + " already recorded");
        }
        for (Stage earlier : requestedStages) {
            if (earlier == stage) {
                break;
            }
            if (!stageOutputs.containsKey(earlier)) {
                throw new IllegalStateException(
                        "Output of stage " + stage + " recorded before " + earlier);
            }
        }

        EnumMap<Stage, StageOutput> outputs = new EnumMap<>(Stage.class);
        outputs.putAll(stageOutputs);
        outputs.put(stage, output);

        return new TaskRecord(
                id, status, requestedStages, request, outputs, null,
                currentStage, cancelRequested, createdAt, Instant.now(), startedAt, null
        );
    }

    /**
     * Mark as completed
     */
    public TaskRecord complete() {
        requireTransition(TaskStatus.COMPLETED);
        if (stageOutputs.size() != requestedStages.size()) {
            throw new IllegalStateException("Cannot complete task with missing stage outputs: "
                    + completedStages() + " of " + requestedStages);
        }
        Instant now = Instant.now();
        return new TaskRecord(
                id, TaskStatus.COMPLETED, requestedStages, request, stageOutputs, null,
                null, cancelRequested, createdAt, now, startedAt, now
        );
    }

    /**
     * Mark as failed, keeping the outputs of stages that already succeeded
     */
    public TaskRecord fail(TaskError taskError) {
        if (taskError == null) {
            throw new IllegalArgumentException("Task error cannot be null");
        }
        requireTransition(TaskStatus.FAILED);
        Instant now = Instant.now();
        return new TaskRecord(
                id, TaskStatus.FAILED, requestedStages, request, stageOutputs, taskError,
                null, cancelRequested, createdAt, now, startedAt, now
        );
    }

    /**
     * Ask a running task to stop at its next stage boundary
     */
    public TaskRecord requestCancellation() {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Cannot request cancellation of task in status: " + status);
        }
        if (cancelRequested) {
            return this;
        }
        return new TaskRecord(
                id, status, requestedStages, request, stageOutputs, null,
                currentStage, true, createdAt, Instant.now(), startedAt, null
        );
    }

    /**
     * Mark as cancelled
     */
    public TaskRecord cancel() {
        requireTransition(TaskStatus.CANCELLED);
        Instant now = Instant.now();
        return new TaskRecord(
                id, TaskStatus.CANCELLED, requestedStages, request, stageOutputs, null,
                null, cancelRequested, createdAt, now, startedAt, now
        );
    }

    /**
     * Check if the task is finished
     */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Stages with a recorded output, in pipeline order
     */
    public List<Stage> completedStages() {
        return List.copyOf(stageOutputs.keySet());
    }

    public StageOutput outputOf(Stage stage) {
        return stageOutputs.get(stage);
    }

    private void requireTransition(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition of task " + id + ": " + status + " -> " + next);
        }
    }

    private void requireRequested(Stage stage) {
        if (!requestedStages.contains(stage)) {
            throw new IllegalStateException("Stage " + stage + " was not requested for task " + id);
        }
    }
}

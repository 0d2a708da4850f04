package org.neuralchilli.pressroom.service;

import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageOutput;
import org.neuralchilli.pressroom.domain.TaskError;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.TaskStatus;

import java.util.Map;
import java.util.UUID;

/**
 * Outputs of a finished task. A failed or cancelled task still returns the
 * outputs of the stages that succeeded.
 */
public record TaskResultView(
        UUID taskId,
        TaskStatus status,
        Map<Stage, StageOutput> stageOutputs,
        TaskError error
) {

    static TaskResultView of(TaskRecord task) {
        return new TaskResultView(task.id(), task.status(), task.stageOutputs(), task.error());
    }
}

package org.neuralchilli.pressroom.service;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.core.PipelineOrchestrator;
import org.neuralchilli.pressroom.core.TaskNotFoundException;
import org.neuralchilli.pressroom.core.TaskRecordStore;
import org.neuralchilli.pressroom.domain.Audience;
import org.neuralchilli.pressroom.domain.CancelOutcome;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.TaskStatus;
import org.neuralchilli.pressroom.domain.TaskTransitionEvent;
import org.neuralchilli.pressroom.domain.WritingStyle;
import org.neuralchilli.pressroom.worker.PipelineWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for callers: submit pipeline runs, poll their progress,
 * fetch their results and cancel them.
 * <p>
 * Submission returns as soon as the task is queued; the stages run later
 * on the worker pool.
 */
@ApplicationScoped
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private static final List<Stage> URL_TO_ARTICLE = List.of(Stage.EXTRACT, Stage.ANALYZE, Stage.WRITE);
    private static final List<Stage> URL_TO_PUBLICATION = List.of(Stage.values());

    @Inject
    SubmissionValidator validator;

    @Inject
    TaskRecordStore store;

    @Inject
    PipelineOrchestrator orchestrator;

    @Inject
    PipelineWorkerPool workerPool;

    @Inject
    EventBus eventBus;

    @Inject
    PipelineConfig config;

    /**
     * Validate and queue a pipeline run.
     *
     * @param requestedStages stages to run; any order, must form a contiguous run
     * @return the new task's ID
     * @throws InvalidRequestException if the stages or parameters are invalid
     * @throws QueueCapacityExceededException if the work queue is full
     */
    public UUID submit(Collection<Stage> requestedStages, PipelineRequest request) {
        PipelineRequest effective = request != null ? withDefaults(request) : null;
        List<Stage> stages = validator.validate(requestedStages, effective);

        TaskRecord task = store.create(stages, effective);
        eventBus.publish(TaskTransitionEvent.ADDRESS,
                TaskTransitionEvent.of(task.id(), null, TaskStatus.PENDING));

        if (!workerPool.enqueue(task.id())) {
            orchestrator.forceCancel(task.id());
            log.warn("Work queue full, task {} rejected", task.id());
            throw new QueueCapacityExceededException(task.id(), config.worker().queueCapacity());
        }

        log.info("Submitted task {} for stages {}", task.id(), stages);
        return task.id();
    }

    /**
     * Extract, analyze and write an article from a URL.
     */
    public UUID urlToArticle(PipelineRequest request) {
        return submit(URL_TO_ARTICLE, request);
    }

    /**
     * Run all four stages, ending with publication (or a draft when
     * {@code draftOnly} is set).
     */
    public UUID urlToPublication(PipelineRequest request) {
        return submit(URL_TO_PUBLICATION, request);
    }

    /**
     * @throws TaskNotFoundException if the task is unknown or evicted
     */
    public TaskStatusView status(UUID taskId) {
        return TaskStatusView.of(store.get(taskId));
    }

    /**
     * Outputs of a finished task.
     *
     * @throws TaskNotFoundException if the task is unknown or evicted
     * @throws TaskNotReadyException if the task is still PENDING or RUNNING
     */
    public TaskResultView result(UUID taskId) {
        TaskRecord task = store.get(taskId);
        if (!task.isTerminal()) {
            throw new TaskNotReadyException(taskId, task.status());
        }
        return TaskResultView.of(task);
    }

    /**
     * @throws TaskNotFoundException if the task is unknown or evicted
     */
    public CancelOutcome cancel(UUID taskId) {
        CancelOutcome outcome = orchestrator.cancel(taskId);
        if (outcome.previousStatus() == TaskStatus.PENDING) {
            workerPool.withdraw(taskId);
        }
        return outcome;
    }

    private PipelineRequest withDefaults(PipelineRequest request) {
        return request.withDefaults(
                WritingStyle.PROFESSIONAL,
                Audience.GENERAL,
                config.content().defaultWordCount(),
                config.publish().defaultAuthor(),
                config.publish().defaultPlatform()
        );
    }
}

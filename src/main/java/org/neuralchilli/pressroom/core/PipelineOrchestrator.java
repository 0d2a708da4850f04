package org.neuralchilli.pressroom.core;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.domain.AnalysisRequest;
import org.neuralchilli.pressroom.domain.CancelOutcome;
import org.neuralchilli.pressroom.domain.ExtractRequest;
import org.neuralchilli.pressroom.domain.FailureReason;
import org.neuralchilli.pressroom.domain.PublishRequest;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageAttemptEvent;
import org.neuralchilli.pressroom.domain.StageInput;
import org.neuralchilli.pressroom.domain.TaskError;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.TaskStatus;
import org.neuralchilli.pressroom.domain.TaskTransitionEvent;
import org.neuralchilli.pressroom.domain.WritingRequest;
import org.neuralchilli.pressroom.stage.ArticlePublisher;
import org.neuralchilli.pressroom.stage.ArticleWriter;
import org.neuralchilli.pressroom.stage.ContentAnalyzer;
import org.neuralchilli.pressroom.stage.ContentExtractor;
import org.neuralchilli.pressroom.stage.PublisherCredentials;
import org.neuralchilli.pressroom.stage.StageResult;
import org.neuralchilli.pressroom.stage.StageRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Drives a task through its requested stages, one after another, on the
 * calling thread.
 * <p>
 * State machine:
 * <pre>
 *   PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED
 *   PENDING -> CANCELLED
 * </pre>
 * Every record change goes through {@link TaskRecordStore#update}; no lock is
 * held while a collaborator runs. Each status change is published to
 * {@link TaskTransitionEvent#ADDRESS}.
 * <p>
 * Cancelling a running task takes effect at the next stage boundary. When
 * the request arrives during the final stage there is no boundary left: if
 * that stage succeeds the task ends COMPLETED, with {@code cancelRequested}
 * still set on the record.
 * <p>
 * A record deleted while its task runs ends the run quietly.
 */
@ApplicationScoped
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    @Inject
    TaskRecordStore store;

    @Inject
    StageRunner stageRunner;

    @Inject
    ContentExtractor extractor;

    @Inject
    ContentAnalyzer analyzer;

    @Inject
    ArticleWriter writer;

    @Inject
    ArticlePublisher publisher;

    @Inject
    EventBus eventBus;

    @Inject
    PipelineConfig config;

    private PublisherCredentials credentials;

    @PostConstruct
    void init() {
        PipelineConfig.Publish publish = config.publish();
        credentials = new PublisherCredentials(
                publish.appId().orElse(null),
                publish.appSecret().orElse(null));
        log.info("PipelineOrchestrator initialized (publisher credentials configured: {})",
                credentials.configured());
    }

    /**
     * Execute a pending task to completion.
     * <p>
     * A task that is no longer PENDING is refused without invoking any
     * collaborator, so a duplicate delivery of the same ID is harmless.
     *
     * @return true if this call ran the task, false if it was refused
     */
    public boolean execute(UUID taskId) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        TaskRecord task;
        try {
            task = apply(taskId, current -> {
                if (current.status() != TaskStatus.PENDING) {
                    return current;
                }
                claimed.set(true);
                return current.start();
            });
        } catch (TaskNotFoundException e) {
            log.warn("Task {} no longer exists, skipping", taskId);
            return false;
        }

        if (!claimed.get()) {
            log.warn("Refusing to execute task {} in status {}", taskId, task.status());
            return false;
        }

        log.info("Executing task {}: stages {}", taskId, task.requestedStages());

        Stage inFlight = null;
        try {
            for (Stage stage : task.requestedStages()) {
                inFlight = stage;
                if (!runStage(taskId, stage)) {
                    return true;
                }
            }

            TaskRecord finished = apply(taskId, current -> current.isTerminal() ? current : current.complete());
            if (finished.status() == TaskStatus.COMPLETED) {
                log.info("Task {} completed: {}", taskId, finished.completedStages());
            }
        } catch (TaskNotFoundException e) {
            log.warn("Task {} was deleted while running stage {}, abandoning it", taskId, inFlight);
        } catch (RuntimeException e) {
            // Anything escaping here is a bug, not a stage failure; don't leave the task RUNNING
            log.error("Unexpected error executing task {} at stage {}", taskId, inFlight, e);
            Stage failedStage = inFlight;
            try {
                apply(taskId, current -> current.isTerminal() ? current : current.fail(
                        TaskError.of(failedStage, FailureReason.STAGE_PERMANENT_FAILURE,
                                "Internal error: " + e.getMessage(), 0)));
            } catch (TaskNotFoundException gone) {
                log.warn("Task {} was deleted before its failure could be recorded", taskId);
            }
        }
        return true;
    }

    /**
     * Run one stage and record its outcome.
     *
     * @return true to continue with the next stage
     */
    private boolean runStage(UUID taskId, Stage stage) {
        // Stage boundary: honour a pending cancellation before starting
        TaskRecord task = apply(taskId, current -> {
            if (current.isTerminal()) {
                return current;
            }
            return current.cancelRequested() ? current.cancel() : current.beginStage(stage);
        });
        if (task.status() != TaskStatus.RUNNING) {
            log.info("Task {} stopped before stage {}: {}", taskId, stage, task.status());
            return false;
        }

        log.debug("Task {} starting stage {} ({})", taskId, stage, stage.description());
        Instant start = Instant.now();

        StageResult result;
        try {
            result = call(stage, StageInputs.build(task, stage));
        } catch (IllegalArgumentException | IllegalStateException e) {
            result = StageResult.permanent("Cannot build input for stage " + stage + ": " + e.getMessage(), 0);
        }

        long millis = Duration.between(start, Instant.now()).toMillis();
        eventBus.publish(StageAttemptEvent.ADDRESS,
                new StageAttemptEvent(taskId, stage, result.isSuccess(), result.attempts(), millis));

        if (result instanceof StageResult.Success success) {
            TaskRecord updated = apply(taskId, current ->
                    current.isTerminal() ? current : current.withStageOutput(success.output()));
            if (updated.isTerminal()) {
                log.warn("Task {} became {} while stage {} was running, output discarded",
                        taskId, updated.status(), stage);
                return false;
            }
            log.info("Task {} stage {} succeeded after {} attempt(s) in {}ms",
                    taskId, stage, success.attempts(), millis);
            return true;
        }

        StageResult.Failure failure = (StageResult.Failure) result;
        TaskRecord updated = apply(taskId, current -> {
            if (current.isTerminal()) {
                return current;
            }
            if (current.cancelRequested()) {
                // Cancellation wins; the failure is not recorded
                return current.cancel();
            }
            return current.fail(TaskError.of(stage, failure.reason(), failure.message(), failure.attempts()));
        });

        if (updated.status() == TaskStatus.FAILED) {
            log.error("Task {} failed at stage {} ({}, {} attempt(s)): {}",
                    taskId, stage, failure.reason(), failure.attempts(), failure.message());
        } else {
            log.warn("Task {} stage {} failed but task is {}", taskId, stage, updated.status());
        }
        return false;
    }

    private StageResult call(Stage stage, StageInput input) {
        if (input instanceof ExtractRequest request) {
            return stageRunner.run(stage, request, extractor::extract);
        }
        if (input instanceof AnalysisRequest request) {
            return stageRunner.run(stage, request, analyzer::analyze);
        }
        if (input instanceof WritingRequest request) {
            return stageRunner.run(stage, request, writer::write);
        }
        if (input instanceof PublishRequest request) {
            return stageRunner.run(stage, request, req -> publisher.publish(req, credentials));
        }
        throw new IllegalStateException("Unknown stage input: " + input);
    }

    /**
     * Cancel a task. PENDING becomes CANCELLED at once; RUNNING is flagged
     * and stops at its next stage boundary; a terminal task is left alone.
     *
     * @throws TaskNotFoundException if no record exists
     */
    public CancelOutcome cancel(UUID taskId) {
        AtomicReference<TaskStatus> previous = new AtomicReference<>();
        TaskRecord task = apply(taskId, current -> {
            previous.set(current.status());
            return switch (current.status()) {
                case PENDING -> current.cancel();
                case RUNNING -> current.requestCancellation();
                case COMPLETED, FAILED, CANCELLED -> current;
            };
        });

        switch (previous.get()) {
            case PENDING -> log.info("Task {} cancelled before it started", taskId);
            case RUNNING -> log.warn("Task {} cancellation requested, will stop at next stage boundary", taskId);
            default -> log.debug("Task {} already {}, cancel ignored", taskId, previous.get());
        }
        return new CancelOutcome(taskId, previous.get(), task.status());
    }

    /**
     * Move a task that is not yet terminal straight to CANCELLED, without
     * waiting for a stage boundary. Used when shutting down.
     */
    public TaskRecord forceCancel(UUID taskId) {
        return apply(taskId, current -> current.isTerminal() ? current : current.cancel());
    }

    /**
     * Update the record and publish a transition event if its status changed.
     */
    private TaskRecord apply(UUID taskId, UnaryOperator<TaskRecord> mutation) {
        AtomicReference<TaskStatus> before = new AtomicReference<>();
        TaskRecord after = store.update(taskId, current -> {
            before.set(current.status());
            return mutation.apply(current);
        });
        if (before.get() != after.status()) {
            eventBus.publish(TaskTransitionEvent.ADDRESS,
                    TaskTransitionEvent.of(taskId, before.get(), after.status()));
        }
        return after;
    }
}

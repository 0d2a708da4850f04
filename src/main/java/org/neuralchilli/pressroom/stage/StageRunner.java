package org.neuralchilli.pressroom.stage;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageInput;
import org.neuralchilli.pressroom.domain.StageOutput;
import org.neuralchilli.pressroom.monitoring.PipelineMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one stage call with a per-attempt timeout, retrying transient
 * failures with exponential backoff.
 * <p>
 * Classification of a failed attempt:
 * <ul>
 *   <li>transient: {@link TransientStageException}, {@link UncheckedIOException}, timeout</li>
 *   <li>permanent: {@link PermanentStageException}, any other exception, a null output</li>
 * </ul>
 * The call runs on a separate thread so the caller can stop waiting at the
 * deadline. A timed-out call is interrupted but may keep running in the
 * collaborator; its late result is discarded.
 */
@ApplicationScoped
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    @Inject
    PipelineConfig config;

    @Inject
    PipelineMonitor monitor;

    private ExecutorService callExecutor;

    @PostConstruct
    void init() {
        callExecutor = Executors.newCachedThreadPool(new StageCallThreadFactory());
        log.info("StageRunner initialized");
    }

    @PreDestroy
    void shutdown() {
        if (callExecutor != null) {
            callExecutor.shutdownNow();
        }
    }

    /**
     * Retry policy of a stage: the global retry settings, the stage's own
     * timeout and its optional attempt override.
     */
    public RetryPolicy policyFor(Stage stage) {
        PipelineConfig.Retry retry = config.retry();
        PipelineConfig.StageSettings settings = settingsOf(stage);
        return new RetryPolicy(
                settings.maxAttempts().orElse(retry.maxAttempts()),
                retry.initialBackoff(),
                retry.multiplier(),
                retry.maxBackoff(),
                settings.timeout()
        );
    }

    public <I extends StageInput, O extends StageOutput> StageResult run(
            Stage stage, I input, StageCall<I, O> call) {
        return run(stage, input, call, policyFor(stage));
    }

    /**
     * Run the call until it succeeds, fails permanently or the attempt
     * budget is spent. Never throws.
     */
    public <I extends StageInput, O extends StageOutput> StageResult run(
            Stage stage, I input, StageCall<I, O> call, RetryPolicy policy) {

        String lastError = "No attempt made";
        int attempt = 0;

        while (attempt < policy.maxAttempts()) {
            attempt++;
            monitor.recordStageAttempt(stage);
            log.debug("Stage {} attempt {}/{}", stage, attempt, policy.maxAttempts());

            Future<O> future = callExecutor.submit(() -> call.invoke(input));
            try {
                O output = future.get(policy.timeout().toMillis(), TimeUnit.MILLISECONDS);
                if (output == null) {
                    log.error("Stage {} returned no output", stage);
                    return StageResult.permanent("Stage " + stage + " returned no output", attempt);
                }
                if (output.stage() != stage) {
                    log.error("Stage {} returned output of stage {}", stage, output.stage());
                    return StageResult.permanent(
                            "Stage " + stage + " returned output of stage " + output.stage(), attempt);
                }
                return StageResult.success(output, attempt);

            } catch (TimeoutException e) {
                future.cancel(true);
                monitor.recordTimeout(stage);
                lastError = "Timed out after " + policy.timeout().toMillis() + "ms";
                log.warn("Stage {} attempt {} timed out after {}ms",
                        stage, attempt, policy.timeout().toMillis());

            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                lastError = describe(cause);
                if (!isTransient(cause)) {
                    log.error("Stage {} failed permanently on attempt {}: {}", stage, attempt, lastError);
                    return StageResult.permanent(lastError, attempt);
                }
                log.warn("Stage {} attempt {} failed: {}", stage, attempt, lastError);

            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                log.warn("Stage {} interrupted during attempt {}", stage, attempt);
                return StageResult.exhausted("Interrupted during attempt " + attempt, attempt);
            }

            if (attempt < policy.maxAttempts()) {
                Duration backoff = policy.backoffAfter(attempt);
                monitor.recordRetry(stage);
                log.debug("Retrying stage {} in {}ms", stage, backoff.toMillis());
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Stage {} interrupted while backing off", stage);
                    return StageResult.exhausted(lastError, attempt);
                }
            }
        }

        log.error("Stage {} exhausted {} attempts: {}", stage, attempt, lastError);
        return StageResult.exhausted(lastError, attempt);
    }

    private PipelineConfig.StageSettings settingsOf(Stage stage) {
        PipelineConfig.Stages stages = config.stages();
        return switch (stage) {
            case EXTRACT -> stages.extract();
            case ANALYZE -> stages.analyze();
            case WRITE -> stages.write();
            case PUBLISH -> stages.publish();
        };
    }

    static boolean isTransient(Throwable failure) {
        if (failure instanceof StageException stageException) {
            return stageException.isTransient();
        }
        return failure instanceof UncheckedIOException;
    }

    private static String describe(Throwable failure) {
        if (failure instanceof StageException) {
            return failure.getMessage();
        }
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }

    /**
     * Daemon threads, so a collaborator stuck past its timeout cannot hold
     * the JVM open.
     */
    private static class StageCallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("stage-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

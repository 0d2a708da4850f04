package org.neuralchilli.pressroom.monitoring;

import io.quarkus.vertx.ConsumeEvent;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageAttemptEvent;
import org.neuralchilli.pressroom.domain.TaskTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for task lifecycle and stage execution.
 * <p>
 * Task counters are fed from the transition events on the event bus;
 * attempt, retry and timeout counters are recorded directly by the stage
 * runner, since those happen inside a single stage run.
 */
@ApplicationScoped
public class PipelineMonitor {

    private static final Logger log = LoggerFactory.getLogger(PipelineMonitor.class);

    // Task lifecycle
    private final LongAdder tasksSubmitted = new LongAdder();
    private final LongAdder tasksStarted = new LongAdder();
    private final LongAdder tasksCompleted = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder tasksCancelled = new LongAdder();

    // Stage execution
    private final LongAdder stageAttempts = new LongAdder();
    private final LongAdder stageRetries = new LongAdder();
    private final LongAdder stageTimeouts = new LongAdder();
    private final LongAdder stageFailures = new LongAdder();

    private final Map<Stage, TimingStats> stageTimings = new ConcurrentHashMap<>();

    @ConsumeEvent(TaskTransitionEvent.ADDRESS)
    public void onTransition(TaskTransitionEvent event) {
        switch (event.to()) {
            case PENDING -> tasksSubmitted.increment();
            case RUNNING -> tasksStarted.increment();
            case COMPLETED -> tasksCompleted.increment();
            case FAILED -> tasksFailed.increment();
            case CANCELLED -> tasksCancelled.increment();
        }
        log.trace("Task {} {} -> {}", event.taskId(), event.from(), event.to());
    }

    @ConsumeEvent(StageAttemptEvent.ADDRESS)
    public void onStageFinished(StageAttemptEvent event) {
        stageTimings.computeIfAbsent(event.stage(), stage -> new TimingStats())
                .record(Duration.ofMillis(event.durationMillis()));
        if (!event.success()) {
            stageFailures.increment();
        }
    }

    public void recordStageAttempt(Stage stage) {
        stageAttempts.increment();
    }

    public void recordRetry(Stage stage) {
        stageRetries.increment();
    }

    public void recordTimeout(Stage stage) {
        stageTimeouts.increment();
    }

    /**
     * Timing statistics of a stage, empty if it never ran.
     */
    public TimingStats timingOf(Stage stage) {
        return stageTimings.getOrDefault(stage, new TimingStats());
    }

    /**
     * Statistics for stage timing.
     */
    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Nonnull
        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    public Snapshot snapshot() {
        Map<Stage, String> timings = new EnumMap<>(Stage.class);
        stageTimings.forEach((stage, stats) -> timings.put(stage, stats.toString()));
        return new Snapshot(
                tasksSubmitted.sum(),
                tasksStarted.sum(),
                tasksCompleted.sum(),
                tasksFailed.sum(),
                tasksCancelled.sum(),
                stageAttempts.sum(),
                stageRetries.sum(),
                stageTimeouts.sum(),
                stageFailures.sum(),
                timings
        );
    }

    /**
     * Point-in-time copy of all counters.
     */
    public record Snapshot(
            long tasksSubmitted,
            long tasksStarted,
            long tasksCompleted,
            long tasksFailed,
            long tasksCancelled,
            long stageAttempts,
            long stageRetries,
            long stageTimeouts,
            long stageFailures,
            Map<Stage, String> stageTimings
    ) {
        public double successRate() {
            long finished = tasksCompleted + tasksFailed;
            return finished > 0 ? (tasksCompleted * 100.0) / finished : 0.0;
        }

        @Nonnull
        @Override
        public String toString() {
            StringBuilder timings = new StringBuilder();
            stageTimings.forEach((stage, stats) ->
                    timings.append("  ").append(stage).append(": ").append(stats).append('\n'));
            return String.format("""
                Pipeline Summary:
                =================
                Tasks:
                  Submitted: %d, Started: %d
                  Completed: %d, Failed: %d, Cancelled: %d
                  Success Rate: %.1f%%

                Stages:
                  Attempts: %d, Retries: %d, Timeouts: %d, Failures: %d
                %s""",
                    tasksSubmitted, tasksStarted,
                    tasksCompleted, tasksFailed, tasksCancelled,
                    successRate(),
                    stageAttempts, stageRetries, stageTimeouts, stageFailures,
                    timings
            );
        }
    }

    /**
     * Reset all counters (useful for testing).
     */
    public void reset() {
        tasksSubmitted.reset();
        tasksStarted.reset();
        tasksCompleted.reset();
        tasksFailed.reset();
        tasksCancelled.reset();
        stageAttempts.reset();
        stageRetries.reset();
        stageTimeouts.reset();
        stageFailures.reset();
        stageTimings.clear();
        log.info("Pipeline metrics reset");
    }

    public void logSummary() {
        log.info("\n{}", snapshot());
    }
}

package org.neuralchilli.pressroom.monitoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageAttemptEvent;
import org.neuralchilli.pressroom.domain.TaskStatus;
import org.neuralchilli.pressroom.domain.TaskTransitionEvent;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMonitorTest {

    private PipelineMonitor monitor;

    @BeforeEach
    void setup() {
        monitor = new PipelineMonitor();
    }

    @Test
    void shouldCountTransitionsByTargetStatus() {
        UUID taskId = UUID.randomUUID();
        monitor.onTransition(TaskTransitionEvent.of(taskId, null, TaskStatus.PENDING));
        monitor.onTransition(TaskTransitionEvent.of(taskId, TaskStatus.PENDING, TaskStatus.RUNNING));
        monitor.onTransition(TaskTransitionEvent.of(taskId, TaskStatus.RUNNING, TaskStatus.COMPLETED));
        monitor.onTransition(TaskTransitionEvent.of(UUID.randomUUID(), TaskStatus.RUNNING, TaskStatus.FAILED));

        PipelineMonitor.Snapshot snapshot = monitor.snapshot();

        assertThat(snapshot.tasksSubmitted()).isEqualTo(1);
        assertThat(snapshot.tasksStarted()).isEqualTo(1);
        assertThat(snapshot.tasksCompleted()).isEqualTo(1);
        assertThat(snapshot.tasksFailed()).isEqualTo(1);
        assertThat(snapshot.successRate()).isEqualTo(50.0);
    }

    @Test
    void shouldTrackStageTimings() {
        UUID taskId = UUID.randomUUID();
        monitor.onStageFinished(new StageAttemptEvent(taskId, Stage.ANALYZE, true, 1, 100));
        monitor.onStageFinished(new StageAttemptEvent(taskId, Stage.ANALYZE, false, 3, 300));

        PipelineMonitor.TimingStats stats = monitor.timingOf(Stage.ANALYZE);

        assertThat(stats.getCount()).isEqualTo(2);
        assertThat(stats.getAverage()).isEqualTo(Duration.ofMillis(200));
        assertThat(stats.getMin()).isEqualTo(Duration.ofMillis(100));
        assertThat(stats.getMax()).isEqualTo(Duration.ofMillis(300));
        assertThat(monitor.snapshot().stageFailures()).isEqualTo(1);
        assertThat(monitor.timingOf(Stage.PUBLISH).getCount()).isZero();
    }

    @Test
    void shouldResetAllCounters() {
        monitor.recordStageAttempt(Stage.EXTRACT);
        monitor.recordRetry(Stage.EXTRACT);
        monitor.recordTimeout(Stage.EXTRACT);

        monitor.reset();

        PipelineMonitor.Snapshot snapshot = monitor.snapshot();
        assertThat(snapshot.stageAttempts()).isZero();
        assertThat(snapshot.stageRetries()).isZero();
        assertThat(snapshot.stageTimeouts()).isZero();
        assertThat(snapshot.toString()).contains("Pipeline Summary");
    }
}

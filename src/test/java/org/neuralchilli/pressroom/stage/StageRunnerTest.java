package org.neuralchilli.pressroom.stage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.domain.ExtractRequest;
import org.neuralchilli.pressroom.domain.ExtractedContent;
import org.neuralchilli.pressroom.domain.FailureReason;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.monitoring.PipelineMonitor;
import org.neuralchilli.pressroom.support.Fixtures;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class StageRunnerTest {

    private static final ExtractRequest REQUEST = new ExtractRequest(Fixtures.URL, true, true);
    private static final ExtractedContent CONTENT = Fixtures.content(Fixtures.URL);

    private static final RetryPolicy POLICY = new RetryPolicy(
            3, Duration.ofMillis(5), 2.0, Duration.ofMillis(20), Duration.ofSeconds(2));

    private StageRunner runner;
    private PipelineMonitor monitor;
    private ContentExtractor extractor;

    @BeforeEach
    void setup() {
        monitor = new PipelineMonitor();
        runner = new StageRunner();
        runner.monitor = monitor;
        runner.init();
        extractor = mock(ContentExtractor.class);
    }

    @AfterEach
    void teardown() {
        runner.shutdown();
    }

    @Test
    void shouldReturnOutputOnFirstSuccess() {
        when(extractor.extract(REQUEST)).thenReturn(CONTENT);

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, POLICY);

        assertThat(result).isInstanceOfSatisfying(StageResult.Success.class, success -> {
            assertThat(success.output()).isEqualTo(CONTENT);
            assertThat(success.attempts()).isEqualTo(1);
        });
        verify(extractor, times(1)).extract(REQUEST);
    }

    @Test
    void shouldNeverRetryPermanentFailure() {
        when(extractor.extract(REQUEST)).thenThrow(new PermanentStageException("404 Not Found"));

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, POLICY);

        assertThat(result).isInstanceOfSatisfying(StageResult.Failure.class, failure -> {
            assertThat(failure.reason()).isEqualTo(FailureReason.STAGE_PERMANENT_FAILURE);
            assertThat(failure.attempts()).isEqualTo(1);
            assertThat(failure.message()).isEqualTo("404 Not Found");
        });
        verify(extractor, times(1)).extract(REQUEST);
        assertThat(monitor.snapshot().stageRetries()).isZero();
    }

    @Test
    void shouldTreatUnclassifiedExceptionAsPermanent() {
        when(extractor.extract(REQUEST)).thenThrow(new IllegalStateException("parser bug"));

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, POLICY);

        assertThat(result).isInstanceOfSatisfying(StageResult.Failure.class, failure -> {
            assertThat(failure.reason()).isEqualTo(FailureReason.STAGE_PERMANENT_FAILURE);
            assertThat(failure.message()).contains("IllegalStateException", "parser bug");
        });
        verify(extractor, times(1)).extract(REQUEST);
    }

    @Test
    void shouldTreatNullOutputAsPermanent() {
        when(extractor.extract(REQUEST)).thenReturn(null);

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, POLICY);

        assertThat(result).isInstanceOfSatisfying(StageResult.Failure.class, failure ->
                assertThat(failure.reason()).isEqualTo(FailureReason.STAGE_PERMANENT_FAILURE));
    }

    @Test
    void shouldRetryTransientFailureUntilSuccess() {
        when(extractor.extract(REQUEST))
                .thenThrow(new TransientStageException("connection reset"))
                .thenThrow(new UncheckedIOException(new IOException("socket closed")))
                .thenReturn(CONTENT);

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, POLICY);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        verify(extractor, times(3)).extract(REQUEST);
        assertThat(monitor.snapshot().stageRetries()).isEqualTo(2);
        assertThat(monitor.snapshot().stageAttempts()).isEqualTo(3);
    }

    @Test
    void shouldReportExhaustedAfterAttemptBudget() {
        when(extractor.extract(REQUEST)).thenThrow(new TransientStageException("503 Service Unavailable"));

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, POLICY);

        assertThat(result).isInstanceOfSatisfying(StageResult.Failure.class, failure -> {
            assertThat(failure.reason()).isEqualTo(FailureReason.STAGE_EXHAUSTED);
            assertThat(failure.attempts()).isEqualTo(3);
            assertThat(failure.message()).isEqualTo("503 Service Unavailable");
        });
        verify(extractor, times(3)).extract(REQUEST);
    }

    @Test
    void shouldCountTimeoutAsTransient() {
        RetryPolicy quick = new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO, Duration.ofMillis(100));
        when(extractor.extract(REQUEST)).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return CONTENT;
        });

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, quick);

        assertThat(result).isInstanceOfSatisfying(StageResult.Failure.class, failure -> {
            assertThat(failure.reason()).isEqualTo(FailureReason.STAGE_EXHAUSTED);
            assertThat(failure.attempts()).isEqualTo(2);
            assertThat(failure.message()).contains("Timed out");
        });
        assertThat(monitor.snapshot().stageTimeouts()).isEqualTo(2);
    }

    @Test
    void shouldRecoverFromTimeoutOnRetry() {
        RetryPolicy quick = new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO, Duration.ofMillis(200));
        when(extractor.extract(REQUEST))
                .thenAnswer(invocation -> {
                    Thread.sleep(1000);
                    return CONTENT;
                })
                .thenReturn(CONTENT);

        StageResult result = runner.run(Stage.EXTRACT, REQUEST, extractor::extract, quick);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    void shouldGrowBackoffExponentiallyUpToCap() {
        RetryPolicy policy = new RetryPolicy(
                5, Duration.ofMillis(500), 2.0, Duration.ofSeconds(3), Duration.ofSeconds(30));

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(2000));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void shouldBuildPolicyFromStageSettings() {
        PipelineConfig config = mock(PipelineConfig.class);
        PipelineConfig.Retry retry = mock(PipelineConfig.Retry.class);
        PipelineConfig.Stages stages = mock(PipelineConfig.Stages.class);
        PipelineConfig.StageSettings publish = mock(PipelineConfig.StageSettings.class);
        when(config.retry()).thenReturn(retry);
        when(config.stages()).thenReturn(stages);
        when(stages.publish()).thenReturn(publish);
        when(retry.maxAttempts()).thenReturn(3);
        when(retry.initialBackoff()).thenReturn(Duration.ofMillis(500));
        when(retry.multiplier()).thenReturn(2.0);
        when(retry.maxBackoff()).thenReturn(Duration.ofSeconds(10));
        when(publish.timeout()).thenReturn(Duration.ofSeconds(60));
        when(publish.maxAttempts()).thenReturn(Optional.of(1));
        runner.config = config;

        RetryPolicy policy = runner.policyFor(Stage.PUBLISH);

        assertThat(policy.maxAttempts()).isEqualTo(1);
        assertThat(policy.timeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.initialBackoff()).isEqualTo(Duration.ofMillis(500));
    }
}

package org.neuralchilli.pressroom.core;

import org.neuralchilli.pressroom.domain.AnalysisRequest;
import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.domain.ContentAnalysis;
import org.neuralchilli.pressroom.domain.ExtractRequest;
import org.neuralchilli.pressroom.domain.ExtractedContent;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.PublishRequest;
import org.neuralchilli.pressroom.domain.Stage;
import org.neuralchilli.pressroom.domain.StageInput;
import org.neuralchilli.pressroom.domain.StageOutput;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.domain.WritingRequest;

/**
 * Derives the input of a stage from the task's request and the output of the
 * stage immediately before it. The leading stage of a run that skips EXTRACT
 * takes the request's explicit seed instead.
 */
final class StageInputs {

    private StageInputs() {
    }

    /**
     * @throws IllegalStateException if the upstream output is missing
     * @throws IllegalArgumentException if the request lacks a field the stage needs
     */
    static StageInput build(TaskRecord task, Stage stage) {
        PipelineRequest request = task.request();
        StageOutput upstream = upstreamOf(task, stage);

        return switch (stage) {
            case EXTRACT -> new ExtractRequest(request.url(), request.extractImages(), request.extractLinks());
            case ANALYZE -> new AnalysisRequest((ExtractedContent) upstream);
            case WRITE -> new WritingRequest(
                    (ContentAnalysis) upstream,
                    request.style(),
                    request.audience(),
                    request.targetLength() != null ? request.targetLength() : 0);
            case PUBLISH -> new PublishRequest(
                    (Article) upstream,
                    request.author(),
                    request.draftOnly(),
                    request.platform());
        };
    }

    private static StageOutput upstreamOf(TaskRecord task, Stage stage) {
        if (stage == Stage.EXTRACT) {
            return null;
        }
        boolean leading = task.requestedStages().get(0) == stage;
        StageOutput upstream = leading
                ? task.request().seedFor(stage)
                : task.outputOf(stage.previous());
        if (upstream == null) {
            throw new IllegalStateException(leading
                    ? "No seed input for leading stage " + stage
                    : "No output of stage " + stage.previous() + " to feed " + stage);
        }
        return upstream;
    }
}

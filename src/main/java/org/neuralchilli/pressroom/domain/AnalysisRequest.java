package org.neuralchilli.pressroom.domain;

public record AnalysisRequest(ExtractedContent content) implements StageInput {

    public AnalysisRequest {
        if (content == null) {
            throw new IllegalArgumentException("Content to analyze cannot be null");
        }
    }

    @Override
    public Stage stage() {
        return Stage.ANALYZE;
    }
}

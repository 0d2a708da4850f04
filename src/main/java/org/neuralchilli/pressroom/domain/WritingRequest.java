package org.neuralchilli.pressroom.domain;

public record WritingRequest(
        ContentAnalysis analysis,
        WritingStyle style,
        Audience audience,
        int targetLength
) implements StageInput {

    public WritingRequest {
        if (analysis == null) {
            throw new IllegalArgumentException("Analysis cannot be null");
        }
        if (style == null) {
            throw new IllegalArgumentException("Writing style cannot be null");
        }
        if (audience == null) {
            throw new IllegalArgumentException("Audience cannot be null");
        }
        if (targetLength <= 0) {
            throw new IllegalArgumentException("Target length must be positive");
        }
    }

    @Override
    public Stage stage() {
        return Stage.WRITE;
    }
}

package org.neuralchilli.pressroom.domain;

import java.util.List;

/**
 * Structural and thematic reading of extracted content.
 */
public record ContentAnalysis(
        String summary,
        List<String> keyPoints,
        List<String> themes,
        String sentiment,
        String structure,
        List<String> recommendations
) implements StageOutput {

    public ContentAnalysis {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("Analysis summary cannot be null or empty");
        }

        keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
        themes = themes != null ? List.copyOf(themes) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    @Override
    public Stage stage() {
        return Stage.ANALYZE;
    }
}

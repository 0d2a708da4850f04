package org.neuralchilli.pressroom.domain;

public record ExtractRequest(
        String url,
        boolean extractImages,
        boolean extractLinks
) implements StageInput {

    public ExtractRequest {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be null or empty");
        }
    }

    @Override
    public Stage stage() {
        return Stage.EXTRACT;
    }
}

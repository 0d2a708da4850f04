package org.neuralchilli.pressroom.domain;

/**
 * Input for the publishing stage. draftOnly selects the platform's draft
 * mode; the stage still runs.
 */
public record PublishRequest(
        Article article,
        String author,
        boolean draftOnly,
        String platform
) implements StageInput {

    public PublishRequest {
        if (article == null) {
            throw new IllegalArgumentException("Article cannot be null");
        }
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("Platform cannot be null or empty");
        }
    }

    @Override
    public Stage stage() {
        return Stage.PUBLISH;
    }
}

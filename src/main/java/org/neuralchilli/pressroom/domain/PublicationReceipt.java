package org.neuralchilli.pressroom.domain;

/**
 * Acknowledgement from the publishing platform.
 * A draft carries a draftId, a live publication a publishedId.
 */
public record PublicationReceipt(
        String platform,
        String publishedId,
        String draftId,
        String url,
        boolean draft
) implements StageOutput {

    public PublicationReceipt {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("Platform cannot be null or empty");
        }
        if (draft && draftId == null) {
            throw new IllegalArgumentException("Draft receipt requires a draft ID");
        }
        if (!draft && publishedId == null) {
            throw new IllegalArgumentException("Publication receipt requires a published ID");
        }
    }

    public static PublicationReceipt published(String platform, String publishedId, String url) {
        return new PublicationReceipt(platform, publishedId, null, url, false);
    }

    public static PublicationReceipt drafted(String platform, String draftId) {
        return new PublicationReceipt(platform, null, draftId, null, true);
    }

    @Override
    public Stage stage() {
        return Stage.PUBLISH;
    }
}

package org.neuralchilli.pressroom.domain;

import java.util.List;

/**
 * Article drafted by the writing stage.
 */
public record Article(
        String title,
        String content,
        String summary,
        int wordCount,
        List<String> tags
) implements StageOutput {

    public Article {
        if (wordCount < 0) {
            throw new IllegalArgumentException("Word count cannot be negative");
        }

        title = title != null ? title : "";
        content = content != null ? content : "";
        summary = summary != null ? summary : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    @Override
    public Stage stage() {
        return Stage.WRITE;
    }
}

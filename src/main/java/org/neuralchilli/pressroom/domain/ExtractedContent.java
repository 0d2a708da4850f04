package org.neuralchilli.pressroom.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Page content pulled out by the extraction stage.
 */
public record ExtractedContent(
        String url,
        String title,
        String body,
        List<String> images,
        List<String> links,
        Map<String, String> metadata,
        Instant extractedAt
) implements StageOutput {

    public ExtractedContent {
        if (body == null) {
            throw new IllegalArgumentException("Extracted body cannot be null");
        }

        // Defaults
        title = title != null ? title : "";
        images = images != null ? List.copyOf(images) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
        // Sorted so the serialized form is stable
        metadata = metadata != null
                ? Collections.unmodifiableMap(new TreeMap<>(metadata))
                : Map.of();
    }

    @Override
    public Stage stage() {
        return Stage.EXTRACT;
    }
}

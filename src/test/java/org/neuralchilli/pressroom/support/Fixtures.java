package org.neuralchilli.pressroom.support;

import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.domain.ContentAnalysis;
import org.neuralchilli.pressroom.domain.ExtractedContent;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.PublicationReceipt;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Sample payloads for tests.
 */
public final class Fixtures {

    public static final String URL = "https://example.com/posts/42";

    private Fixtures() {
    }

    public static ExtractedContent content(String url) {
        return new ExtractedContent(
                url,
                "Example post",
                "The body of the example post.",
                List.of("https://example.com/img/1.png"),
                List.of("https://example.com/about"),
                Map.of("lang", "en", "author", "Jo"),
                Instant.parse("2025-01-15T10:00:00Z")
        );
    }

    public static ContentAnalysis analysis() {
        return new ContentAnalysis(
                "A post about examples",
                List.of("Examples help", "Tests need fixtures"),
                List.of("testing", "examples"),
                "positive",
                "intro, body, conclusion",
                List.of("Add more examples")
        );
    }

    public static Article article() {
        return new Article(
                "Why examples matter",
                "Examples make ideas concrete. ".repeat(20),
                "Examples make ideas concrete",
                100,
                List.of("testing")
        );
    }

    public static PublicationReceipt receipt() {
        return PublicationReceipt.published("wechat", "pub-1", "https://mp.example.com/pub-1");
    }

    public static PipelineRequest request() {
        return PipelineRequest.forUrl(URL).build();
    }
}

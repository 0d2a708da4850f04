package org.neuralchilli.pressroom.stage;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.domain.ContentAnalysis;
import org.neuralchilli.pressroom.domain.ExtractedContent;
import org.neuralchilli.pressroom.domain.PublicationReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Trial-run collaborators, active until a deployment provides real ones.
 * Each logs what it would do and returns a placeholder payload derived
 * only from its input.
 */
@ApplicationScoped
public class TrialRunCollaborators {

    private static final Logger log = LoggerFactory.getLogger(TrialRunCollaborators.class);

    @Produces
    @ApplicationScoped
    @DefaultBean
    ContentExtractor trialRunExtractor() {
        return request -> {
            log.info("TRIAL RUN - Would extract: {} (images: {}, links: {})",
                    request.url(), request.extractImages(), request.extractLinks());
            return new ExtractedContent(
                    request.url(),
                    "Trial run: " + request.url(),
                    "Placeholder body extracted from " + request.url(),
                    List.of(),
                    List.of(),
                    Map.of("trial_run", "true"),
                    Instant.now()
            );
        };
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    ContentAnalyzer trialRunAnalyzer() {
        return request -> {
            ExtractedContent content = request.content();
            log.info("TRIAL RUN - Would analyze: {} ({} chars)", content.title(), content.body().length());
            return new ContentAnalysis(
                    "Summary of " + content.title(),
                    List.of(content.title()),
                    List.of("trial-run"),
                    "neutral",
                    "single section",
                    List.of()
            );
        };
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    ArticleWriter trialRunWriter() {
        return request -> {
            log.info("TRIAL RUN - Would write: {} words, style {}, audience {}",
                    request.targetLength(), request.style(), request.audience());
            String summary = request.analysis().summary();
            return new Article(
                    "Trial run article",
                    summary,
                    summary,
                    request.targetLength(),
                    request.analysis().themes()
            );
        };
    }

    @Produces
    @ApplicationScoped
    @DefaultBean
    ArticlePublisher trialRunPublisher() {
        return (request, credentials) -> {
            Article article = request.article();
            if (article.title().isBlank() || article.content().isBlank()) {
                throw new PermanentStageException("Article title and content are required for publishing");
            }
            log.info("TRIAL RUN - Would publish: '{}' to {} (draft: {}, credentials configured: {})",
                    article.title(), request.platform(), request.draftOnly(), credentials.configured());

            String id = UUID.nameUUIDFromBytes(article.title().getBytes(StandardCharsets.UTF_8)).toString();
            return request.draftOnly()
                    ? PublicationReceipt.drafted(request.platform(), "draft-" + id)
                    : PublicationReceipt.published(request.platform(), id, null);
        };
    }
}

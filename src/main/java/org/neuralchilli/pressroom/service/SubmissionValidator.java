package org.neuralchilli.pressroom.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.domain.PipelineRequest;
import org.neuralchilli.pressroom.domain.Stage;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Checks a submission against the stages it asks for. Runs once, before a
 * task record exists; a task that passes never fails for a reason this
 * class could have caught.
 */
@ApplicationScoped
public class SubmissionValidator {

    @Inject
    PipelineConfig config;

    private int minWordCount;
    private int maxWordCount;

    public SubmissionValidator() {
    }

    SubmissionValidator(int minWordCount, int maxWordCount) {
        this.minWordCount = minWordCount;
        this.maxWordCount = maxWordCount;
    }

    @PostConstruct
    void init() {
        minWordCount = config.content().minWordCount();
        maxWordCount = config.content().maxWordCount();
    }

    /**
     * Normalise the requested stages into pipeline order and validate the
     * request against them.
     *
     * @return the stages in pipeline order
     * @throws InvalidRequestException if anything is wrong
     */
    public List<Stage> validate(Collection<Stage> requestedStages, PipelineRequest request) {
        List<String> errors = new ArrayList<>();

        if (requestedStages == null || requestedStages.isEmpty()) {
            throw new InvalidRequestException(List.of("At least one stage must be requested"));
        }
        if (requestedStages.stream().anyMatch(Objects::isNull)) {
            throw new InvalidRequestException(List.of("Requested stages cannot contain null"));
        }
        if (request == null) {
            throw new InvalidRequestException(List.of("Request cannot be null"));
        }

        List<Stage> stages = Stage.inPipelineOrder(requestedStages);
        if (!Stage.isContiguous(stages)) {
            errors.add("Requested stages must be contiguous in pipeline order, got " + stages);
        }

        Stage leading = stages.get(0);
        validateSeeds(leading, request, errors);

        if (stages.contains(Stage.EXTRACT)) {
            validateUrl(request.url(), errors);
        }
        if (stages.contains(Stage.WRITE)) {
            validateWriting(request, errors);
        }
        if (stages.contains(Stage.PUBLISH)) {
            validatePublishing(leading, request, errors);
        }

        if (!errors.isEmpty()) {
            throw new InvalidRequestException(errors);
        }
        return stages;
    }

    /**
     * Only the leading stage may take a seed, and it must have one unless it
     * is EXTRACT. A seed for any other stage would shadow a derived input.
     */
    private void validateSeeds(Stage leading, PipelineRequest request, List<String> errors) {
        for (Stage stage : Stage.values()) {
            boolean seeded = request.seedFor(stage) != null;
            if (stage == leading && stage != Stage.EXTRACT && !seeded) {
                errors.add(seedName(stage) + " is required when the run starts at " + stage);
            } else if (stage != leading && seeded) {
                errors.add(seedName(stage) + " must not be supplied: the run starts at " + leading);
            }
        }
    }

    private void validateUrl(String url, List<String> errors) {
        if (url == null || url.isBlank()) {
            errors.add("url is required for EXTRACT");
            return;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                errors.add("url must be an absolute http or https URL: " + url);
            }
        } catch (URISyntaxException e) {
            errors.add("url is malformed: " + e.getMessage());
        }
    }

    private void validateWriting(PipelineRequest request, List<String> errors) {
        if (request.style() == null) {
            errors.add("style is required for WRITE");
        }
        if (request.audience() == null) {
            errors.add("audience is required for WRITE");
        }
        Integer length = request.targetLength();
        if (length == null) {
            errors.add("targetLength is required for WRITE");
        } else if (length < minWordCount || length > maxWordCount) {
            errors.add("targetLength must be between " + minWordCount + " and " + maxWordCount
                    + ", got " + length);
        }
    }

    private void validatePublishing(Stage leading, PipelineRequest request, List<String> errors) {
        if (request.platform() == null || request.platform().isBlank()) {
            errors.add("platform is required for PUBLISH");
        }
        if (leading == Stage.PUBLISH && request.seedArticle() != null) {
            Article article = request.seedArticle();
            if (article.title().isBlank()) {
                errors.add("seedArticle title is required for PUBLISH");
            }
            if (article.content().isBlank()) {
                errors.add("seedArticle content is required for PUBLISH");
            }
        }
    }

    private static String seedName(Stage stage) {
        return switch (stage) {
            case EXTRACT -> "url";
            case ANALYZE -> "seedContent";
            case WRITE -> "seedAnalysis";
            case PUBLISH -> "seedArticle";
        };
    }
}

package org.neuralchilli.pressroom.domain;

/**
 * Caller-supplied parameters of a pipeline run.
 * <p>
 * The seed fields carry the explicit input of the leading stage when a run
 * starts after EXTRACT: {@code seedContent} for ANALYZE, {@code seedAnalysis}
 * for WRITE and {@code seedArticle} for PUBLISH. Which fields are required
 * depends on the requested stages and is checked at submission.
 */
public record PipelineRequest(
        String url,
        boolean extractImages,
        boolean extractLinks,
        WritingStyle style,
        Audience audience,
        Integer targetLength,
        String author,
        boolean draftOnly,
        String platform,
        ExtractedContent seedContent,
        ContentAnalysis seedAnalysis,
        Article seedArticle
) {

    public static Builder builder() {
        return new Builder();
    }

    public static Builder forUrl(String url) {
        return new Builder().url(url);
    }

    /**
     * Fill unset writing and publishing parameters. Values the caller set win.
     */
    public PipelineRequest withDefaults(
            WritingStyle defaultStyle,
            Audience defaultAudience,
            int defaultTargetLength,
            String defaultAuthor,
            String defaultPlatform
    ) {
        return new PipelineRequest(
                url,
                extractImages,
                extractLinks,
                style != null ? style : defaultStyle,
                audience != null ? audience : defaultAudience,
                targetLength != null ? targetLength : defaultTargetLength,
                author != null && !author.isBlank() ? author : defaultAuthor,
                draftOnly,
                platform != null && !platform.isBlank() ? platform : defaultPlatform,
                seedContent,
                seedAnalysis,
                seedArticle
        );
    }

    /**
     * The explicit seed for a leading stage, or null when none was supplied.
     * EXTRACT is seeded by the URL and never has one.
     */
    public StageOutput seedFor(Stage stage) {
        return switch (stage) {
            case EXTRACT -> null;
            case ANALYZE -> seedContent;
            case WRITE -> seedAnalysis;
            case PUBLISH -> seedArticle;
        };
    }

    public static final class Builder {
        private String url;
        private boolean extractImages = true;
        private boolean extractLinks = true;
        private WritingStyle style;
        private Audience audience;
        private Integer targetLength;
        private String author;
        private boolean draftOnly;
        private String platform;
        private ExtractedContent seedContent;
        private ContentAnalysis seedAnalysis;
        private Article seedArticle;

        private Builder() {
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder extractImages(boolean extractImages) {
            this.extractImages = extractImages;
            return this;
        }

        public Builder extractLinks(boolean extractLinks) {
            this.extractLinks = extractLinks;
            return this;
        }

        public Builder style(WritingStyle style) {
            this.style = style;
            return this;
        }

        public Builder audience(Audience audience) {
            this.audience = audience;
            return this;
        }

        public Builder targetLength(Integer targetLength) {
            this.targetLength = targetLength;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder draftOnly(boolean draftOnly) {
            this.draftOnly = draftOnly;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder seedContent(ExtractedContent seedContent) {
            this.seedContent = seedContent;
            return this;
        }

        public Builder seedAnalysis(ContentAnalysis seedAnalysis) {
            this.seedAnalysis = seedAnalysis;
            return this;
        }

        public Builder seedArticle(Article seedArticle) {
            this.seedArticle = seedArticle;
            return this;
        }

        public PipelineRequest build() {
            return new PipelineRequest(
                    url, extractImages, extractLinks, style, audience, targetLength,
                    author, draftOnly, platform, seedContent, seedAnalysis, seedArticle
            );
        }
    }
}

package org.neuralchilli.pressroom.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result payload of one stage. One variant per stage, each with a fixed schema,
 * so the next stage's input can be derived without guessing at its shape.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExtractedContent.class, name = "extracted-content"),
        @JsonSubTypes.Type(value = ContentAnalysis.class, name = "content-analysis"),
        @JsonSubTypes.Type(value = Article.class, name = "article"),
        @JsonSubTypes.Type(value = PublicationReceipt.class, name = "publication-receipt")
})
public sealed interface StageOutput
        permits ExtractedContent, ContentAnalysis, Article, PublicationReceipt {

    /**
     * The stage that produces this payload.
     */
    Stage stage();
}

package org.neuralchilli.pressroom.domain;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/**
 * The four pipeline stages, declared in their fixed execution order.
 */
public enum Stage {
    /**
     * Fetch the page and pull out title, body, images and links
     */
    EXTRACT("Extracting content"),

    /**
     * Summarise the extracted content into key points and themes
     */
    ANALYZE("Analyzing content"),

    /**
     * Draft a new article from the analysis
     */
    WRITE("Writing article"),

    /**
     * Publish the article, or store it as a draft
     */
    PUBLISH("Publishing article");

    private final String description;

    Stage(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * The stage whose output feeds this one, or null for EXTRACT.
     */
    public Stage previous() {
        return ordinal() == 0 ? null : values()[ordinal() - 1];
    }

    public boolean precedes(Stage other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Collapse duplicates and sort into pipeline order.
     */
    public static List<Stage> inPipelineOrder(Collection<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            return List.of();
        }
        return List.copyOf(EnumSet.copyOf(stages));
    }

    /**
     * Check that the stages form one unbroken run of the pipeline.
     * Expects stages already in pipeline order.
     */
    public static boolean isContiguous(List<Stage> orderedStages) {
        for (int i = 1; i < orderedStages.size(); i++) {
            if (orderedStages.get(i).previous() != orderedStages.get(i - 1)) {
                return false;
            }
        }
        return true;
    }
}

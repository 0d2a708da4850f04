package org.neuralchilli.pressroom.stage;

import org.neuralchilli.pressroom.domain.ExtractRequest;
import org.neuralchilli.pressroom.domain.ExtractedContent;

/**
 * Fetches a page and pulls out its readable content.
 */
public interface ContentExtractor {

    /**
     * @throws TransientStageException if the page could not be fetched right now
     * @throws PermanentStageException if the page cannot be extracted at all
     */
    ExtractedContent extract(ExtractRequest request);
}

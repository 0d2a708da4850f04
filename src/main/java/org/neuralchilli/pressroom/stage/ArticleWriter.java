package org.neuralchilli.pressroom.stage;

import org.neuralchilli.pressroom.domain.Article;
import org.neuralchilli.pressroom.domain.WritingRequest;

/**
 * Drafts an article from an analysis.
 */
public interface ArticleWriter {

    Article write(WritingRequest request);
}

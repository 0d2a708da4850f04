package org.neuralchilli.pressroom.stage;

import org.neuralchilli.pressroom.domain.AnalysisRequest;
import org.neuralchilli.pressroom.domain.ContentAnalysis;

/**
 * Summarises extracted content into key points, themes and structure.
 */
public interface ContentAnalyzer {

    ContentAnalysis analyze(AnalysisRequest request);
}

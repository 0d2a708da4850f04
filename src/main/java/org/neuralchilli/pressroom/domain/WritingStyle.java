package org.neuralchilli.pressroom.domain;

/**
 * Tone the writer should adopt for the generated article.
 */
public enum WritingStyle {
    PROFESSIONAL,
    CASUAL,
    NEWS
}

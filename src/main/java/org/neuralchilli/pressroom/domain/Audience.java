package org.neuralchilli.pressroom.domain;

/**
 * Readership the generated article targets.
 */
public enum Audience {
    GENERAL,
    TECHNICAL,
    BUSINESS
}

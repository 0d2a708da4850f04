package org.neuralchilli.pressroom.domain;

/**
 * Typed input handed to a stage's collaborator.
 */
public sealed interface StageInput
        permits ExtractRequest, AnalysisRequest, WritingRequest, PublishRequest {

    Stage stage();
}

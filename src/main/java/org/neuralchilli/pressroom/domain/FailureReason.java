package org.neuralchilli.pressroom.domain;

/**
 * Why a stage ended a task in FAILED.
 */
public enum FailureReason {
    /**
     * Transient failures on every attempt of the retry budget
     */
    STAGE_EXHAUSTED,

    /**
     * The collaborator rejected the input; retrying cannot help
     */
    STAGE_PERMANENT_FAILURE
}

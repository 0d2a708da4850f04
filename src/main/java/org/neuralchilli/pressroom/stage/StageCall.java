package org.neuralchilli.pressroom.stage;

import org.neuralchilli.pressroom.domain.StageInput;
import org.neuralchilli.pressroom.domain.StageOutput;

/**
 * One invocation of a stage collaborator.
 */
@FunctionalInterface
public interface StageCall<I extends StageInput, O extends StageOutput> {

    O invoke(I input);
}

package org.neuralchilli.pressroom.stage;

import org.neuralchilli.pressroom.domain.FailureReason;
import org.neuralchilli.pressroom.domain.StageOutput;

/**
 * Outcome of running a stage with retries. The runner never throws; every
 * outcome is one of these values.
 */
public sealed interface StageResult {

    /**
     * Check if the stage produced an output
     */
    boolean isSuccess();

    /**
     * Attempts made, including the last one
     */
    int attempts();

    /**
     * Stage produced its output
     */
    record Success(StageOutput output, int attempts) implements StageResult {
        public Success {
            if (output == null) {
                throw new IllegalArgumentException("Output cannot be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Stage failed permanently or ran out of attempts
     */
    record Failure(FailureReason reason, String message, int attempts) implements StageResult {
        public Failure {
            if (reason == null) {
                throw new IllegalArgumentException("Failure reason cannot be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static StageResult success(StageOutput output, int attempts) {
        return new Success(output, attempts);
    }

    static StageResult exhausted(String message, int attempts) {
        return new Failure(FailureReason.STAGE_EXHAUSTED, message, attempts);
    }

    static StageResult permanent(String message, int attempts) {
        return new Failure(FailureReason.STAGE_PERMANENT_FAILURE, message, attempts);
    }
}

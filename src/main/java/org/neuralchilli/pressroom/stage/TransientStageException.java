package org.neuralchilli.pressroom.stage;

/**
 * A failure worth retrying: network errors, rate limits, upstream 5xx.
 */
public class TransientStageException extends StageException {

    public TransientStageException(String message) {
        super(message);
    }

    public TransientStageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}

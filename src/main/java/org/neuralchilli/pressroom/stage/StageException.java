package org.neuralchilli.pressroom.stage;

/**
 * Failure signalled by a stage collaborator.
 */
public abstract class StageException extends RuntimeException {

    protected StageException(String message) {
        super(message);
    }

    protected StageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether another attempt may succeed
     */
    public abstract boolean isTransient();
}

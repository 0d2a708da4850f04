package org.neuralchilli.pressroom.stage;

/**
 * A failure that retrying cannot fix: malformed input, rejected credentials,
 * unparseable pages.
 */
public class PermanentStageException extends StageException {

    public PermanentStageException(String message) {
        super(message);
    }

    public PermanentStageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}

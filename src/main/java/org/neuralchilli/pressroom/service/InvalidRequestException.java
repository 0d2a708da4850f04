package org.neuralchilli.pressroom.service;

import java.util.List;

/**
 * Exception thrown when a submission fails validation. Carries every
 * problem found, not just the first.
 */
public class InvalidRequestException extends RuntimeException {

    private final List<String> errors;

    public InvalidRequestException(List<String> errors) {
        super("Invalid pipeline request:\n" + String.join("\n", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}

package org.neuralchilli.workflowdag.service;

import java.util.List;

/**
 * Thrown when a graph breaks one or more structural rules.
 * Carries every problem found, not just the first.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(String message, List<String> errors) {
        super(message + ":\n" + String.join("\n", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}

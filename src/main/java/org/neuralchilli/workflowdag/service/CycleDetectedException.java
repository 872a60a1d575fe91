package org.neuralchilli.workflowdag.service;

/**
 * Thrown when an operation that needs a topological order meets a cycle.
 * The plain sort reports cycles through its result instead; this is for
 * callers that opted into failing fast.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}

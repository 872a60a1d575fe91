package org.neuralchilli.workflowdag.export;

/**
 * Base class for failures while exporting a graph diagram.
 */
public class DiagramExportException extends RuntimeException {

    public DiagramExportException(String message) {
        super(message);
    }

    public DiagramExportException(String message, Throwable cause) {
        super(message, cause);
    }
}

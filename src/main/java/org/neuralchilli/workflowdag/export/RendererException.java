package org.neuralchilli.workflowdag.export;

import java.util.OptionalInt;

/**
 * Thrown when the external renderer is missing, fails or times out.
 */
public class RendererException extends DiagramExportException {

    private final Integer exitCode;

    public RendererException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    public RendererException(String message) {
        super(message);
        this.exitCode = null;
    }

    public RendererException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    /**
     * Exit code of the renderer, empty when it never ran to completion
     */
    public OptionalInt exitCode() {
        return exitCode != null ? OptionalInt.of(exitCode) : OptionalInt.empty();
    }
}

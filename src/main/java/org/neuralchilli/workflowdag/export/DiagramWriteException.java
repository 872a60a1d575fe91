package org.neuralchilli.workflowdag.export;

import java.nio.file.Path;

/**
 * Thrown when the DOT description cannot be created or written.
 */
public class DiagramWriteException extends DiagramExportException {

    private final Path file;

    public DiagramWriteException(Path file, Throwable cause) {
        super("Failed to write diagram file " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}

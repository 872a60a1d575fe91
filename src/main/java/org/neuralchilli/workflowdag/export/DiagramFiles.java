package org.neuralchilli.workflowdag.export;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Files produced by one diagram export.
 *
 * @param dotFile   the written DOT description
 * @param imageFile the rendered image, empty when rendering is disabled
 */
public record DiagramFiles(Path dotFile, Optional<Path> imageFile) {

    public DiagramFiles {
        if (dotFile == null) {
            throw new IllegalArgumentException("DOT file cannot be null");
        }
        if (imageFile == null) {
            imageFile = Optional.empty();
        }
    }

    public boolean isRendered() {
        return imageFile.isPresent();
    }
}

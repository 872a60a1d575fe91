package org.neuralchilli.workflowdag.export;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.workflowdag.config.WorkflowDagConfig;
import org.neuralchilli.workflowdag.core.Digraph;
import org.neuralchilli.workflowdag.domain.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Writes graphs as DOT files and hands them to the renderer.
 * Accepts any {@link Digraph}; how the graph was produced does not matter.
 */
@ApplicationScoped
public class DiagramExportService {

    private static final Logger log = LoggerFactory.getLogger(DiagramExportService.class);

    @Inject
    GraphvizRenderer renderer;

    @Inject
    WorkflowDagConfig config;

    /**
     * Export a graph to {@code <baseName>.dot} and, when enabled, render it.
     *
     * @param baseName path of the output files without extension
     * @throws DiagramWriteException if the DOT file cannot be written
     * @throws RendererException     if rendering fails
     */
    public <N extends Node> DiagramFiles export(Digraph<N> graph, Path baseName) {
        return export(graph, baseName, List.of());
    }

    /**
     * Like {@link #export(Digraph, Path)}, placing each rank group on the same rank.
     */
    public <N extends Node> DiagramFiles export(
            Digraph<N> graph,
            Path baseName,
            List<? extends Collection<N>> ranks
    ) {
        Path dotFile = sibling(baseName, ".dot");
        writeDot(dotFile, DotWriter.toDot(graph, ranks));

        if (!config.render().enabled()) {
            log.info("Saved DAG as {}", dotFile);
            return new DiagramFiles(dotFile, Optional.empty());
        }

        Path imageFile = sibling(baseName, "." + config.render().format());
        renderer.render(dotFile, imageFile);

        log.info("Saved DAG as {} and {}", dotFile, imageFile);
        return new DiagramFiles(dotFile, Optional.of(imageFile));
    }

    private void writeDot(Path dotFile, String dot) {
        try {
            Path parent = dotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(dotFile, dot, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DiagramWriteException(dotFile, e);
        }
    }

    private static Path sibling(Path baseName, String extension) {
        return baseName.resolveSibling(baseName.getFileName() + extension);
    }
}

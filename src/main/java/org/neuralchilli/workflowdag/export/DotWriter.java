package org.neuralchilli.workflowdag.export;

import org.neuralchilli.workflowdag.core.Digraph;
import org.neuralchilli.workflowdag.domain.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Renders a graph as a Graphviz DOT description.
 * <p>
 * Nodes are numbered by their position in {@link Digraph#allNodes()} and
 * labelled with {@link Node#label()}. Optional rank groups ask the renderer
 * to place their nodes side by side, one group per execution layer.
 */
public final class DotWriter {

    private static final Logger log = LoggerFactory.getLogger(DotWriter.class);

    private DotWriter() {
    }

    public static <N extends Node> String toDot(Digraph<N> graph) {
        return toDot(graph, List.of());
    }

    public static <N extends Node> String toDot(Digraph<N> graph, List<? extends Collection<N>> ranks) {
        List<N> nodes = graph.allNodes();
        Map<UUID, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i).id(), i);
        }

        StringBuilder dot = new StringBuilder();
        dot.append("digraph G {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, style=rounded, fontsize=12];\n");

        for (int i = 0; i < nodes.size(); i++) {
            dot.append("  ").append(i)
                    .append(" [label=\"").append(escape(nodes.get(i).label())).append("\"];\n");
        }

        for (int layer = 0; layer < ranks.size(); layer++) {
            dot.append("  { rank=same; // layer ").append(layer).append('\n');
            for (N node : ranks.get(layer)) {
                Integer j = index.get(node.id());
                if (j != null) {
                    dot.append("    ").append(j).append(";\n");
                }
            }
            dot.append("  }\n");
        }

        for (int i = 0; i < nodes.size(); i++) {
            for (N successor : graph.adjacencyFrom(nodes.get(i))) {
                Integer j = index.get(successor.id());
                if (j == null) {
                    log.warn("Skipping edge {} -> {}: target is not in the graph",
                            nodes.get(i).label(), successor.label());
                    continue;
                }
                dot.append("  ").append(i).append(" -> ").append(j).append(";\n");
            }
        }

        dot.append("}\n");
        return dot.toString();
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}

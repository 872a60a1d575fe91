package org.neuralchilli.workflowdag.core;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedPseudograph;
import org.neuralchilli.workflowdag.domain.Node;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Copies workflow graphs into JGraphT so its algorithms can be run against them.
 */
public final class JGraphTAdapter {

    private JGraphTAdapter() {
    }

    /**
     * Copy a graph into a JGraphT pseudograph.
     * Duplicate edges and self-loops survive the copy; successors that were
     * never added as nodes become vertices of their own. A node added twice
     * contributes its edges once.
     */
    public static <N extends Node> Graph<N, DefaultEdge> toJGraphT(Digraph<N> graph) {
        Graph<N, DefaultEdge> copy = new DirectedPseudograph<>(DefaultEdge.class);

        for (N node : graph.allNodes()) {
            copy.addVertex(node);
        }
        Set<UUID> copied = new HashSet<>();
        for (N from : graph.allNodes()) {
            if (!copied.add(from.id())) {
                continue;
            }
            for (N to : graph.adjacencyFrom(from)) {
                copy.addVertex(to);
                copy.addEdge(from, to);
            }
        }
        return copy;
    }
}

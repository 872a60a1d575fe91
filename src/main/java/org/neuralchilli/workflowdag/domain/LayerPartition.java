package org.neuralchilli.workflowdag.domain;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Execution layers of a graph together with whether they cover every node.
 * Nodes within one layer have no ordering dependency on each other.
 */
public record LayerPartition<N extends Node>(
        List<List<N>> layers,
        int totalNodes
) {
    public LayerPartition {
        if (layers == null) {
            throw new IllegalArgumentException("Layers cannot be null");
        }
        if (totalNodes < 0) {
            throw new IllegalArgumentException("Total nodes cannot be negative");
        }
        layers = layers.stream().map(List::copyOf).toList();
    }

    /**
     * Number of nodes placed in some layer
     */
    public int placedNodes() {
        return layers.stream().mapToInt(List::size).sum();
    }

    /**
     * True when every node of the graph landed in a layer, i.e. the graph is acyclic
     */
    public boolean isComplete() {
        return placedNodes() == totalNodes;
    }

    public int depth() {
        return layers.size();
    }

    /**
     * Size of the widest layer
     */
    public int maxWidth() {
        return layers.stream().mapToInt(List::size).max().orElse(0);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("LayerPartition[layers=%d, placed=%d/%d]",
                layers.size(), placedNodes(), totalNodes);
    }
}

package org.neuralchilli.workflowdag.domain;

import javax.annotation.Nonnull;

/**
 * Shape of a workflow graph as seen by Kahn layering: counts of nodes, edges,
 * roots and leaves, how many layers the nodes peel into and how many nodes
 * the widest layer holds.
 */
public record DagStatistics(
        int totalNodes,
        int totalEdges,
        int rootNodes,
        int leafNodes,
        int executionLayers,
        int maxParallelism
) {
    public DagStatistics {
        if (totalNodes < 0) {
            throw new IllegalArgumentException("Total nodes cannot be negative");
        }
        if (totalEdges < 0) {
            throw new IllegalArgumentException("Total edges cannot be negative");
        }
        if (rootNodes < 0) {
            throw new IllegalArgumentException("Root nodes cannot be negative");
        }
        if (leafNodes < 0) {
            throw new IllegalArgumentException("Leaf nodes cannot be negative");
        }
        if (executionLayers < 0) {
            throw new IllegalArgumentException("Execution layers cannot be negative");
        }
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("Max parallelism cannot be negative");
        }
    }

    /**
     * At least one layer holds two or more nodes that may run together
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    /**
     * Non-empty and every layer holds a single node, so the order is forced
     */
    public boolean isLinear() {
        return maxParallelism == 1;
    }

    /**
     * Number of layers, the length of the longest dependency chain
     */
    public int depth() {
        return executionLayers;
    }

    /**
     * Size of the widest layer
     */
    public int width() {
        return maxParallelism;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "DagStatistics[nodes=%d, edges=%d, layers=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalNodes, totalEdges, executionLayers, maxParallelism, rootNodes, leafNodes
        );
    }
}

package org.neuralchilli.workflowdag.domain;

import java.util.List;

/**
 * Scheduling metadata an executor would consume: a serial order and the
 * parallel layers, both expressed with node labels.
 */
public record ExecutionPlan(
        int nodeCount,
        List<String> order,
        List<List<String>> layers
) {
    public ExecutionPlan {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("Node count cannot be negative");
        }
        order = order != null ? List.copyOf(order) : List.of();
        layers = layers != null ? layers.stream().map(List::copyOf).toList() : List.of();

        if (order.size() != nodeCount) {
            throw new IllegalArgumentException(
                    "Order must contain every node: expected " + nodeCount + ", got " + order.size()
            );
        }
    }

    public static <N extends Node> ExecutionPlan of(List<N> order, List<List<N>> layers) {
        return new ExecutionPlan(
                order.size(),
                order.stream().map(Node::label).toList(),
                layers.stream()
                        .map(layer -> layer.stream().map(Node::label).toList())
                        .toList()
        );
    }

    /**
     * Check if any layer allows more than one node to run at once
     */
    public boolean isParallel() {
        return layers.stream().anyMatch(layer -> layer.size() > 1);
    }
}

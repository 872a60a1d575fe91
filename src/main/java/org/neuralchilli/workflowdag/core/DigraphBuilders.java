package org.neuralchilli.workflowdag.core;

import org.neuralchilli.workflowdag.domain.Node;

import java.util.List;

/**
 * Materialises analysis results as new graphs.
 * Inputs are never mutated; the built graphs share node values only.
 */
public final class DigraphBuilders {

    private DigraphBuilders() {
    }

    /**
     * Build a chain that follows the given order exactly: n0 -> n1 -> ... -> nk.
     * Fed with a topological order of some graph, the chain serialises that
     * graph's partial order into a total one.
     */
    public static <N extends Node> SimpleDigraph<N> linearChain(List<N> order) {
        SimpleDigraph<N> chain = new SimpleDigraph<>();
        for (N node : order) {
            chain.addNode(node);
        }
        for (int i = 0; i + 1 < order.size(); i++) {
            chain.addEdge(order.get(i), order.get(i + 1));
        }
        return chain;
    }

    /**
     * Build a layered DAG where every node of layer i points to every node
     * of layer i+1 (complete bipartite between neighbouring layers).
     * Only layer membership survives; finer edge structure is discarded.
     */
    public static <N extends Node> SimpleDigraph<N> layeredDag(List<? extends List<N>> layers) {
        SimpleDigraph<N> layered = new SimpleDigraph<>();
        for (List<N> layer : layers) {
            for (N node : layer) {
                layered.addNode(node);
            }
        }
        for (int i = 0; i + 1 < layers.size(); i++) {
            for (N from : layers.get(i)) {
                for (N to : layers.get(i + 1)) {
                    layered.addEdge(from, to);
                }
            }
        }
        return layered;
    }
}

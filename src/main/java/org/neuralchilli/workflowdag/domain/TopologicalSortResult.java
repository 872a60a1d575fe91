package org.neuralchilli.workflowdag.domain;

import org.neuralchilli.workflowdag.service.CycleDetectedException;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Outcome of a Kahn topological sort.
 * A cyclic input yields no usable order: callers must check
 * {@link #isAcyclic()} before trusting {@link #order()}.
 */
public final class TopologicalSortResult<N extends Node> {

    private final List<N> order;
    private final boolean acyclic;
    private final int unplacedNodes;

    private TopologicalSortResult(List<N> order, boolean acyclic, int unplacedNodes) {
        this.order = order;
        this.acyclic = acyclic;
        this.unplacedNodes = unplacedNodes;
    }

    public static <N extends Node> TopologicalSortResult<N> sorted(List<N> order) {
        return new TopologicalSortResult<>(List.copyOf(order), true, 0);
    }

    /**
     * The partial order is discarded; only the number of nodes that could
     * not be peeled is kept for diagnostics.
     */
    public static <N extends Node> TopologicalSortResult<N> cyclic(int unplacedNodes) {
        if (unplacedNodes <= 0) {
            throw new IllegalArgumentException("A cyclic result must leave at least one node unplaced");
        }
        return new TopologicalSortResult<>(List.of(), false, unplacedNodes);
    }

    public boolean isAcyclic() {
        return acyclic;
    }

    /**
     * Topological order, or an empty list when the graph has a cycle.
     */
    public List<N> order() {
        return order;
    }

    /**
     * Number of nodes left behind by the peeling (0 for a DAG).
     */
    public int unplacedNodes() {
        return unplacedNodes;
    }

    /**
     * Get the order, failing loudly on a cyclic graph.
     */
    public List<N> orderOrThrow() {
        if (!acyclic) {
            throw new CycleDetectedException(
                    "Graph contains a cycle: " + unplacedNodes + " node(s) could not be ordered"
            );
        }
        return order;
    }

    @Nonnull
    @Override
    public String toString() {
        if (!acyclic) {
            return "TopologicalSortResult[cyclic, unplaced=" + unplacedNodes + "]";
        }
        return "TopologicalSortResult[" + order + "]";
    }
}

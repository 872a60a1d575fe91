package org.neuralchilli.workflowdag.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.workflowdag.domain.DagStatistics;
import org.neuralchilli.workflowdag.domain.ExecutionPlan;
import org.neuralchilli.workflowdag.domain.LayerPartition;
import org.neuralchilli.workflowdag.domain.Node;
import org.neuralchilli.workflowdag.domain.TopologicalSortResult;
import org.neuralchilli.workflowdag.service.CycleDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;

/**
 * Kahn's algorithm based analyses of workflow graphs.
 * <p>
 * Works only through the {@link Digraph} contract and never mutates the
 * graph: in-degree bookkeeping is private to each call. Ties are broken by
 * node insertion order for the initial frontier and by successor-list order
 * afterwards, so results are deterministic.
 */
@ApplicationScoped
public class DagAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(DagAnalysisService.class);

    /**
     * Topological sort using a FIFO frontier.
     *
     * @return the order, or the cyclic outcome (no usable order) when some node
     *         can never reach in-degree zero
     */
    public <N extends Node> TopologicalSortResult<N> topologicalSort(Digraph<N> graph) {
        Map<UUID, Integer> inDegree = inDegrees(graph);

        Queue<N> frontier = new ArrayDeque<>(zeroInDegree(graph, inDegree));
        List<N> order = new ArrayList<>(graph.nodeCount());

        while (!frontier.isEmpty()) {
            N node = frontier.poll();
            order.add(node);
            for (N successor : graph.adjacencyFrom(node)) {
                if (decrement(inDegree, successor) == 0) {
                    frontier.add(successor);
                }
            }
        }

        if (order.size() < graph.nodeCount()) {
            int unplaced = graph.nodeCount() - order.size();
            log.debug("Topological sort found a cycle: {} of {} nodes unplaced",
                    unplaced, graph.nodeCount());
            return TopologicalSortResult.cyclic(unplaced);
        }

        log.debug("Topological sort ordered {} nodes", order.size());
        return TopologicalSortResult.sorted(order);
    }

    /**
     * Topological order of a graph that must be acyclic.
     *
     * @throws CycleDetectedException if the graph has a cycle
     */
    public <N extends Node> List<N> requireTopologicalOrder(Digraph<N> graph) {
        return topologicalSort(graph).orderOrThrow();
    }

    /**
     * Partition the graph into execution layers by peeling the whole
     * zero in-degree frontier at once.
     * <p>
     * Cycles are not reported: nodes on or behind a cycle are simply left
     * out. Use {@link #layerPartition(Digraph)} or
     * {@link #topologicalSort(Digraph)} when completeness matters.
     */
    public <N extends Node> List<List<N>> computeLayers(Digraph<N> graph) {
        Map<UUID, Integer> inDegree = inDegrees(graph);

        List<List<N>> layers = new ArrayList<>();
        List<N> frontier = zeroInDegree(graph, inDegree);

        while (!frontier.isEmpty()) {
            layers.add(frontier);
            List<N> next = new ArrayList<>();
            for (N node : frontier) {
                for (N successor : graph.adjacencyFrom(node)) {
                    if (decrement(inDegree, successor) == 0) {
                        next.add(successor);
                    }
                }
            }
            frontier = next;
        }

        log.debug("Graph has {} execution layers", layers.size());
        return layers;
    }

    /**
     * Execution layers together with a completeness flag that is false on
     * cyclic input.
     */
    public <N extends Node> LayerPartition<N> layerPartition(Digraph<N> graph) {
        LayerPartition<N> partition = new LayerPartition<>(computeLayers(graph), graph.nodeCount());
        if (!partition.isComplete()) {
            log.warn("Layering left {} of {} nodes unplaced - graph contains a cycle",
                    partition.totalNodes() - partition.placedNodes(), partition.totalNodes());
        }
        return partition;
    }

    /**
     * Nodes without incoming edges, in insertion order.
     */
    public <N extends Node> List<N> roots(Digraph<N> graph) {
        return zeroInDegree(graph, inDegrees(graph));
    }

    /**
     * Nodes without outgoing edges, in insertion order.
     */
    public <N extends Node> List<N> leaves(Digraph<N> graph) {
        return graph.allNodes().stream()
                .filter(node -> graph.adjacencyFrom(node).isEmpty())
                .toList();
    }

    /**
     * Get statistics about the graph.
     */
    public <N extends Node> DagStatistics statistics(Digraph<N> graph) {
        LayerPartition<N> partition = layerPartition(graph);

        return new DagStatistics(
                graph.nodeCount(),
                graph.edgeCount(),
                roots(graph).size(),
                leaves(graph).size(),
                partition.depth(),
                partition.maxWidth()
        );
    }

    /**
     * Build the scheduling metadata of an acyclic graph.
     *
     * @throws CycleDetectedException if the graph has a cycle
     */
    public <N extends Node> ExecutionPlan plan(Digraph<N> graph) {
        List<N> order = requireTopologicalOrder(graph);
        return ExecutionPlan.of(order, computeLayers(graph));
    }

    private <N extends Node> Map<UUID, Integer> inDegrees(Digraph<N> graph) {
        Map<UUID, Integer> inDegree = new HashMap<>();
        for (N node : graph.allNodes()) {
            inDegree.put(node.id(), 0);
        }
        for (N node : graph.allNodes()) {
            for (N successor : graph.adjacencyFrom(node)) {
                inDegree.merge(successor.id(), 1, Integer::sum);
            }
        }
        return inDegree;
    }

    private <N extends Node> List<N> zeroInDegree(Digraph<N> graph, Map<UUID, Integer> inDegree) {
        List<N> zero = new ArrayList<>();
        for (N node : graph.allNodes()) {
            if (inDegree.get(node.id()) == 0) {
                zero.add(node);
            }
        }
        return zero;
    }

    private int decrement(Map<UUID, Integer> inDegree, Node node) {
        return inDegree.merge(node.id(), -1, Integer::sum);
    }
}

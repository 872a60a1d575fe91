package org.neuralchilli.workflowdag.core;

import org.neuralchilli.workflowdag.domain.Node;
import org.neuralchilli.workflowdag.domain.SimpleNode;
import org.neuralchilli.workflowdag.service.NodeNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * List-backed {@link Digraph} with successor lists keyed by node identity.
 * Node lookups are linear scans; graphs are expected to stay at
 * workflow-authoring scale.
 */
public class SimpleDigraph<N extends Node> implements Digraph<N> {

    private final List<N> nodes = new ArrayList<>();
    private final Map<UUID, List<N>> adjacency = new LinkedHashMap<>();
    // Read-only wrappers of the lists above, same keys in the same order
    private final Map<UUID, List<N>> successorViews = new LinkedHashMap<>();

    /**
     * Create a graph holding {@code size} fresh, unconnected nodes.
     */
    public static SimpleDigraph<SimpleNode> withSize(int size) {
        SimpleDigraph<SimpleNode> graph = new SimpleDigraph<>();
        for (int i = 0; i < size; i++) {
            graph.addNode(SimpleNode.create());
        }
        return graph;
    }

    @Override
    public void addNode(N node) {
        nodes.add(node);
        putSuccessors(node.id(), new ArrayList<>());
    }

    @Override
    public N getNode(UUID id) {
        return findNode(id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    @Override
    public Optional<N> findNode(UUID id) {
        for (N node : nodes) {
            if (node.id().equals(id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public List<N> allNodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public void addEdge(N from, N to) {
        List<N> successors = adjacency.get(from.id());
        if (successors == null) {
            successors = putSuccessors(from.id(), new ArrayList<>());
        }
        successors.add(to);
    }

    @Override
    public void removeEdge(N from, N to) {
        List<N> successors = adjacency.get(from.id());
        if (successors != null) {
            successors.removeIf(successor -> successor.id().equals(to.id()));
        }
    }

    @Override
    public boolean hasEdge(N from, N to) {
        List<N> successors = adjacency.getOrDefault(from.id(), List.of());
        for (N successor : successors) {
            if (successor.id().equals(to.id())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Map<UUID, List<N>> adjacency() {
        return Collections.unmodifiableMap(successorViews);
    }

    @Override
    public List<N> adjacencyFrom(N node) {
        return successorViews.getOrDefault(node.id(), List.of());
    }

    private List<N> putSuccessors(UUID id, List<N> successors) {
        adjacency.put(id, successors);
        successorViews.put(id, Collections.unmodifiableList(successors));
        return successors;
    }

    @Override
    public boolean isDirected() {
        return true;
    }

    @Override
    public String toString() {
        return "SimpleDigraph[nodes=" + nodeCount() + ", edges=" + edgeCount() + "]";
    }
}

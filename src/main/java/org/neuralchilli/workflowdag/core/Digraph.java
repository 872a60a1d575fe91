package org.neuralchilli.workflowdag.core;

import org.neuralchilli.workflowdag.domain.Node;
import org.neuralchilli.workflowdag.service.NodeNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Directed graph over workflow nodes.
 * <p>
 * Nodes keep their insertion order and every added node owns a successor
 * list, also in insertion order. Those orders drive tie-breaking in the
 * topological analyses, so implementations must preserve them.
 * <p>
 * Preconditions are the caller's responsibility: adding a node twice,
 * linking to a node that was never added or creating a cycle are not
 * checked here.
 */
public interface Digraph<N extends Node> {

    // Node operations

    /**
     * Append a node and give it an empty successor list.
     */
    void addNode(N node);

    /**
     * Find a node by identity.
     *
     * @throws NodeNotFoundException if no node has this identity
     */
    N getNode(UUID id);

    /**
     * Find a node by identity, empty if absent.
     */
    Optional<N> findNode(UUID id);

    int nodeCount();

    /**
     * Live read-only view of the nodes in insertion order.
     */
    List<N> allNodes();

    // Edge operations

    /**
     * Append {@code to} to the successors of {@code from}. Duplicates are kept.
     */
    void addEdge(N from, N to);

    /**
     * Remove every occurrence of {@code to} from the successors of {@code from}.
     */
    void removeEdge(N from, N to);

    boolean hasEdge(N from, N to);

    /**
     * Number of successor entries over all nodes, duplicates included.
     */
    default int edgeCount() {
        return allNodes().stream()
                .mapToInt(node -> adjacencyFrom(node).size())
                .sum();
    }

    // Adjacency access

    /**
     * Read-only live view of the successor lists keyed by node identity.
     */
    Map<UUID, List<N>> adjacency();

    /**
     * Successors of a node, empty for a node this graph does not know.
     */
    List<N> adjacencyFrom(N node);

    // Graph properties

    boolean isDirected();
}

package org.neuralchilli.workflowdag.domain;

import java.util.UUID;

/**
 * A vertex of a workflow graph.
 * Graphs and analyses only rely on the identity and the display label,
 * so richer node types (tasks carrying actions) plug in without changes.
 */
public interface Node {

    /**
     * Number of characters of the identity shown as the label.
     */
    int LABEL_LENGTH = 8;

    /**
     * Globally unique, immutable identity of this node.
     */
    UUID id();

    /**
     * Short display label derived from the identity.
     * Purely cosmetic: not guaranteed collision-free across large graphs.
     */
    default String label() {
        return id().toString().substring(0, LABEL_LENGTH);
    }
}

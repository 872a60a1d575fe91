package org.neuralchilli.workflowdag.service;

import java.util.UUID;

/**
 * Thrown when a node identity is looked up in a graph that does not contain it.
 */
public class NodeNotFoundException extends RuntimeException {

    private final UUID nodeId;

    public NodeNotFoundException(UUID nodeId) {
        super("Could not find node " + nodeId + " in graph");
        this.nodeId = nodeId;
    }

    public UUID nodeId() {
        return nodeId;
    }
}

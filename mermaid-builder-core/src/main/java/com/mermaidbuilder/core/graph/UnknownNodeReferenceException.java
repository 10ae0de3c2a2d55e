package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.NodeId;

import java.util.Objects;

/**
 * Thrown when an edge refers to a node identifier the target graph never issued.
 */
public class UnknownNodeReferenceException extends DiagramValidationException {

    private final NodeId nodeId;

    /**
     * @param nodeId the unknown identifier
     */
    public UnknownNodeReferenceException(NodeId nodeId) {
        super("Unknown node reference: " + Objects.requireNonNull(nodeId, "nodeId must not be null"));
        this.nodeId = nodeId;
    }

    /**
     * @return the unknown identifier
     */
    public NodeId getNodeId() {
        return nodeId;
    }
}

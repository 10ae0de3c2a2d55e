package com.mermaidbuilder.core.model;

/**
 * Finalized, immutable description of a diagram edge.
 *
 * <p>The relationship semantics (arrow heads, cardinalities) live on the dialect-specific
 * records; this interface exposes what the graph needs to enforce referential integrity.
 */
public interface EdgeDescriptor {

    /**
     * @return node the edge starts from
     */
    NodeId source();

    /**
     * @return node the edge points to
     */
    NodeId destination();

    /**
     * @return edge label, or {@code null} when none was set
     */
    String label();
}

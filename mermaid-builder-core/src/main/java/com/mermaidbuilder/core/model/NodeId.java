package com.mermaidbuilder.core.model;

/**
 * Opaque handle identifying a node within one diagram.
 *
 * <p>Identifiers are dense and zero-based: the first node appended to a graph receives
 * {@code 0}, the next {@code 1}, and so on. They are diagram-local, so two diagrams may
 * both contain a node {@code v0}.
 *
 * <p>Only the graph that issued an identifier accepts it as an edge endpoint. Comparing
 * two identifiers with {@link #equals(Object)} compares their numeric value only.
 *
 * @param value zero-based position of the node in insertion order
 */
public record NodeId(int value) {

    /**
     * Compact constructor with validation.
     */
    public NodeId {
        if (value < 0) {
            throw new IllegalArgumentException("value must not be negative: " + value);
        }
    }

    /**
     * Returns the identifier as it appears in Mermaid text, e.g. {@code v3}.
     *
     * @return textual node identifier
     */
    public String mermaidId() {
        return "v" + value;
    }

    @Override
    public String toString() {
        return mermaidId();
    }
}

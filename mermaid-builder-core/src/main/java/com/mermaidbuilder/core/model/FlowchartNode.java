package com.mermaidbuilder.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Node of a flowchart.
 *
 * <p>A node with subnodes is a subgraph: it is rendered as a {@code subgraph ... end}
 * block around its subnodes and its shape is not used. Subnodes are identifiers of nodes
 * appended earlier to the same graph.
 *
 * @param id allocated node identifier
 * @param label node label
 * @param shape shape category
 * @param subnodes members of the subgraph in insertion order, empty for a plain node
 * @param subgraphDirection optional direction inside the subgraph, {@code null} when unset
 * @param clickEvent optional navigation on click, {@code null} when unset
 */
public record FlowchartNode(
    NodeId id,
    String label,
    FlowchartNodeShape shape,
    List<NodeId> subnodes,
    Direction subgraphDirection,
    ClickEvent clickEvent
) implements NodeDescriptor {
    /**
     * Compact constructor with validation.
     */
    public FlowchartNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        subnodes = subnodes == null ? List.of() : List.copyOf(subnodes);
        if (subnodes.isEmpty() && subgraphDirection != null) {
            throw new IllegalArgumentException("Subgraph direction requires at least one subnode");
        }
        if (!subnodes.isEmpty() && clickEvent != null) {
            throw new IllegalArgumentException("Click events are not supported on subgraphs");
        }
        if (subnodes.stream().distinct().count() != subnodes.size()) {
            throw new IllegalArgumentException("Subnodes must be distinct: " + subnodes);
        }
    }

    /**
     * Creates a plain node without subnodes or click event.
     *
     * @param id allocated node identifier
     * @param label node label
     * @param shape shape category
     */
    public FlowchartNode(NodeId id, String label, FlowchartNodeShape shape) {
        this(id, label, shape, List.of(), null, null);
    }

    /**
     * @return true if this node groups other nodes
     */
    public boolean isSubgraph() {
        return !subnodes.isEmpty();
    }
}

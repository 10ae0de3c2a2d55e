package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.NodeDescriptor;
import com.mermaidbuilder.core.model.NodeId;

import java.util.List;

/**
 * Accumulates the attributes of one node before it is admitted to a {@link GraphBuilder}.
 *
 * <p>The graph calls {@link #validate()} first and only allocates an identifier when it
 * passes, so a rejected node never consumes an identifier.
 *
 * @param <N> descriptor type produced by this builder
 */
public interface NodeBuilder<N extends NodeDescriptor> {

    /**
     * Checks that every required attribute is present.
     *
     * <p>Must reject every condition {@link #build(NodeId)} would reject.
     *
     * @throws MissingFieldException if a required attribute was never set
     * @throws IllegalArgumentException if the attributes contradict each other
     */
    void validate();

    /**
     * Identifiers of existing nodes this node refers to, such as the members of a subgraph.
     * The graph checks them before allocating an identifier.
     *
     * @return referenced node identifiers, empty by default
     */
    default List<NodeId> referencedNodes() {
        return List.of();
    }

    /**
     * Freezes the accumulated attributes into a descriptor.
     *
     * @param id identifier allocated by the owning graph
     * @return immutable node descriptor
     * @throws MissingFieldException if a required attribute was never set
     */
    N build(NodeId id);
}

package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.EdgeDescriptor;

/**
 * Accumulates the endpoints and relationship semantics of one edge.
 *
 * <p>Building validates the edge in isolation; the {@link GraphBuilder} it is appended to
 * then checks that both endpoints belong to it.
 *
 * @param <E> descriptor type produced by this builder
 */
public interface EdgeBuilder<E extends EdgeDescriptor> {

    /**
     * Freezes the accumulated attributes into a descriptor.
     *
     * @return immutable edge descriptor
     * @throws MissingFieldException if the source, destination or relationship was never set
     */
    E build();
}

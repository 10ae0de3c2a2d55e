package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.EdgeDescriptor;
import com.mermaidbuilder.core.model.NodeDescriptor;
import com.mermaidbuilder.core.model.NodeId;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a {@link GraphBuilder}, ready to be rendered.
 *
 * <p>Diagrams can only be obtained from {@link GraphBuilder#build()}, which guarantees that
 * node identifiers form the range {@code 0..N-1} in list order and that every edge endpoint
 * lies in that range. Instances are safe to share between threads.
 *
 * @param <N> node descriptor type of the dialect
 * @param <E> edge descriptor type of the dialect
 */
public final class Diagram<N extends NodeDescriptor, E extends EdgeDescriptor> {

    private final DiagramType type;
    private final DiagramConfiguration configuration;
    private final List<N> nodes;
    private final List<E> edges;

    Diagram(DiagramType type, DiagramConfiguration configuration, List<N> nodes, List<E> edges) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    /**
     * @return dialect this diagram is rendered to
     */
    public DiagramType type() {
        return type;
    }

    /**
     * @return document-level configuration
     */
    public DiagramConfiguration configuration() {
        return configuration;
    }

    /**
     * @return nodes in insertion order (unmodifiable)
     */
    public List<N> nodes() {
        return nodes;
    }

    /**
     * @return edges in insertion order (unmodifiable)
     */
    public List<E> edges() {
        return edges;
    }

    /**
     * Looks up a node by identifier.
     *
     * @param id node identifier
     * @return the node, or empty if the identifier is out of range
     */
    public Optional<N> node(NodeId id) {
        Objects.requireNonNull(id, "id must not be null");
        return id.value() < nodes.size() ? Optional.of(nodes.get(id.value())) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagram<?, ?> other)) {
            return false;
        }
        return type == other.type
            && configuration.equals(other.configuration)
            && nodes.equals(other.nodes)
            && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, configuration, nodes, edges);
    }

    @Override
    public String toString() {
        return "Diagram[type=" + type + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}

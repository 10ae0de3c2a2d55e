package com.mermaidbuilder.core.graph;

import com.mermaidbuilder.core.model.ClassEdge;
import com.mermaidbuilder.core.model.ClassNode;
import com.mermaidbuilder.core.model.DiagramConfiguration;
import com.mermaidbuilder.core.model.DiagramType;
import com.mermaidbuilder.core.model.EdgeDescriptor;
import com.mermaidbuilder.core.model.ErEdge;
import com.mermaidbuilder.core.model.ErNode;
import com.mermaidbuilder.core.model.FlowchartEdge;
import com.mermaidbuilder.core.model.FlowchartNode;
import com.mermaidbuilder.core.model.NodeDescriptor;
import com.mermaidbuilder.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Append-only graph of validated nodes and edges for one diagram.
 *
 * <p>The builder owns an {@link IdAllocator} and the ordered node and edge lists. Insertion
 * order is render order; there is no way to remove or reorder entries. Every append is
 * validated immediately and a rejected node or edge leaves the builder untouched.
 *
 * <p>Edge endpoints must be identifiers returned by {@link #addNode(NodeBuilder)} on this
 * very builder. Identifiers issued by another builder, or created with
 * {@code new NodeId(n)}, are rejected with {@link UnknownNodeReferenceException} even when
 * their value is in range.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GraphBuilder<FlowchartNode, FlowchartEdge> graph = GraphBuilder.flowchart();
 * NodeId start = graph.addNode(new FlowchartNodeBuilder().setLabel("Start"));
 * NodeId end = graph.addNode(new FlowchartNodeBuilder().setLabel("End"));
 * graph.addEdge(new FlowchartEdgeBuilder()
 *     .setSource(start)
 *     .setDestination(end)
 *     .setArrowShape(FlowchartArrowShape.NORMAL));
 *
 * Diagram<FlowchartNode, FlowchartEdge> diagram = graph.build();
 * String text = DiagramRenderers.render(diagram);
 * }</pre>
 *
 * <p>Not thread-safe: confine a builder to one thread and share the resulting
 * {@link Diagram} instead.
 *
 * @param <N> node descriptor type of the dialect
 * @param <E> edge descriptor type of the dialect
 */
public final class GraphBuilder<N extends NodeDescriptor, E extends EdgeDescriptor> {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final DiagramType type;
    private final IdAllocator allocator = new IdAllocator();
    private final List<N> nodes = new ArrayList<>();
    private final List<E> edges = new ArrayList<>();
    private final Set<NodeId> issued = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<NodeId> nested = Collections.newSetFromMap(new IdentityHashMap<>());
    private DiagramConfiguration configuration = DiagramConfiguration.defaults();
    private boolean built;

    /**
     * Creates an empty graph for the given dialect. Only the dialect factories call this,
     * which keeps the descriptor types and the {@link DiagramType} in agreement.
     *
     * @param type dialect of the diagram
     */
    private GraphBuilder(DiagramType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public static GraphBuilder<FlowchartNode, FlowchartEdge> flowchart() {
        return new GraphBuilder<>(DiagramType.FLOWCHART);
    }

    public static GraphBuilder<ClassNode, ClassEdge> classDiagram() {
        return new GraphBuilder<>(DiagramType.CLASS_DIAGRAM);
    }

    public static GraphBuilder<ErNode, ErEdge> entityRelationship() {
        return new GraphBuilder<>(DiagramType.ENTITY_RELATIONSHIP);
    }

    /**
     * Replaces the document-level configuration.
     *
     * @param configuration new configuration
     * @return this builder
     */
    public GraphBuilder<N, E> configure(DiagramConfiguration configuration) {
        ensureOpen();
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
        return this;
    }

    /**
     * Validates a node, allocates its identifier and appends it.
     *
     * @param builder node builder holding the attributes
     * @return identifier of the appended node
     * @throws MissingFieldException if a required attribute is missing; no identifier is consumed
     * @throws UnknownNodeReferenceException if a referenced node was not issued by this builder
     * @throws IllegalArgumentException if the attributes contradict each other, or a referenced
     *         node already belongs to another subgraph
     */
    public NodeId addNode(NodeBuilder<? extends N> builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        ensureOpen();

        try {
            builder.validate();
        } catch (MissingFieldException | IllegalArgumentException e) {
            log.warn("Rejected {} node: {}", type, e.getMessage());
            throw e;
        }
        List<NodeId> references = builder.referencedNodes();
        for (NodeId reference : references) {
            requireIssued(reference, "node");
            if (nested.contains(reference)) {
                log.warn("Rejected {} node: {} already belongs to a subgraph", type, reference);
                throw new IllegalArgumentException("Node " + reference + " already belongs to a subgraph");
            }
        }
        NodeId id = allocator.next();
        N node = builder.build(id);
        if (node.id() != id) {
            throw new IllegalStateException("Node builder must use the allocated identifier " + id);
        }

        nodes.add(node);
        issued.add(id);
        nested.addAll(references);
        log.debug("Appended {} node {} ({})", type, id, node.label());
        return id;
    }

    /**
     * Validates an edge and appends it.
     *
     * @param builder edge builder holding the endpoints and relationship
     * @throws MissingFieldException if the source, destination or relationship is missing
     * @throws UnknownNodeReferenceException if an endpoint was not issued by this builder
     */
    public void addEdge(EdgeBuilder<? extends E> builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        ensureOpen();

        E edge;
        try {
            edge = builder.build();
        } catch (MissingFieldException e) {
            log.warn("Rejected {} edge: {}", type, e.getMessage());
            throw e;
        }
        requireIssued(edge.source(), "edge");
        requireIssued(edge.destination(), "edge");

        edges.add(edge);
        log.debug("Appended {} edge {} -> {}", type, edge.source(), edge.destination());
    }

    /**
     * Finalizes the graph into an immutable {@link Diagram}.
     *
     * <p>Cannot fail on content: every invariant was enforced at append time. The builder
     * accepts no further changes afterwards.
     *
     * @return immutable diagram
     * @throws IllegalStateException if the graph was already built
     */
    public Diagram<N, E> build() {
        ensureOpen();
        built = true;
        log.debug("Built {} diagram with {} nodes and {} edges", type, nodes.size(), edges.size());
        return new Diagram<>(type, configuration, nodes, edges);
    }

    public DiagramType type() {
        return type;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    private void requireIssued(NodeId id, String referrer) {
        if (!issued.contains(id)) {
            log.warn("Rejected {} {} referencing unknown node {}", type, referrer, id);
            throw new UnknownNodeReferenceException(id);
        }
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Graph has already been built");
        }
    }
}

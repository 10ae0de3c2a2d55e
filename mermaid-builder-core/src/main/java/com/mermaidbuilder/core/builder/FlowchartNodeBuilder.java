package com.mermaidbuilder.core.builder;

import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.graph.NodeBuilder;
import com.mermaidbuilder.core.model.ClickEvent;
import com.mermaidbuilder.core.model.Direction;
import com.mermaidbuilder.core.model.FlowchartNode;
import com.mermaidbuilder.core.model.FlowchartNodeShape;
import com.mermaidbuilder.core.model.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builder for {@link FlowchartNode}. The shape defaults to {@link FlowchartNodeShape#RECTANGLE}.
 *
 * <p>Adding subnodes turns the node into a subgraph:
 *
 * <pre>{@code
 * NodeId pay = graph.addNode(new FlowchartNodeBuilder().setLabel("Pay"));
 * NodeId ship = graph.addNode(new FlowchartNodeBuilder().setLabel("Ship"));
 * graph.addNode(new FlowchartNodeBuilder()
 *     .setLabel("Fulfilment")
 *     .addSubnode(pay)
 *     .addSubnode(ship)
 *     .setDirection(Direction.TOP_TO_BOTTOM));
 * }</pre>
 */
public final class FlowchartNodeBuilder implements NodeBuilder<FlowchartNode> {

    private String label;
    private FlowchartNodeShape shape = FlowchartNodeShape.RECTANGLE;
    private final List<NodeId> subnodes = new ArrayList<>();
    private Direction direction;
    private ClickEvent clickEvent;

    public FlowchartNodeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    public FlowchartNodeBuilder setShape(FlowchartNodeShape shape) {
        this.shape = Objects.requireNonNull(shape, "shape must not be null");
        return this;
    }

    /**
     * Adds an already appended node to this subgraph.
     *
     * @param subnode identifier returned by the owning graph
     * @return this builder
     * @throws IllegalArgumentException if the subnode was already added
     */
    public FlowchartNodeBuilder addSubnode(NodeId subnode) {
        Objects.requireNonNull(subnode, "subnode must not be null");
        if (subnodes.contains(subnode)) {
            throw new IllegalArgumentException("Duplicate subnode: " + subnode);
        }
        subnodes.add(subnode);
        return this;
    }

    /**
     * Sets the direction inside the subgraph. Only valid once subnodes were added.
     *
     * @param direction subgraph direction, or {@code null} to inherit the diagram's
     * @return this builder
     */
    public FlowchartNodeBuilder setDirection(Direction direction) {
        this.direction = direction;
        return this;
    }

    public FlowchartNodeBuilder setClickEvent(ClickEvent clickEvent) {
        this.clickEvent = clickEvent;
        return this;
    }

    @Override
    public void validate() {
        if (label == null || label.isEmpty()) {
            throw new MissingFieldException("label");
        }
        if (subnodes.isEmpty() && direction != null) {
            throw new IllegalArgumentException("Subgraph direction requires at least one subnode");
        }
        if (!subnodes.isEmpty() && clickEvent != null) {
            throw new IllegalArgumentException("Click events are not supported on subgraphs");
        }
    }

    @Override
    public List<NodeId> referencedNodes() {
        return List.copyOf(subnodes);
    }

    @Override
    public FlowchartNode build(NodeId id) {
        validate();
        return new FlowchartNode(id, label, shape, subnodes, direction, clickEvent);
    }
}

package com.mermaidbuilder.core.builder;

import com.mermaidbuilder.core.graph.EdgeBuilder;
import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.model.FlowchartArrowShape;
import com.mermaidbuilder.core.model.FlowchartEdge;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.NodeId;

import java.util.Objects;

/**
 * Builder for {@link FlowchartEdge}.
 *
 * <p>The right arrow shape is the relationship and must be set explicitly. The left head
 * defaults to {@link FlowchartArrowShape#NONE}, the line to {@link LineStyle#SOLID} and the
 * length to {@code 1}.
 */
public final class FlowchartEdgeBuilder implements EdgeBuilder<FlowchartEdge> {

    private NodeId source;
    private NodeId destination;
    private FlowchartArrowShape arrowShape;
    private FlowchartArrowShape leftArrowShape = FlowchartArrowShape.NONE;
    private LineStyle lineStyle = LineStyle.SOLID;
    private int length = 1;
    private String label;

    public FlowchartEdgeBuilder setSource(NodeId source) {
        this.source = source;
        return this;
    }

    public FlowchartEdgeBuilder setDestination(NodeId destination) {
        this.destination = destination;
        return this;
    }

    public FlowchartEdgeBuilder setArrowShape(FlowchartArrowShape arrowShape) {
        this.arrowShape = arrowShape;
        return this;
    }

    public FlowchartEdgeBuilder setLeftArrowShape(FlowchartArrowShape leftArrowShape) {
        this.leftArrowShape = Objects.requireNonNull(leftArrowShape, "leftArrowShape must not be null");
        return this;
    }

    public FlowchartEdgeBuilder setLineStyle(LineStyle lineStyle) {
        this.lineStyle = Objects.requireNonNull(lineStyle, "lineStyle must not be null");
        return this;
    }

    /**
     * Sets the extra link length. Mermaid draws longer links with more dashes.
     *
     * @param length at least 1
     * @return this builder
     */
    public FlowchartEdgeBuilder setLength(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be at least 1: " + length);
        }
        this.length = length;
        return this;
    }

    public FlowchartEdgeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    @Override
    public FlowchartEdge build() {
        if (source == null) {
            throw new MissingFieldException("source");
        }
        if (destination == null) {
            throw new MissingFieldException("destination");
        }
        if (arrowShape == null) {
            throw new MissingFieldException("relationship");
        }
        return new FlowchartEdge(source, destination, arrowShape, leftArrowShape, lineStyle, length, label);
    }
}

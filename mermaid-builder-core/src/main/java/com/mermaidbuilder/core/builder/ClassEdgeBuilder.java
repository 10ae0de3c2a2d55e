package com.mermaidbuilder.core.builder;

import com.mermaidbuilder.core.graph.EdgeBuilder;
import com.mermaidbuilder.core.graph.MissingFieldException;
import com.mermaidbuilder.core.model.ClassArrowShape;
import com.mermaidbuilder.core.model.ClassEdge;
import com.mermaidbuilder.core.model.LineStyle;
import com.mermaidbuilder.core.model.Multiplicity;
import com.mermaidbuilder.core.model.NodeId;

import java.util.Objects;

/**
 * Builder for {@link ClassEdge}.
 *
 * <p>The right arrow shape is the relationship and must be set explicitly, e.g.
 * {@link ClassArrowShape#TRIANGLE} for inheritance. Multiplicities are optional.
 */
public final class ClassEdgeBuilder implements EdgeBuilder<ClassEdge> {

    private NodeId source;
    private NodeId destination;
    private ClassArrowShape arrowShape;
    private ClassArrowShape leftArrowShape = ClassArrowShape.NONE;
    private LineStyle lineStyle = LineStyle.SOLID;
    private Multiplicity leftMultiplicity;
    private Multiplicity rightMultiplicity;
    private String label;

    public ClassEdgeBuilder setSource(NodeId source) {
        this.source = source;
        return this;
    }

    public ClassEdgeBuilder setDestination(NodeId destination) {
        this.destination = destination;
        return this;
    }

    public ClassEdgeBuilder setArrowShape(ClassArrowShape arrowShape) {
        this.arrowShape = arrowShape;
        return this;
    }

    public ClassEdgeBuilder setLeftArrowShape(ClassArrowShape leftArrowShape) {
        this.leftArrowShape = Objects.requireNonNull(leftArrowShape, "leftArrowShape must not be null");
        return this;
    }

    /**
     * @param lineStyle {@link LineStyle#SOLID} or {@link LineStyle#DASHED}
     * @return this builder
     * @throws IllegalArgumentException for {@link LineStyle#THICK}
     */
    public ClassEdgeBuilder setLineStyle(LineStyle lineStyle) {
        Objects.requireNonNull(lineStyle, "lineStyle must not be null");
        if (lineStyle == LineStyle.THICK) {
            throw new IllegalArgumentException("Class diagram edges support SOLID or DASHED line styles only");
        }
        this.lineStyle = lineStyle;
        return this;
    }

    public ClassEdgeBuilder setLeftMultiplicity(Multiplicity leftMultiplicity) {
        this.leftMultiplicity = leftMultiplicity;
        return this;
    }

    public ClassEdgeBuilder setRightMultiplicity(Multiplicity rightMultiplicity) {
        this.rightMultiplicity = rightMultiplicity;
        return this;
    }

    public ClassEdgeBuilder setLabel(String label) {
        this.label = label;
        return this;
    }

    @Override
    public ClassEdge build() {
        if (source == null) {
            throw new MissingFieldException("source");
        }
        if (destination == null) {
            throw new MissingFieldException("destination");
        }
        if (arrowShape == null) {
            throw new MissingFieldException("relationship");
        }
        return new ClassEdge(source, destination, arrowShape, leftArrowShape, lineStyle,
            leftMultiplicity, rightMultiplicity, label);
    }
}

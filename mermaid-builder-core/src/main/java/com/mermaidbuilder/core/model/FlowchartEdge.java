package com.mermaidbuilder.core.model;

import java.util.Objects;

/**
 * Edge of a flowchart.
 *
 * @param source source node
 * @param destination destination node
 * @param arrowShape head drawn at the destination end
 * @param leftArrowShape head drawn at the source end ({@link FlowchartArrowShape#NONE} for none)
 * @param lineStyle stroke of the link
 * @param length extra link length, at least 1
 * @param label optional label, {@code null} when unset
 */
public record FlowchartEdge(
    NodeId source,
    NodeId destination,
    FlowchartArrowShape arrowShape,
    FlowchartArrowShape leftArrowShape,
    LineStyle lineStyle,
    int length,
    String label
) implements EdgeDescriptor {
    /**
     * Compact constructor with validation.
     */
    public FlowchartEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(arrowShape, "arrowShape must not be null");
        Objects.requireNonNull(leftArrowShape, "leftArrowShape must not be null");
        Objects.requireNonNull(lineStyle, "lineStyle must not be null");
        if (length < 1) {
            throw new IllegalArgumentException("length must be at least 1: " + length);
        }
    }
}

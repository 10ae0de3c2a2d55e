package com.mermaidbuilder.core.model;

import java.util.Objects;

/**
 * Relationship between two classes.
 *
 * @param source source class
 * @param destination destination class
 * @param arrowShape marker at the destination end
 * @param leftArrowShape marker at the source end ({@link ClassArrowShape#NONE} for none)
 * @param lineStyle {@link LineStyle#SOLID} or {@link LineStyle#DASHED}
 * @param leftMultiplicity optional multiplicity at the source end
 * @param rightMultiplicity optional multiplicity at the destination end
 * @param label optional label, {@code null} when unset
 */
public record ClassEdge(
    NodeId source,
    NodeId destination,
    ClassArrowShape arrowShape,
    ClassArrowShape leftArrowShape,
    LineStyle lineStyle,
    Multiplicity leftMultiplicity,
    Multiplicity rightMultiplicity,
    String label
) implements EdgeDescriptor {
    /**
     * Compact constructor with validation.
     */
    public ClassEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(arrowShape, "arrowShape must not be null");
        Objects.requireNonNull(leftArrowShape, "leftArrowShape must not be null");
        Objects.requireNonNull(lineStyle, "lineStyle must not be null");
        if (lineStyle == LineStyle.THICK) {
            throw new IllegalArgumentException("Class diagram edges support SOLID or DASHED line styles only");
        }
    }
}

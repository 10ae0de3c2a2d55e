package com.mermaidbuilder.core.model;

import java.util.Objects;

/**
 * Relationship between two entities.
 *
 * @param source source entity
 * @param destination destination entity
 * @param leftCardinality cardinality at the source end
 * @param rightCardinality cardinality at the destination end
 * @param identifying solid line when true, dashed otherwise
 * @param label optional label, {@code null} when unset
 */
public record ErEdge(
    NodeId source,
    NodeId destination,
    Cardinality leftCardinality,
    Cardinality rightCardinality,
    boolean identifying,
    String label
) implements EdgeDescriptor {
    /**
     * Compact constructor with validation.
     */
    public ErEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(leftCardinality, "leftCardinality must not be null");
        Objects.requireNonNull(rightCardinality, "rightCardinality must not be null");
    }
}

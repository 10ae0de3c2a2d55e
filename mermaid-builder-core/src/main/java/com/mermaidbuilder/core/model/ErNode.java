package com.mermaidbuilder.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Entity of an entity-relationship diagram.
 *
 * @param id allocated node identifier
 * @param label entity name
 * @param attributes attributes in insertion order
 */
public record ErNode(
    NodeId id,
    String label,
    List<ErAttribute> attributes
) implements NodeDescriptor {
    /**
     * Compact constructor with validation.
     */
    public ErNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}

package com.mermaidbuilder.core.model;

import java.util.Objects;

/**
 * Typed attribute of an entity.
 *
 * <p>Rendered as {@code type name} on its own line, so neither part may contain whitespace.
 *
 * @param type attribute type, e.g. {@code string}
 * @param name attribute name
 */
public record ErAttribute(String type, String name) {
    /**
     * Compact constructor with validation.
     */
    public ErAttribute {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (type.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("type and name must not be blank");
        }
        requireSingleToken("type", type);
        requireSingleToken("name", name);
    }

    private static void requireSingleToken(String field, String value) {
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(
                "Attribute " + field + " must not contain whitespace: '" + value + "'");
        }
    }
}

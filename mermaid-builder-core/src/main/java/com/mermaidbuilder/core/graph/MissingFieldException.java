package com.mermaidbuilder.core.graph;

import java.util.Objects;

/**
 * Thrown when a node or edge is finalized before a required attribute was set.
 */
public class MissingFieldException extends DiagramValidationException {

    private final String field;

    /**
     * @param field name of the missing attribute, e.g. {@code label}
     */
    public MissingFieldException(String field) {
        super("Missing required field: " + Objects.requireNonNull(field, "field must not be null"));
        this.field = field;
    }

    /**
     * @return name of the missing attribute
     */
    public String getField() {
        return field;
    }
}

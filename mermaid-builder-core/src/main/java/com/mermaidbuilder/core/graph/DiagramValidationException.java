package com.mermaidbuilder.core.graph;

/**
 * Base class for errors raised while a diagram is being constructed.
 *
 * <p>Validation errors surface at the offending call and leave the graph unchanged.
 */
public class DiagramValidationException extends RuntimeException {

    protected DiagramValidationException(String message) {
        super(message);
    }
}

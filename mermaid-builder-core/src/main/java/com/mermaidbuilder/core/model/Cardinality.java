package com.mermaidbuilder.core.model;

/**
 * Crow's-foot cardinalities for entity-relationship edges.
 */
public enum Cardinality {
    /** Exactly one */
    EXACTLY_ONE,

    /** Zero or one */
    ZERO_OR_ONE,

    /** One or more */
    ONE_OR_MORE,

    /** Zero or more */
    ZERO_OR_MORE
}

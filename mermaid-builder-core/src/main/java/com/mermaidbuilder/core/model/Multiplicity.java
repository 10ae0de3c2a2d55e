package com.mermaidbuilder.core.model;

/**
 * Multiplicity labels that can be attached to either end of a class relationship.
 */
public enum Multiplicity {
    /** {@code 1} */
    ONE,

    /** {@code 0..1} */
    ZERO_OR_ONE,

    /** {@code 1..*} */
    ONE_OR_MORE,

    /** {@code *} */
    MANY,

    /** {@code n} */
    N,

    /** {@code 0..n} */
    ZERO_TO_N,

    /** {@code 1..n} */
    ONE_TO_N
}

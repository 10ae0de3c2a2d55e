package com.mermaidbuilder.core.model;

/**
 * Relationship markers available on class diagram edges.
 */
public enum ClassArrowShape {
    /** Hollow triangle: inheritance, or realization on a dashed line */
    TRIANGLE,

    /** Open arrow: association, or dependency on a dashed line */
    NORMAL,

    /** Filled diamond: composition */
    STAR,

    /** Hollow diamond: aggregation */
    CIRCLE,

    /** Plain link without a marker */
    NONE
}

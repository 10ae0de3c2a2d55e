package com.mermaidbuilder.core.model;

/**
 * Stroke used for the segment between two arrow heads.
 */
public enum LineStyle {
    /** Plain solid line */
    SOLID,

    /** Thick line (flowcharts only) */
    THICK,

    /** Dotted or dashed line */
    DASHED
}

package com.mermaidbuilder.core.model;

/**
 * Shape categories for flowchart nodes, as supported by the Mermaid
 * {@code v<n>@{shape: ...}} syntax.
 *
 * <p>{@link #RECTANGLE} is the default category.
 */
public enum FlowchartNodeShape {
    // Process steps
    RECTANGLE,
    ROUNDED,
    STADIUM,
    SUBPROCESS,
    DIVIDED_RECTANGLE,
    LINED_RECTANGLE,
    STACKED_RECTANGLE,
    TAGGED_RECTANGLE,
    FRAMED_RECTANGLE,
    NOTCHED_RECTANGLE,
    SLOPED_RECTANGLE,
    BOW_TIE_RECTANGLE,
    WINDOW_PANE,
    FORK,
    DELAY,

    // Storage
    CYLINDER,
    HORIZONTAL_CYLINDER,
    LINED_CYLINDER,

    // Circles
    CIRCLE,
    DOUBLE_CIRCLE,
    SMALL_CIRCLE,
    FRAMED_CIRCLE,
    FILLED_CIRCLE,
    CROSSED_CIRCLE,

    // Decisions and data
    DIAMOND,
    HEXAGON,
    ODD,
    LEAN_RIGHT,
    LEAN_LEFT,
    TRAPEZOID,
    INVERTED_TRAPEZOID,
    CURVED_TRAPEZOID,
    TRIANGLE,
    FLIPPED_TRIANGLE,
    HOURGLASS,
    NOTCHED_PENTAGON,
    FLAG,
    LIGHTNING_BOLT,

    // Documents
    DOCUMENT,
    LINED_DOCUMENT,
    STACKED_DOCUMENT,
    TAGGED_DOCUMENT,

    // Annotations
    LEFT_BRACE,
    RIGHT_BRACE,
    BRACES,
    TEXT
}

package com.mermaidbuilder.core.model;

/**
 * Overall drawing style of a diagram.
 */
public enum Look {
    /** Traditional Mermaid style */
    CLASSIC,

    /** Modern style */
    NEO,

    /** Sketch-like style */
    HAND_DRAWN
}

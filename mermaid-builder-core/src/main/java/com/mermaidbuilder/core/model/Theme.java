package com.mermaidbuilder.core.model;

/**
 * Mermaid color themes.
 */
public enum Theme {
    MERMAID_CHART,
    NEO,
    NEO_DARK,
    DEFAULT,
    FOREST,
    BASE,
    DARK,
    NEUTRAL,
    REDUX,
    REDUX_DARK
}

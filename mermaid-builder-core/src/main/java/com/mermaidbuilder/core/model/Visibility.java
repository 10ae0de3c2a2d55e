package com.mermaidbuilder.core.model;

/**
 * Visibility modifiers for class members.
 */
public enum Visibility {
    /** {@code +} */
    PUBLIC,

    /** {@code -} */
    PRIVATE,

    /** {@code #} */
    PROTECTED,

    /** {@code ~} */
    PACKAGE;

    /**
     * @return the member prefix Mermaid uses for this visibility
     */
    public String symbol() {
        return switch (this) {
            case PUBLIC -> "+";
            case PRIVATE -> "-";
            case PROTECTED -> "#";
            case PACKAGE -> "~";
        };
    }
}

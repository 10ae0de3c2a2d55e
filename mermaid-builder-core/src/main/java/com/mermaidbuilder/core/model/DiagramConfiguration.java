package com.mermaidbuilder.core.model;

/**
 * Document-level settings emitted in a diagram's front matter and header line.
 *
 * <p>Null components fall back to the Mermaid defaults, so a partially filled
 * configuration (for example one read from YAML) is always complete.
 *
 * @param title optional diagram title
 * @param direction direction of the diagram
 * @param layout layout engine
 * @param theme color theme
 * @param look drawing style
 * @param hideEmptyMembersBox class diagrams only: ask Mermaid to hide empty member boxes
 */
public record DiagramConfiguration(
    String title,
    Direction direction,
    LayoutEngine layout,
    Theme theme,
    Look look,
    boolean hideEmptyMembersBox
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramConfiguration {
        if (title != null && title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (direction == null) {
            direction = Direction.LEFT_TO_RIGHT;
        }
        if (layout == null) {
            layout = LayoutEngine.DAGRE;
        }
        if (theme == null) {
            theme = Theme.DEFAULT;
        }
        if (look == null) {
            look = Look.CLASSIC;
        }
    }

    /**
     * Creates the default configuration: no title, left to right, dagre, default theme,
     * classic look, empty member boxes shown.
     *
     * @return default configuration
     */
    public static DiagramConfiguration defaults() {
        return new DiagramConfiguration(null, null, null, null, null, false);
    }

    /**
     * @return true if every setting equals {@link #defaults()}
     */
    public boolean isDefault() {
        return equals(defaults());
    }

    public DiagramConfiguration withTitle(String title) {
        return new DiagramConfiguration(title, direction, layout, theme, look, hideEmptyMembersBox);
    }

    public DiagramConfiguration withDirection(Direction direction) {
        return new DiagramConfiguration(title, direction, layout, theme, look, hideEmptyMembersBox);
    }

    public DiagramConfiguration withLayout(LayoutEngine layout) {
        return new DiagramConfiguration(title, direction, layout, theme, look, hideEmptyMembersBox);
    }

    public DiagramConfiguration withTheme(Theme theme) {
        return new DiagramConfiguration(title, direction, layout, theme, look, hideEmptyMembersBox);
    }

    public DiagramConfiguration withLook(Look look) {
        return new DiagramConfiguration(title, direction, layout, theme, look, hideEmptyMembersBox);
    }

    public DiagramConfiguration withHideEmptyMembersBox(boolean hideEmptyMembersBox) {
        return new DiagramConfiguration(title, direction, layout, theme, look, hideEmptyMembersBox);
    }
}

package com.mermaidbuilder.core.model;

import java.util.Objects;

/**
 * Navigation triggered by clicking a flowchart node.
 *
 * <p>Rendered after the node as
 * {@code click v0 [href] "url" ["tooltip"] [_blank]}.
 *
 * @param url link target
 * @param tooltip optional tooltip, {@code null} when unset
 * @param newTab open the link in a new tab
 * @param anchor use an anchor link ({@code href}) instead of a script call
 */
public record ClickEvent(
    String url,
    String tooltip,
    boolean newTab,
    boolean anchor
) {
    /**
     * Compact constructor with validation.
     */
    public ClickEvent {
        Objects.requireNonNull(url, "url must not be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (url.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"')) {
            throw new IllegalArgumentException("url must not contain whitespace or quotes: " + url.strip());
        }
    }

    /**
     * Creates a plain navigation to the given URL: no tooltip, same tab, script call.
     *
     * @param url link target
     * @return click event
     */
    public static ClickEvent navigate(String url) {
        return new ClickEvent(url, null, false, false);
    }

    public ClickEvent withTooltip(String tooltip) {
        return new ClickEvent(url, tooltip, newTab, anchor);
    }

    public ClickEvent withNewTab(boolean newTab) {
        return new ClickEvent(url, tooltip, newTab, anchor);
    }

    public ClickEvent withAnchor(boolean anchor) {
        return new ClickEvent(url, tooltip, newTab, anchor);
    }
}

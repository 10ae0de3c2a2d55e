package com.mermaidbuilder.core.model;

/**
 * Layout engine Mermaid uses to place nodes.
 */
public enum LayoutEngine {
    /** Default dagre layout */
    DAGRE,

    /** Eclipse Layout Kernel */
    ELK
}

package com.mermaidbuilder.core.model;

/**
 * Mermaid dialects a diagram can be rendered to.
 */
public enum DiagramType {
    /** Flowchart ({@code flowchart}) */
    FLOWCHART,

    /** Class diagram ({@code classDiagram}) */
    CLASS_DIAGRAM,

    /** Entity-relationship diagram ({@code erDiagram}) */
    ENTITY_RELATIONSHIP
}

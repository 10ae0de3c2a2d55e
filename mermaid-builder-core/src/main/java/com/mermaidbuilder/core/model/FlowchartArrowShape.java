package com.mermaidbuilder.core.model;

/**
 * Arrow heads available on flowchart edges.
 */
public enum FlowchartArrowShape {
    /** Regular arrow head */
    NORMAL,

    /** Circle end */
    CIRCLE,

    /** Cross end */
    CROSS,

    /** Open link without a head */
    NONE
}

package com.mermaidbuilder.core.model;

/**
 * Direction in which a diagram extends.
 */
public enum Direction {
    /** Left to right ({@code LR}) */
    LEFT_TO_RIGHT,

    /** Top to bottom ({@code TB}) */
    TOP_TO_BOTTOM,

    /** Right to left ({@code RL}) */
    RIGHT_TO_LEFT,

    /** Bottom to top ({@code BT}) */
    BOTTOM_TO_TOP;

    /**
     * Swaps the orientation between horizontal and vertical.
     *
     * @return the direction rotated by a quarter turn
     */
    public Direction flip() {
        return switch (this) {
            case LEFT_TO_RIGHT -> TOP_TO_BOTTOM;
            case TOP_TO_BOTTOM -> LEFT_TO_RIGHT;
            case RIGHT_TO_LEFT -> BOTTOM_TO_TOP;
            case BOTTOM_TO_TOP -> RIGHT_TO_LEFT;
        };
    }
}

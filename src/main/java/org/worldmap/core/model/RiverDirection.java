package org.worldmap.core.model;

/**
 * Направления связи между соседними углами. UP = +y (на север).
 * Порядок констант задаёт порядок перебора при равных уклонах.
 */
public enum RiverDirection {
    UP(1, 0, 1),
    DOWN(2, 0, -1),
    LEFT(4, -1, 0),
    RIGHT(8, 1, 0);

    public final int bit;
    public final int dx;
    public final int dy;

    RiverDirection(int bit, int dx, int dy) {
        this.bit = bit;
        this.dx = dx;
        this.dy = dy;
    }

    public RiverDirection opposite() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }

    public boolean isHorizontal() {
        return dx != 0;
    }
}

package org.worldmap.core.topology;

/**
 * Coordinate arithmetic on a rectangular grid whose axes may wrap around.
 * Used for tiles and for river corners alike.
 */
public final class WrapTopology {

    /** Returned by {@link #wrap} for a coordinate that falls off a non-wrapping axis. */
    public static final int NONE = -1;

    private WrapTopology() {}

    public static int wrap(int coord, int length, boolean wrapEnabled) {
        if (coord >= 0 && coord < length) return coord;
        if (!wrapEnabled || length <= 0) return NONE;
        return Math.floorMod(coord, length);
    }

    /** Shortest distance between two coordinates on one axis, in cells. */
    public static int toroidalDelta(int a, int b, int length, boolean wrapEnabled) {
        int d = Math.abs(a - b);
        if (!wrapEnabled) return d;
        return Math.min(d, length - d);
    }

    public static double distanceSquared(int dx, int dy, double scaleX, double scaleY) {
        double kx = dx * scaleX;
        double ky = dy * scaleY;
        return kx * kx + ky * ky;
    }
}

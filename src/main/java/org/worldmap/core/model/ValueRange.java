package org.worldmap.core.model;

/**
 * Closed interval [min, max].
 */
public record ValueRange(double min, double max) {

    public boolean contains(double v) {
        return min <= v && v <= max;
    }

    /**
     * Clamps min into [clampMin, clampMax] and max into [min, clampMax].
     */
    public ValueRange validated(double clampMin, double clampMax) {
        double lo = clamp(min, clampMin, clampMax);
        double hi = clamp(max, lo, clampMax);
        return new ValueRange(lo, hi);
    }

    public boolean spansZero() {
        return min < 0.0 && max > 0.0;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}

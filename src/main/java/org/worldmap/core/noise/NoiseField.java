package org.worldmap.core.noise;

import org.worldmap.core.model.config.MapParameters;

import java.util.Random;

/**
 * Maps tile coordinates into simplex noise space.
 * <p>
 * A non-wrapping axis is a straight line in noise space. A wrapping axis is bent into a
 * circle (two noise coordinates), so the first and last column meet without a seam.
 * Hence 2D noise with no wrap, 3D with one wrapping axis and 4D with both.
 * The longer physical side of the map spans {@code noiseScale} noise units.
 */
public class NoiseField {

    // lattice period of the permutation table
    private static final double OFFSET_RANGE = 256.0;

    private final int width;
    private final int height;
    private final boolean wrapX;
    private final boolean wrapY;

    // noise units along the whole axis
    private final double spanX;
    private final double spanY;

    private final double[] offsets;

    /**
     * Draws one random offset per noise dimension from {@code rng}.
     */
    public NoiseField(MapParameters p, Random rng) {
        this.width = p.width;
        this.height = p.height;
        this.wrapX = p.wrapX;
        this.wrapY = p.wrapY;

        double lengthX = p.width * p.tileScaleX;
        double lengthY = p.height * p.tileScaleY;
        double longest = Math.max(lengthX, lengthY);
        this.spanX = p.noiseScale * lengthX / longest;
        this.spanY = p.noiseScale * lengthY / longest;

        this.offsets = new double[dimensions(wrapX, wrapY)];
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] = rng.nextDouble() * OFFSET_RANGE;
        }
    }

    public static int dimensions(boolean wrapX, boolean wrapY) {
        return 2 + (wrapX ? 1 : 0) + (wrapY ? 1 : 0);
    }

    public int dimensions() {
        return offsets.length;
    }

    /** Raw noise value for a tile, roughly in [0, 1]. */
    public double sample(double x, double y) {
        double[] c = coordinates(x, y);
        return switch (c.length) {
            case 2 -> SimplexNoise.noise2D(c[0], c[1]);
            case 3 -> SimplexNoise.noise3D(c[0], c[1], c[2]);
            default -> SimplexNoise.noise4D(c[0], c[1], c[2], c[3]);
        };
    }

    /** Offset noise-space coordinates of a tile position. */
    double[] coordinates(double x, double y) {
        double[] c = new double[offsets.length];
        int n = 0;
        n = axis(c, n, x, width, spanX, wrapX);
        axis(c, n, y, height, spanY, wrapY);
        for (int i = 0; i < c.length; i++) {
            c[i] += offsets[i];
        }
        return c;
    }

    private static int axis(double[] out, int n, double coord, int cells, double span, boolean wrap) {
        if (!wrap) {
            out[n] = coord / cells * span;
            return n + 1;
        }
        double angle = 2.0 * Math.PI * coord / cells;
        double radius = span / (2.0 * Math.PI);
        out[n] = radius * Math.cos(angle);
        out[n + 1] = radius * Math.sin(angle);
        return n + 2;
    }
}

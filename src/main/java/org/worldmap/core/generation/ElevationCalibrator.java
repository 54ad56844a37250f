package org.worldmap.core.generation;

import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.noise.NoiseField;

import java.util.Arrays;

/**
 * Raw noise to elevation in metres.
 * <p>
 * Sea level sits at the k-th smallest raw value, k = floor(N * oceanFraction), so exactly
 * k tiles end up at or below 0 m. The highest raw value maps to roughly the highest
 * elevation any tile type accepts.
 */
public class ElevationCalibrator {

    static final double FALLBACK_MAX_ELEVATION = 1.0;

    /**
     * @return the ocean tile count the calibration targets
     */
    public int generate(TileGrid grid, MapParameters p, NoiseField field) {
        int n = grid.size();
        double[] raw = new double[n];
        TileLoops.forEachIndex(n, i -> {
            Tile t = grid.get(i);
            raw[i] = field.sample(t.x, t.y);
        });

        int k = oceanTileTarget(n, p.oceanFraction);
        double seaLevel = seaLevelQuantile(raw, k);
        double denom = elevationDenominator(raw, seaLevel);
        double maxElevation = maxElevation(p);

        for (int i = 0; i < n; i++) {
            grid.get(i).elevation = elevation(raw[i], seaLevel, denom, maxElevation);
        }
        return k;
    }

    public static int oceanTileTarget(int tileCount, double oceanFraction) {
        int k = (int) Math.floor(tileCount * oceanFraction);
        // хотя бы один тайл суши
        return Math.max(0, Math.min(k, tileCount - 1));
    }

    /**
     * k-th smallest value (1-based rank), or a value just below the minimum when k = 0.
     */
    public static double seaLevelQuantile(double[] raw, int k) {
        double[] sorted = raw.clone();
        Arrays.sort(sorted);
        if (k <= 0) return Math.nextDown(sorted[0]);
        return sorted[k - 1];
    }

    static double maxElevation(MapParameters p) {
        double max = p.maxTileTypeElevation();
        return max > 0.0 ? max : FALLBACK_MAX_ELEVATION;
    }

    /**
     * Raw distance from sea level that maps to the maximum elevation: 1 - seaLevel, or the
     * actual raw maximum above sea level when the noise went past 1.0.
     */
    static double elevationDenominator(double[] raw, double seaLevel) {
        double denom = 1.0 - seaLevel;
        if (!(denom > 0.0)) {
            double maxRaw = Double.NEGATIVE_INFINITY;
            for (double v : raw) maxRaw = Math.max(maxRaw, v);
            denom = Math.max(Double.MIN_NORMAL, maxRaw - seaLevel);
        }
        return denom;
    }

    /**
     * Elevation in metres, kept finite even for a type bounded only by Double.MAX_VALUE.
     */
    static double elevation(double raw, double seaLevel, double denom, double maxElevation) {
        // сначала доля, потом множитель: maxElevation / denom переполняется
        double e = maxElevation * ((raw - seaLevel) / denom);
        return Math.max(-Double.MAX_VALUE, Math.min(Double.MAX_VALUE, e));
    }
}

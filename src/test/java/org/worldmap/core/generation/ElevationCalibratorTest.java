package org.worldmap.core.generation;

import org.junit.jupiter.api.Test;
import org.worldmap.TestMaps;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.TileType;
import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.model.config.ParameterValidator;
import org.worldmap.core.noise.NoiseField;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ElevationCalibratorTest {

    private static TileGrid calibrate(MapParameters raw, long seed) {
        MapParameters p = ParameterValidator.validate(raw);
        TileGrid grid = TileGrid.create(p);
        new ElevationCalibrator().generate(grid, p, new NoiseField(p, new Random(seed)));
        return grid;
    }

    private static int oceanCount(TileGrid grid) {
        int n = 0;
        for (Tile t : grid.tiles) if (t.isOcean()) n++;
        return n;
    }

    @Test
    void quantileIsKthSmallestValue() {
        double[] raw = {0.3, 0.1, 0.2, 0.4};
        assertEquals(0.2, ElevationCalibrator.seaLevelQuantile(raw, 2));
        assertEquals(0.4, ElevationCalibrator.seaLevelQuantile(raw, 4));
    }

    @Test
    void quantileForNoOceanSitsJustBelowMinimum() {
        double[] raw = {0.3, 0.1, 0.2};
        double q = ElevationCalibrator.seaLevelQuantile(raw, 0);
        assertTrue(q < 0.1);
        assertEquals(Math.nextDown(0.1), q);
    }

    @Test
    void oceanTargetAlwaysLeavesLand() {
        assertEquals(8, ElevationCalibrator.oceanTileTarget(16, 0.5));
        assertEquals(0, ElevationCalibrator.oceanTileTarget(16, 0.0));
        assertEquals(15, ElevationCalibrator.oceanTileTarget(16, 1.0));
    }

    @Test
    void fourByFourWrappedHalfOcean() {
        MapParameters p = TestMaps.params(4, 4);
        p.wrapX = true;
        p.wrapY = false;
        p.oceanFraction = 0.5;
        assertEquals(8, oceanCount(calibrate(p, 11L)));
    }

    @Test
    void oceanCountMatchesFractionExactly() {
        for (double f : new double[]{0.0, 0.3, 0.65, 0.99}) {
            MapParameters p = TestMaps.params(30, 20);
            p.oceanFraction = f;
            TileGrid grid = calibrate(p, 5L);
            assertEquals((int) Math.floor(600 * f), oceanCount(grid), "fraction " + f);
        }
    }

    @Test
    void elevationsAreScaledToHighestTileType() {
        MapParameters p = TestMaps.params(40, 30);
        p.tileTypes = List.of(new TileType("Low").elevation(-100.0, 800.0),
                new TileType("High").elevation(800.0, 4000.0));
        p.oceanFraction = 0.4;
        TileGrid grid = calibrate(p, 21L);

        double max = Double.NEGATIVE_INFINITY;
        for (Tile t : grid.tiles) max = Math.max(max, t.elevation);
        assertTrue(max > 400.0, "max=" + max);
        assertTrue(max < 4000.0 * 1.5, "max=" + max);
    }

    @Test
    void fallsBackToOneMetreWithoutLandTypes() {
        MapParameters p = TestMaps.params(4, 4);
        p.tileTypes = List.of(new TileType("Sea").elevation(-100.0, 0.0));
        assertEquals(1.0, ElevationCalibrator.maxElevation(p));
    }

    @Test
    void denominatorUsesActualMaximumWhenSeaLevelIsAboveOne() {
        double[] raw = {0.5, 1.2, 1.1};
        assertEquals(0.1, ElevationCalibrator.elevationDenominator(raw, 1.1), 1e-12);
        assertEquals(0.5, ElevationCalibrator.elevationDenominator(raw, 0.5), 1e-12);
    }

    @Test
    void unboundedMaximumElevationStaysFinite() {
        double max = Double.MAX_VALUE;
        double q = 0.2;
        double denom = 1.0 - q;
        assertEquals(max, ElevationCalibrator.elevation(1.0, q, denom, max));
        assertEquals(max, ElevationCalibrator.elevation(1.3, q, denom, max));
        assertEquals(-max / 4.0, ElevationCalibrator.elevation(0.0, q, denom, max), max * 1e-12);
        assertEquals(-max, ElevationCalibrator.elevation(-5.0, q, denom, max));
        assertTrue(ElevationCalibrator.elevation(q, q, denom, max) <= 0.0);
        assertTrue(ElevationCalibrator.elevation(Math.nextUp(q), q, denom, max) > 0.0);
    }

    @Test
    void unboundedTileTypeKeepsOceanFractionAndFiniteElevations() {
        MapParameters p = TestMaps.params(16, 8);
        p.tileTypes = List.of(new TileType("Anything")
                .elevation(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)
                .temperature(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)
                .precipitation(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
        TileGrid grid = calibrate(p, 42L);

        for (Tile t : grid.tiles) assertTrue(Double.isFinite(t.elevation), "tile " + t);
        assertEquals((int) Math.floor(128 * 0.65), oceanCount(grid));
    }

    @Test
    void doubledNoiseScaleShortensCorrelationButKeepsOceanFraction() {
        MapParameters coarse = TestMaps.params(64, 64);
        coarse.wrapX = false;
        coarse.noiseScale = 4.0;
        coarse.oceanFraction = 0.5;
        MapParameters fine = TestMaps.params(64, 64);
        fine.wrapX = false;
        fine.noiseScale = 8.0;
        fine.oceanFraction = 0.5;

        TileGrid a = calibrate(coarse, 3L);
        TileGrid b = calibrate(fine, 3L);

        assertEquals(2048, oceanCount(a));
        assertEquals(2048, oceanCount(b));
        assertTrue(lagOneCorrelation(a) > lagOneCorrelation(b));
    }

    private static double lagOneCorrelation(TileGrid grid) {
        double mean = 0.0;
        for (Tile t : grid.tiles) mean += t.elevation;
        mean /= grid.size();

        double var = 0.0;
        for (Tile t : grid.tiles) var += (t.elevation - mean) * (t.elevation - mean);

        double cov = 0.0;
        int pairs = 0;
        for (int y = 0; y < grid.height; y++) {
            for (int x = 0; x + 1 < grid.width; x++) {
                cov += (grid.get(x, y).elevation - mean) * (grid.get(x + 1, y).elevation - mean);
                pairs++;
            }
        }
        return (cov / pairs) / (var / grid.size());
    }
}

package org.worldmap.core.model.config;

import org.junit.jupiter.api.Test;
import org.worldmap.TestMaps;
import org.worldmap.core.generation.ElevationCalibrator;
import org.worldmap.core.model.TileType;
import org.worldmap.core.model.ValueRange;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParameterValidatorTest {

    @Test
    void validateReturnsClampedCopy() {
        MapParameters p = TestMaps.params(0, -3);
        p.oceanFraction = 1.5;
        p.tileScaleX = -10.0;

        MapParameters v = ParameterValidator.validate(p);

        assertNotSame(p, v);
        assertEquals(1, v.width);
        assertEquals(1, v.height);
        assertEquals(0.0, v.oceanFraction);
        assertTrue(v.tileScaleX > 0.0);
        assertEquals(0, p.width);
        assertEquals(1.5, p.oceanFraction);
    }

    @Test
    void oceanFractionLeavesOneLandTile() {
        MapParameters p = TestMaps.params(10, 10);
        p.oceanFraction = 1.0;
        assertEquals(0.99, ParameterValidator.validate(p).oceanFraction, 1e-12);

        p.oceanFraction = -0.2;
        assertEquals(0.0, ParameterValidator.validate(p).oceanFraction);
    }

    @Test
    void fullOceanRequestStillLeavesExactlyOneLandTile() {
        int[][] sizes = {{1, 1}, {7, 3}, {10, 10}, {80, 50}, {333, 7}, {100, 100}};
        for (int[] size : sizes) {
            MapParameters p = TestMaps.params(size[0], size[1]);
            p.oceanFraction = 1.0;
            int n = size[0] * size[1];

            double f = ParameterValidator.validate(p).oceanFraction;

            assertEquals(n - 1, ElevationCalibrator.oceanTileTarget(n, f), size[0] + "x" + size[1]);
        }
    }

    @Test
    void badNoiseScaleFallsBackToDefault() {
        MapParameters p = TestMaps.params(10, 10);
        p.noiseScale = -2.0;
        assertEquals(4.0, ParameterValidator.validate(p).noiseScale);
        p.noiseScale = Double.NaN;
        assertEquals(4.0, ParameterValidator.validate(p).noiseScale);
        p.noiseScale = 7.5;
        assertEquals(7.5, ParameterValidator.validate(p).noiseScale);
    }

    @Test
    void pressureLatitudesAreOrdered() {
        MapParameters p = TestMaps.params(10, 10);
        p.highPressureLatitude = 120.0;
        p.lowPressureLatitude = 20.0;

        MapParameters v = ParameterValidator.validate(p);

        assertEquals(90.0, v.highPressureLatitude);
        assertEquals(90.0, v.lowPressureLatitude);
    }

    @Test
    void climateValuesAreKeptUsable() {
        MapParameters p = TestMaps.params(10, 10);
        p.equatorTemperature = -400.0;
        p.equatorRainfall = -5.0;
        p.midLatitudeRainfallEvenness = -1.0;
        p.rainfallOceanEFoldingDistance = 0.0;
        p.riverSlopeMultiplier = -3.0;

        MapParameters v = ParameterValidator.validate(p);

        assertTrue(v.equatorTemperature > -273.15);
        assertEquals(0.0, v.equatorRainfall);
        assertTrue(v.midLatitudeRainfallEvenness > 0.0);
        assertTrue(v.rainfallOceanEFoldingDistance > 0.0);
        assertEquals(0.0, v.riverSlopeMultiplier);
    }

    @Test
    void saturationConstantMovesOutOfTemperatureRange() {
        MapParameters p = TestMaps.params(10, 10);
        p.equatorTemperature = 30.0;
        p.poleTemperature = -20.0;
        p.saturationPressureConst2 = 10.0;

        assertEquals(Math.nextUp(30.0), ParameterValidator.validate(p).saturationPressureConst2);

        p.saturationPressureConst2 = 237.3;
        assertEquals(237.3, ParameterValidator.validate(p).saturationPressureConst2);
    }

    @Test
    void invertedTypeRangesAreRepaired() {
        MapParameters p = TestMaps.params(10, 10);
        p.tileTypes = new ArrayList<>(List.of(new TileType("Odd").elevation(500.0, 100.0)
                .temperature(-10.0, 10.0).precipitation(0.0, 100.0)));

        MapParameters v = ParameterValidator.validate(p);

        ValueRange r = v.tileTypes.get(0).elevation.get(0);
        assertTrue(r.min() <= r.max());
        assertEquals(500.0, p.tileTypes.get(0).elevation.get(0).min());
        assertNotSame(p.tileTypes.get(0), v.tileTypes.get(0));
    }

    @Test
    void warningsNameTheOffendingField() {
        MapParameters p = TestMaps.params(10, 10);
        p.poleTemperature = 35.0;
        p.equatorTemperature = 5.0;
        p.temperatureLapseRate = -0.01;
        p.rainfallOceanEFoldingDistance = -100.0;
        p.condensationRateMultiplier = -1.0;

        List<String> fields = ParameterValidator.warnings(p).stream().map(ParameterWarning::field).toList();

        assertTrue(fields.contains("poleTemperature"));
        assertTrue(fields.contains("temperatureLapseRate"));
        assertTrue(fields.contains("rainfallOceanEFoldingDistance"));
        assertTrue(fields.contains("condensationRateMultiplier"));
    }

    @Test
    void tileTypeWarnings() {
        MapParameters empty = TestMaps.params(10, 10);
        empty.tileTypes = new ArrayList<>();
        assertTrue(ParameterValidator.warnings(empty).stream().anyMatch(w -> w.field().equals("tileTypes")));

        MapParameters underwater = TestMaps.params(10, 10);
        underwater.tileTypes = new ArrayList<>(List.of(new TileType("Deep").elevation(-5000.0, -10.0)
                .temperature(-300.0, 300.0).precipitation(0.0, 1e9)));
        assertTrue(ParameterValidator.warnings(underwater).stream().anyMatch(w -> w.field().equals("tileTypes")));

        MapParameters spanning = TestMaps.params(10, 10);
        assertTrue(ParameterValidator.warnings(spanning).stream()
                .anyMatch(w -> w.field().equals("tileTypes.Everything")));

        assertTrue(ParameterValidator.warnings(MapPresets.earthLike()).isEmpty());
    }

    @Test
    void nullInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParameterValidator.validate(null));
        MapParameters p = new MapParameters();
        p.tileTypes = null;
        assertThrows(IllegalArgumentException.class, () -> ParameterValidator.warnings(p));
    }
}

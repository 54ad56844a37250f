package org.worldmap.core.model.config;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MapTuningTest {

    @Test
    void appliesKnownKeys() {
        Map<String, String> props = new HashMap<>();
        props.put("map.width", "120");
        props.put("map.wrapY", "TRUE");
        props.put("map.oceanFraction", " 0.4 ");
        props.put("climate.lapseRate", "0.005");
        props.put("rain.oceanEFoldingKm", "900");
        props.put("river.slopeMultiplier", "10");

        MapParameters p = new MapParameters();
        MapTuning.apply(p, props::get);

        assertEquals(120, p.width);
        assertTrue(p.wrapY);
        assertEquals(0.4, p.oceanFraction);
        assertEquals(0.005, p.temperatureLapseRate);
        assertEquals(900.0, p.rainfallOceanEFoldingDistance);
        assertEquals(10.0, p.riverSlopeMultiplier);
        assertEquals(50, p.height);
    }

    @Test
    void brokenValuesKeepCurrentOnes() {
        Map<String, String> props = new HashMap<>();
        props.put("map.width", "wide");
        props.put("map.wrapX", "maybe");
        props.put("map.noiseScale", "");
        props.put("map.seed", "0x12");

        MapParameters p = new MapParameters();
        MapTuning.apply(p, props::get);

        assertEquals(80, p.width);
        assertTrue(p.wrapX);
        assertEquals(4.0, p.noiseScale);
        assertFalse(p.customSeed);
    }

    @Test
    void seedKeyMarksCustomSeed() {
        MapParameters p = new MapParameters();
        MapTuning.apply(p, key -> key.equals("map.seed") ? "-42" : null);

        assertTrue(p.customSeed);
        assertEquals(-42L, p.seed);
    }

    @Test
    void systemPropertiesUsePrefix() {
        String key = MapTuning.SYSTEM_PREFIX + "map.height";
        String old = System.getProperty(key);
        try {
            System.setProperty(key, "33");
            MapParameters p = new MapParameters();
            MapTuning.applySystemOverrides(p);
            assertEquals(33, p.height);
        } finally {
            if (old == null) System.clearProperty(key);
            else System.setProperty(key, old);
        }
    }
}

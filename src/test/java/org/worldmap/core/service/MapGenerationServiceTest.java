package org.worldmap.core.service;

import org.junit.jupiter.api.Test;
import org.worldmap.TestMaps;
import org.worldmap.core.generation.StageProfile;
import org.worldmap.core.io.MapSurfaceSerializer;
import org.worldmap.core.model.RiverCorner;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileType;
import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.model.config.MapPresets;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapGenerationServiceTest {

    private static MapGenerationService service() {
        return new MapGenerationService(TestMaps.quietPipeline(StageProfile.full()));
    }

    @Test
    void sameSeedGivesIdenticalMaps() {
        MapParameters p = TestMaps.params(32, 20);
        MapGenerationResult a = service().generate(p, 1234L);
        MapGenerationResult b = service().generate(p, 1234L);

        for (int i = 0; i < a.grid().size(); i++) {
            Tile ta = a.grid().get(i);
            Tile tb = b.grid().get(i);
            assertEquals(ta.elevation, tb.elevation);
            assertEquals(ta.temperature(), tb.temperature());
            assertEquals(ta.precipitation(), tb.precipitation());
            assertEquals(ta.typeIndex, tb.typeIndex);
        }
        assertEquals(a.rivers().size(), b.rivers().size());
        for (RiverCorner c : a.rivers().corners()) {
            assertEquals(c.connections(), b.rivers().get(c.index).connections());
        }
    }

    @Test
    void differentSeedsGiveDifferentTerrain() {
        MapParameters p = TestMaps.params(32, 20);
        MapGenerationResult a = service().generate(p, 1L);
        MapGenerationResult b = service().generate(p, 2L);

        boolean differs = false;
        for (int i = 0; i < a.grid().size() && !differs; i++) {
            differs = a.grid().get(i).elevation != b.grid().get(i).elevation;
        }
        assertTrue(differs);
    }

    @Test
    void oceanFractionIsHitExactly() {
        MapParameters p = TestMaps.params(40, 25);
        p.oceanFraction = 0.3;
        MapGenerationResult r = service().generate(p, 77L);

        int ocean = 0;
        for (Tile t : r.grid().tiles) {
            if (t.isOcean()) ocean++;
        }
        assertEquals(300, ocean);
        assertEquals(300, r.stats().oceanCount);
    }

    @Test
    void tileValuesStayPhysical() {
        MapGenerationResult r = service().generate(TestMaps.params(30, 30), 5L);
        for (Tile t : r.grid().tiles) {
            assertTrue(Double.isFinite(t.elevation));
            assertTrue(t.temperature() > -273.15);
            assertTrue(t.precipitation() >= 0.0);
        }
    }

    @Test
    void customSeedIsUsedAndReported() {
        MapParameters p = TestMaps.params(16, 10);
        p.seed = 555L;
        p.customSeed = true;

        MapGenerationResult r = service().generate(p);

        assertEquals(555L, r.seed());
        assertEquals(555L, MapGenerationService.resolveSeed(p));
    }

    @Test
    void inputParametersAreNotModified() {
        MapParameters p = TestMaps.params(16, 10);
        p.oceanFraction = 2.0;
        p.lowPressureLatitude = 10.0;

        MapGenerationResult r = service().generate(p, 9L);

        assertEquals(2.0, p.oceanFraction);
        assertEquals(10.0, p.lowPressureLatitude);
        assertNotSame(p, r.parameters());
        assertEquals(1.0 - 1.0 / 160, r.parameters().oceanFraction, 1e-12);
    }

    @Test
    void warningsTravelWithResult() {
        MapParameters p = TestMaps.params(16, 10);
        p.poleTemperature = 40.0;
        p.equatorTemperature = 10.0;

        MapGenerationResult r = service().generate(p, 9L);

        assertTrue(r.warnings().stream().anyMatch(w -> w.field().equals("poleTemperature")));
    }

    @Test
    void presetTypesCoverTheirMaps() {
        MapParameters p = MapPresets.earthLike();
        p.width = 40;
        p.height = 24;
        MapGenerationResult r = service().generate(p, 2024L);

        for (Tile t : r.grid().tiles) {
            TileType type = r.typeOf(t);
            if (type == null) continue;
            assertTrue(type.matches(t));
            assertEquals(t.isOcean(), type.maxElevation() <= 0.0, "type " + type.name + " on " + t);
        }
    }

    @Test
    void unboundedCoveringTypeGeneratesAndTypesEveryTile() throws Exception {
        MapParameters p = TestMaps.params(16, 8);
        p.tileTypes = new ArrayList<>(List.of(new TileType("Anything")
                .elevation(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)
                .temperature(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)
                .precipitation(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY)));

        MapGenerationResult r = service().generate(p, 42L);

        int ocean = 0;
        for (Tile t : r.grid().tiles) {
            assertTrue(Double.isFinite(t.elevation), "tile " + t);
            assertTrue(Double.isFinite(t.temperature()), "tile " + t);
            assertTrue(Double.isFinite(t.precipitation()), "tile " + t);
            assertEquals(0, t.typeIndex);
            if (t.isOcean()) ocean++;
        }
        assertEquals((int) Math.floor(128 * 0.65), ocean);
        assertFalse(MapSurfaceSerializer.toJson(r).isEmpty());
    }

    @Test
    void seaOnlyTypesAreReportedOnce() {
        MapParameters p = TestMaps.params(12, 8);
        p.tileTypes = new ArrayList<>(List.of(new TileType("Sea").elevation(-20000.0, 0.0)
                .temperature(-300.0, 300.0).precipitation(0.0, Double.MAX_VALUE)));

        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            service().generate(p, 6L);
        } finally {
            System.setOut(original);
        }

        long mentions = captured.toString(StandardCharsets.UTF_8).lines()
                .filter(l -> l.contains("No tile type reaches above sea level"))
                .count();
        assertEquals(1, mentions);
    }

    @Test
    void nullParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service().generate(null));
        assertThrows(IllegalArgumentException.class, () -> service().generate(null, 1L));
    }
}

package org.worldmap;

import org.worldmap.core.generation.GenerationPipeline;
import org.worldmap.core.generation.StageListener;
import org.worldmap.core.generation.StageProfile;
import org.worldmap.core.model.TileType;
import org.worldmap.core.model.config.MapParameters;

import java.util.ArrayList;
import java.util.List;

/** Shared fixtures for tests. */
public final class TestMaps {

    private TestMaps() {}

    public static MapParameters params(int width, int height) {
        MapParameters p = new MapParameters();
        p.width = width;
        p.height = height;
        p.tileTypes = new ArrayList<>(List.of(everything()));
        return p;
    }

    /** Matches every tile a run can produce. */
    public static TileType everything() {
        return new TileType("Everything")
                .elevation(-20000.0, 5000.0)
                .temperature(-300.0, 300.0)
                .precipitation(0.0, Double.MAX_VALUE);
    }

    public static GenerationPipeline quietPipeline(StageProfile profile) {
        return new GenerationPipeline(profile, true, silentListener(), false);
    }

    public static StageListener silentListener() {
        return new StageListener() {
            @Override
            public void onStageStart(org.worldmap.core.generation.StageId id, String name) {
            }

            @Override
            public void onStageEnd(org.worldmap.core.generation.StageId id, String name, long elapsedMs) {
            }
        };
    }
}

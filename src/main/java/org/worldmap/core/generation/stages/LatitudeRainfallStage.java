package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.StageId;

public class LatitudeRainfallStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.LATITUDE_RAINFALL;
    }

    @Override
    public String name() {
        return "Latitude rainfall";
    }

    @Override
    public void apply(MapContext ctx) {
        ctx.climate.generateRainfall(ctx.grid);
    }
}

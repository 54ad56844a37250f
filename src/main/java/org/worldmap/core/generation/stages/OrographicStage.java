package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.HydrologyModel;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.StageId;

public class OrographicStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.OROGRAPHIC_RAINFALL;
    }

    @Override
    public String name() {
        return "Orographic rainfall";
    }

    @Override
    public void apply(MapContext ctx) {
        new HydrologyModel(ctx.params, ctx.climate).applyOrographicRainfall(ctx.grid);
    }
}

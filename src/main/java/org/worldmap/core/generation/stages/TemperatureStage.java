package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.StageId;

public class TemperatureStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.TEMPERATURE;
    }

    @Override
    public String name() {
        return "Temperature";
    }

    @Override
    public void apply(MapContext ctx) {
        ctx.climate.generateTemperature(ctx.grid);
    }
}

package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.RiverGenerator;
import org.worldmap.core.generation.StageId;

public class RiverStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.RIVERS;
    }

    @Override
    public String name() {
        return "Rivers";
    }

    @Override
    public void apply(MapContext ctx) {
        new RiverGenerator(ctx.params).generate(ctx.grid, ctx.rivers, ctx.rng);
    }
}

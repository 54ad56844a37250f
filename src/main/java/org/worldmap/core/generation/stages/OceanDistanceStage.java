package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.HydrologyModel;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.StageId;

public class OceanDistanceStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.OCEAN_DISTANCE;
    }

    @Override
    public String name() {
        return "Ocean distance";
    }

    @Override
    public void apply(MapContext ctx) {
        HydrologyModel hydrology = new HydrologyModel(ctx.params, ctx.climate);
        int pops = hydrology.computeNearestOcean(ctx.grid);
        hydrology.attenuateByOceanDistance(ctx.grid);
        System.out.println("Ocean distance: frontier pops=" + pops + " tiles=" + ctx.grid.size());
    }
}

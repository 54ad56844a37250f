package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.ElevationCalibrator;
import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.StageId;
import org.worldmap.core.noise.NoiseField;

public class ElevationStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.ELEVATION;
    }

    @Override
    public String name() {
        return "Elevation";
    }

    @Override
    public void apply(MapContext ctx) {
        // смещения шума первыми берутся из rng
        NoiseField field = new NoiseField(ctx.params, ctx.rng);
        ctx.expectedOceanTiles = new ElevationCalibrator().generate(ctx.grid, ctx.params, field);
    }
}

package org.worldmap.core.generation.stages;

import org.worldmap.core.generation.BiomeClassifier;
import org.worldmap.core.generation.GenerationStage;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.StageId;

public class BiomeStage implements GenerationStage {

    @Override
    public StageId id() {
        return StageId.BIOMES;
    }

    @Override
    public String name() {
        return "Biomes";
    }

    @Override
    public void apply(MapContext ctx) {
        int unmatched = new BiomeClassifier().classify(ctx.grid, ctx.params.tileTypes, ctx.rng);
        if (unmatched > 0) {
            System.out.println("Biomes: " + unmatched + " tiles matched no tile type");
        }
    }
}

package org.worldmap.core.service;

import org.worldmap.core.generation.GenerationPipeline;
import org.worldmap.core.generation.MapContext;
import org.worldmap.core.generation.MapStats;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.model.config.ParameterValidator;
import org.worldmap.core.model.config.ParameterWarning;

import java.util.List;

public class MapGenerationService {

    private final GenerationPipeline pipeline;

    public MapGenerationService() {
        this(new GenerationPipeline());
    }

    public MapGenerationService(GenerationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /** Сид: params.seed при customSeed, иначе System.nanoTime(). */
    public MapGenerationResult generate(MapParameters params) {
        if (params == null) {
            throw new IllegalArgumentException("Map parameters must not be null");
        }
        return generate(params, resolveSeed(params));
    }

    public MapGenerationResult generate(MapParameters params, long seed) {
        List<ParameterWarning> warnings = List.copyOf(ParameterValidator.warnings(params));
        for (ParameterWarning w : warnings) {
            System.out.println("[WARN] " + w);
        }

        // генерация работает только с проверенной копией, исходный объект не трогаем
        MapParameters validated = ParameterValidator.validate(params);
        TileGrid grid = TileGrid.create(validated);

        MapContext ctx = new MapContext(validated, grid, seed);
        System.out.println("Generating map " + grid.width + "x" + grid.height
                + " wrapX=" + grid.wrapX + " wrapY=" + grid.wrapY + " seed=" + seed);
        MapStats stats = pipeline.run(ctx);

        return new MapGenerationResult(validated, grid, ctx.rivers, seed, warnings, stats);
    }

    public static long resolveSeed(MapParameters params) {
        return params.customSeed ? params.seed : System.nanoTime();
    }
}

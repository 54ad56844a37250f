package org.worldmap.core.generation;

import org.worldmap.core.generation.stages.BiomeStage;
import org.worldmap.core.generation.stages.ElevationStage;
import org.worldmap.core.generation.stages.LatitudeRainfallStage;
import org.worldmap.core.generation.stages.OceanDistanceStage;
import org.worldmap.core.generation.stages.OrographicStage;
import org.worldmap.core.generation.stages.RiverStage;
import org.worldmap.core.generation.stages.TemperatureStage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class GenerationPipeline {

    private final List<GenerationStage> stages = new ArrayList<>();
    private final StageProfile profile;
    private final boolean enableValidation;
    private final StageListener listener;
    private final boolean printStats;

    /**
     * Полный конструктор.
     */
    public GenerationPipeline(StageProfile profile,
                              boolean enableValidation,
                              StageListener listener,
                              boolean printStats) {

        this.profile = (profile != null) ? profile : StageProfile.full();
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();
        this.printStats = printStats;

        // Фиксируем порядок стадий
        stages.add(new ElevationStage());
        stages.add(new TemperatureStage());
        stages.add(new LatitudeRainfallStage());
        stages.add(new OceanDistanceStage());
        stages.add(new OrographicStage());
        stages.add(new RiverStage());
        stages.add(new BiomeStage());
    }

    public GenerationPipeline(StageProfile profile) {
        this(profile, true, new ConsoleStageListener(), true);
    }

    /**
     * Удобный конструктор по умолчанию:
     * - все стадии
     * - валидации включены
     * - вывод в консоль
     */
    public GenerationPipeline() {
        this(StageProfile.full());
    }

    public List<GenerationStage> stages() {
        return Collections.unmodifiableList(stages);
    }

    public MapStats run(MapContext ctx) {
        for (GenerationStage stage : stages) {
            if (!profile.isEnabled(stage.id())) {
                System.out.println("[STAGE SKIP]  " + stage.id() + " - " + stage.name());
                continue;
            }

            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                stage.apply(ctx);

                if (enableValidation) {
                    runValidation(stage.id(), ctx);
                }

            } catch (RuntimeException e) {
                throw new RuntimeException("Generation failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }

        MapStats stats = MapStats.compute(ctx.grid, ctx.rivers, ctx.params.tileTypes);
        if (printStats) {
            MapStatsReport.print(stats);
        }
        return stats;
    }

    private void runValidation(StageId id, MapContext ctx) {
        switch (id) {
            case ELEVATION -> Validation.afterElevation(ctx);
            case TEMPERATURE -> Validation.afterTemperature(ctx);
            case LATITUDE_RAINFALL, OROGRAPHIC_RAINFALL -> Validation.afterRainfall(ctx);
            case OCEAN_DISTANCE -> Validation.afterOceanDistance(ctx);
            case RIVERS -> Validation.afterRivers(ctx);
            case BIOMES -> Validation.afterBiomes(ctx);
        }
    }
}

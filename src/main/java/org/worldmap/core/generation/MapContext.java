package org.worldmap.core.generation;

import org.worldmap.core.model.RiverNetwork;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.config.MapParameters;

import java.util.Random;

/**
 * Контекст одной генерации карты (один запуск = один контекст).
 * Здесь лежит всё, чем пользуются стадии, чтобы не таскать много параметров.
 */
public class MapContext {

    /** Уже проверенные параметры (ParameterValidator.validate). */
    public final MapParameters params;

    public final TileGrid grid;

    /** Сид, из которого создан rng. */
    public final long seed;

    /**
     * Единственный RNG на запуск. Порядок потребления фиксирован:
     * смещения шума, затем розыгрыши рек, затем выбор биомов.
     */
    public final Random rng;

    /** Пустая сеть до стадии RIVERS; остаётся пустой, если стадия выключена. */
    public final RiverNetwork rivers;

    public final ClimateModel climate;

    /** Сколько тайлов должно оказаться океаном после ELEVATION. */
    public int expectedOceanTiles = -1;

    public MapContext(MapParameters params, TileGrid grid, long seed) {
        this.params = params;
        this.grid = grid;
        this.seed = seed;
        this.rng = new Random(seed);
        this.rivers = RiverNetwork.forGrid(grid);
        this.climate = new ClimateModel(params);
    }
}

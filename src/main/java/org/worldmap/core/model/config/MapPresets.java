package org.worldmap.core.model.config;

import org.worldmap.core.model.TileType;

import java.util.ArrayList;
import java.util.List;

/**
 * Готовые наборы параметров.
 */
public final class MapPresets {

    // суша: строго выше 0 м
    private static final double LAND_MIN = Double.MIN_VALUE;
    private static final double LOWLAND_MAX = 1500.0;
    private static final double HIGHLAND_MAX = 3500.0;
    private static final double PEAK_MAX = 9000.0;
    private static final double DEEPEST = -11000.0;

    private static final double COLDEST = -300.0;
    private static final double HOTTEST = 100.0;
    private static final double WETTEST = Double.MAX_VALUE;

    private MapPresets() {}

    /**
     * Земноподобная карта 80x50, обёрнута по X, 65% океана.
     */
    public static MapParameters earthLike() {
        MapParameters p = new MapParameters();
        p.tileTypes = earthLikeTileTypes();
        return p;
    }

    /**
     * Порядок важен: индекс типа пишется в тайл и в JSON.
     * Там, где диапазоны перекрываются (пустыня и степь), тип выбирается случайно.
     */
    public static List<TileType> earthLikeTileTypes() {
        List<TileType> types = new ArrayList<>();

        types.add(new TileType("Ocean", "ocean")
                .elevation(DEEPEST, 0.0)
                .temperature(-2.0, HOTTEST)
                .precipitation(0.0, WETTEST));

        types.add(new TileType("Sea ice", "sea_ice")
                .elevation(DEEPEST, 0.0)
                .temperature(COLDEST, -2.0)
                .precipitation(0.0, WETTEST));

        types.add(new TileType("Tundra", "tundra")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(COLDEST, -5.0)
                .precipitation(0.0, WETTEST));

        types.add(new TileType("Taiga", "taiga")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(-5.0, 3.0)
                .precipitation(250.0, WETTEST));

        types.add(new TileType("Temperate forest", "temperate_forest")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(3.0, 20.0)
                .precipitation(700.0, WETTEST));

        types.add(new TileType("Grassland", "grassland")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(-5.0, 20.0)
                .precipitation(150.0, 700.0));

        types.add(new TileType("Desert", "desert")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(-5.0, HOTTEST)
                .precipitation(0.0, 250.0));

        types.add(new TileType("Savanna", "savanna")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(20.0, HOTTEST)
                .precipitation(250.0, 1800.0));

        types.add(new TileType("Rainforest", "rainforest")
                .elevation(LAND_MIN, LOWLAND_MAX)
                .temperature(20.0, HOTTEST)
                .precipitation(1800.0, WETTEST));

        types.add(new TileType("Mountains", "mountains")
                .elevation(LOWLAND_MAX, HIGHLAND_MAX)
                .temperature(COLDEST, HOTTEST)
                .precipitation(0.0, WETTEST));

        types.add(new TileType("Snow peaks", "snow_peaks")
                .elevation(HIGHLAND_MAX, PEAK_MAX)
                .temperature(COLDEST, HOTTEST)
                .precipitation(0.0, WETTEST));

        return types;
    }
}

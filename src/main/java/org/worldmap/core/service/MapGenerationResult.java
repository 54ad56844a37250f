package org.worldmap.core.service;

import org.worldmap.core.generation.MapStats;
import org.worldmap.core.model.RiverNetwork;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.TileType;
import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.model.config.ParameterWarning;

import java.util.List;

/**
 * Everything one run produced. {@code parameters} are the validated ones the run used.
 */
public record MapGenerationResult(MapParameters parameters,
                                  TileGrid grid,
                                  RiverNetwork rivers,
                                  long seed,
                                  List<ParameterWarning> warnings,
                                  MapStats stats) {

    /** Tile type of a tile, or null if none matched. */
    public TileType typeOf(Tile t) {
        return t.hasType() ? parameters.tileTypes.get(t.typeIndex) : null;
    }
}

package org.worldmap.core.generation;

public enum StageId {
    ELEVATION,
    TEMPERATURE,
    LATITUDE_RAINFALL,
    OCEAN_DISTANCE,
    OROGRAPHIC_RAINFALL,
    RIVERS,
    BIOMES
}

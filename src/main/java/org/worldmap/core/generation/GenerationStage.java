package org.worldmap.core.generation;

public interface GenerationStage {
    StageId id();
    String name();
    void apply(MapContext ctx);
}

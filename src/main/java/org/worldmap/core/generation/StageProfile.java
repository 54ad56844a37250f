package org.worldmap.core.generation;

import java.util.EnumSet;
import java.util.Set;

public class StageProfile {
    private final Set<StageId> enabled;

    private StageProfile(Set<StageId> enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled(StageId id) {
        return enabled.contains(id);
    }

    public static StageProfile full() {
        return new StageProfile(EnumSet.allOf(StageId.class));
    }

    // только рельеф: высоты и линия берега
    public static StageProfile terrainOnly() {
        return new StageProfile(EnumSet.of(StageId.ELEVATION));
    }

    public static StageProfile upToClimate() {
        return new StageProfile(EnumSet.of(
                StageId.ELEVATION,
                StageId.TEMPERATURE,
                StageId.LATITUDE_RAINFALL,
                StageId.OCEAN_DISTANCE,
                StageId.OROGRAPHIC_RAINFALL
        ));
    }

    // Биомы без рек. Выбор биомов тогда тянет другие числа из rng, карта типов отличается от full()
    public static StageProfile withoutRivers() {
        return new StageProfile(EnumSet.complementOf(EnumSet.of(StageId.RIVERS)));
    }

    public static StageProfile of(StageId first, StageId... rest) {
        return new StageProfile(EnumSet.of(first, rest));
    }
}

package org.worldmap.core.generation;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Per-tile loops for work with no RNG and no cross-tile writes.
 * Parallel unless {@code -Dmapgen.parallel=false}; results do not depend on the mode.
 */
final class TileLoops {

    static final String PARALLEL_PROPERTY = "mapgen.parallel";

    private TileLoops() {}

    static void forEachIndex(int n, IntConsumer action) {
        if (parallelEnabled()) {
            IntStream.range(0, n).parallel().forEach(action);
        } else {
            for (int i = 0; i < n; i++) action.accept(i);
        }
    }

    static boolean parallelEnabled() {
        return Boolean.parseBoolean(System.getProperty(PARALLEL_PROPERTY, "true"));
    }
}

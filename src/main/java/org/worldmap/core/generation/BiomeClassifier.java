package org.worldmap.core.generation;

import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.TileType;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class BiomeClassifier {

    /**
     * Every tile gets a uniformly random pick among the matching types, or {@link Tile#NONE}.
     * One {@code rng.nextInt} per tile with at least one candidate, in tile order.
     *
     * @return number of tiles left without a type
     */
    public int classify(TileGrid grid, List<TileType> types, Random rng) {
        int unmatched = 0;
        for (Tile t : grid.tiles) {
            List<Integer> candidates = candidates(t, types);
            if (candidates.isEmpty()) {
                t.typeIndex = Tile.NONE;
                unmatched++;
            } else {
                t.typeIndex = candidates.get(rng.nextInt(candidates.size()));
            }
        }
        return unmatched;
    }

    public static List<Integer> candidates(Tile t, List<TileType> types) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            if (types.get(i).matches(t)) out.add(i);
        }
        return out;
    }
}

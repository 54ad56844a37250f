package org.worldmap.core.generation;

import org.worldmap.core.model.RiverCorner;
import org.worldmap.core.model.RiverDirection;
import org.worldmap.core.model.RiverNetwork;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.Units;

public final class Validation {

    private Validation() {}

    public static void afterElevation(MapContext ctx) {
        int ocean = 0;
        for (Tile t : ctx.grid.tiles) {
            if (!Double.isFinite(t.elevation)) {
                throw new IllegalStateException("Non-finite elevation for tile id=" + t.id + " elevation=" + t.elevation);
            }
            if (t.isOcean()) ocean++;
        }

        int want = ctx.expectedOceanTiles;
        if (ocean < want) {
            throw new IllegalStateException("Too few ocean tiles after Elevation: have=" + ocean + " want=" + want);
        }
        if (ocean > want) {
            // одинаковые сырые значения на уровне моря
            System.out.println("[WARN] Ocean tiles above target after Elevation: have=" + ocean + " want=" + want);
        }
        if (ocean == ctx.grid.size()) {
            throw new IllegalStateException("No land tiles after Elevation");
        }
    }

    public static void afterTemperature(MapContext ctx) {
        double first = ctx.grid.get(0).temperature();
        boolean allSame = true;
        for (Tile t : ctx.grid.tiles) {
            double temp = t.temperature();
            if (!Double.isFinite(temp) || temp < Units.MIN_TEMPERATURE) {
                throw new IllegalStateException("Temperature out of range for tile id=" + t.id + " temperature=" + temp);
            }
            if (Double.compare(temp, first) != 0) allSame = false;
        }
        if (allSame && ctx.grid.size() > 1) {
            System.out.println("[WARN] Temperature seems constant after Temperature: " + first);
        }
    }

    public static void afterRainfall(MapContext ctx) {
        double first = ctx.grid.get(0).precipitation();
        boolean allSame = true;
        for (Tile t : ctx.grid.tiles) {
            double p = t.precipitation();
            if (!Double.isFinite(p) || p < 0.0) {
                throw new IllegalStateException("Precipitation out of range for tile id=" + t.id + " precipitation=" + p);
            }
            if (Double.compare(p, first) != 0) allSame = false;
        }
        if (allSame && ctx.grid.size() > 1) {
            System.out.println("[WARN] Precipitation seems constant: " + first);
        }
    }

    public static void afterOceanDistance(MapContext ctx) {
        boolean anyOcean = false;
        for (Tile t : ctx.grid.tiles) {
            if (t.isOcean()) {
                anyOcean = true;
                break;
            }
        }
        if (!anyOcean) {
            System.out.println("[WARN] No ocean tiles, rainfall is not attenuated");
        } else {
            // сетка 4-связна, так что волна обязана дойти до каждого тайла
            for (Tile t : ctx.grid.tiles) {
                if (!t.hasNearestOcean()) {
                    throw new IllegalStateException("Nearest ocean not found for tile id=" + t.id);
                }
                if (!ctx.grid.get(t.nearestOcean).isOcean()) {
                    throw new IllegalStateException("Nearest ocean of tile id=" + t.id
                            + " points to land tile id=" + t.nearestOcean);
                }
            }
        }
        afterRainfall(ctx);
    }

    public static void afterRivers(MapContext ctx) {
        RiverNetwork rivers = ctx.rivers;
        for (RiverCorner c : rivers.corners()) {
            if (c.connectionCount() == 0) {
                throw new IllegalStateException("River corner without links: " + c);
            }
            for (RiverDirection d : RiverDirection.values()) {
                if (!c.connects(d)) continue;
                int ni = rivers.neighbor(c.index, d);
                RiverCorner other = (ni == Tile.NONE) ? null : rivers.get(ni);
                if (other == null || !other.connects(d.opposite())) {
                    throw new IllegalStateException("Asymmetric river link at " + c + " direction=" + d);
                }
            }
        }
        if (rivers.isEmpty()) {
            System.out.println("[WARN] No rivers generated");
        }
    }

    public static void afterBiomes(MapContext ctx) {
        int typeCount = ctx.params.tileTypes.size();
        int untyped = 0;
        for (Tile t : ctx.grid.tiles) {
            if (t.typeIndex == Tile.NONE) {
                untyped++;
                continue;
            }
            if (t.typeIndex < 0 || t.typeIndex >= typeCount) {
                throw new IllegalStateException("Tile type index out of range for tile id=" + t.id
                        + " typeIndex=" + t.typeIndex + " types=" + typeCount);
            }
        }
        if (untyped > 0) {
            System.out.println("[WARN] " + untyped + " of " + ctx.grid.size() + " tiles have no tile type");
        }
    }
}

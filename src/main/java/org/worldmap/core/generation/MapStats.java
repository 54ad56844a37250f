package org.worldmap.core.generation;

import org.worldmap.core.model.RiverCorner;
import org.worldmap.core.model.RiverNetwork;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.TileType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MapStats {

    /** Верхние границы корзин расстояния до океана, км. Последняя корзина открыта. */
    public static final double[] OCEAN_DIST_BUCKETS_KM = {0.0, 250.0, 500.0, 1000.0, 2000.0};

    public int tileCount;
    public int oceanCount;

    // elevation, m
    public double elevationMin = Double.POSITIVE_INFINITY;
    public double elevationMax = Double.NEGATIVE_INFINITY;
    public double elevationAvg;

    // temperature, °C
    public double tempMin = Double.POSITIVE_INFINITY;
    public double tempMax = Double.NEGATIVE_INFINITY;
    public double tempAvg;

    // precipitation, mm/yr
    public double precipMin = Double.POSITIVE_INFINITY;
    public double precipMax = Double.NEGATIVE_INFINITY;
    public double precipAvg;

    // rivers
    public int riverCorners;
    public int riverLinks;
    public int riverEnds;

    // тип -> число тайлов, в порядке объявления типов
    public final Map<String, Integer> typeCounts = new LinkedHashMap<>();
    public int untypedCount;

    // суша по расстоянию до океана
    public final int[] oceanDistCount = new int[OCEAN_DIST_BUCKETS_KM.length + 1];
    public final double[] oceanDistPrecip = new double[OCEAN_DIST_BUCKETS_KM.length + 1];

    public static MapStats compute(TileGrid grid, RiverNetwork rivers, List<TileType> types) {
        MapStats s = new MapStats();
        s.tileCount = grid.size();
        for (TileType type : types) {
            s.typeCounts.putIfAbsent(type.name, 0);
        }

        // средние накапливаем долями: при высотах порядка Double.MAX_VALUE сумма уходит в Infinity
        double n = Math.max(1, s.tileCount);
        double elevSum = 0.0;
        double tempSum = 0.0;
        double precipSum = 0.0;

        for (Tile t : grid.tiles) {
            if (t.isOcean()) s.oceanCount++;

            s.elevationMin = Math.min(s.elevationMin, t.elevation);
            s.elevationMax = Math.max(s.elevationMax, t.elevation);
            elevSum += t.elevation / n;

            s.tempMin = Math.min(s.tempMin, t.temperature());
            s.tempMax = Math.max(s.tempMax, t.temperature());
            tempSum += t.temperature() / n;

            s.precipMin = Math.min(s.precipMin, t.precipitation());
            s.precipMax = Math.max(s.precipMax, t.precipitation());
            precipSum += t.precipitation() / n;

            if (t.hasType() && t.typeIndex < types.size()) {
                s.typeCounts.merge(types.get(t.typeIndex).name, 1, Integer::sum);
            } else {
                s.untypedCount++;
            }

            if (!t.isOcean() && t.hasNearestOcean()) {
                double km = Math.sqrt(grid.distanceSquaredKm(t, grid.get(t.nearestOcean)));
                int b = bucket(km);
                s.oceanDistCount[b]++;
                s.oceanDistPrecip[b] += t.precipitation();
            }
        }

        if (s.tileCount > 0) {
            s.elevationAvg = elevSum;
            s.tempAvg = tempSum;
            s.precipAvg = precipSum;
        }

        int linkEnds = 0;
        for (RiverCorner c : rivers.corners()) {
            s.riverCorners++;
            linkEnds += c.connectionCount();
            if (c.connectionCount() == 1) s.riverEnds++;
        }
        s.riverLinks = linkEnds / 2;
        return s;
    }

    static int bucket(double km) {
        for (int i = 0; i < OCEAN_DIST_BUCKETS_KM.length; i++) {
            if (km <= OCEAN_DIST_BUCKETS_KM[i]) return i;
        }
        return OCEAN_DIST_BUCKETS_KM.length;
    }
}

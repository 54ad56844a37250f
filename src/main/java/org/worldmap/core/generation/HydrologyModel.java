package org.worldmap.core.generation;

import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.Units;
import org.worldmap.core.model.config.MapParameters;

import java.util.ArrayDeque;

/**
 * Влага над сушей: ослабление осадков вдали от океана и орографические осадки.
 */
public class HydrologyModel {

    private static final int[][] DIRS4 = {{0, 1}, {0, -1}, {-1, 0}, {1, 0}};

    private final MapParameters params;
    private final ClimateModel climate;

    public HydrologyModel(MapParameters params, ClimateModel climate) {
        this.params = params;
        this.climate = climate;
    }

    // ---------------------------
    // БЛИЖАЙШИЙ ОКЕАН
    // ---------------------------

    /**
     * Многоисточниковая волна от всех океанских тайлов.
     * Тайл может улучшиться и встать в очередь несколько раз, пока волна не успокоится.
     *
     * @return сколько раз тайлы доставались из очереди
     */
    public int computeNearestOcean(TileGrid grid) {
        ArrayDeque<Tile> frontier = new ArrayDeque<>();
        for (Tile t : grid.tiles) {
            if (t.isOcean()) {
                t.nearestOcean = t.id;
                frontier.add(t);
            } else {
                t.nearestOcean = Tile.NONE;
            }
        }

        int pops = 0;
        while (!frontier.isEmpty()) {
            Tile cur = frontier.poll();
            pops++;
            Tile ocean = grid.get(cur.nearestOcean);

            for (int[] d : DIRS4) {
                int ni = grid.neighbor(cur, d[0], d[1]);
                if (ni == Tile.NONE) continue;
                Tile nb = grid.get(ni);

                if (!nb.hasNearestOcean()
                        || grid.distanceSquaredKm(nb, grid.get(nb.nearestOcean)) > grid.distanceSquaredKm(nb, ocean)) {
                    nb.nearestOcean = ocean.id;
                    frontier.add(nb);
                }
            }
        }
        return pops;
    }

    /** precipitation /= exp(sqrt(d2) / eFolding) для суши с известным ближайшим океаном. */
    public void attenuateByOceanDistance(TileGrid grid) {
        double eFolding = params.rainfallOceanEFoldingDistance;
        for (Tile t : grid.tiles) {
            if (t.isOcean() || !t.hasNearestOcean()) continue;
            double km = Math.sqrt(grid.distanceSquaredKm(t, grid.get(t.nearestOcean)));
            t.setPrecipitation(t.precipitation() / Math.exp(km / eFolding));
        }
    }

    // ---------------------------
    // ОРОГРАФИЯ
    // ---------------------------

    /**
     * Западный перенос (ветер дует на +x) внутри пояса [high, low] по модулю широты,
     * восточный вне его. rotateWest меняет их местами.
     */
    public boolean blowsEastward(double latRad) {
        double absDeg = Math.abs(Math.toDegrees(latRad));
        boolean westerlies = absDeg >= params.highPressureLatitude && absDeg <= params.lowPressureLatitude;
        return westerlies != params.rotateWest;
    }

    public void applyOrographicRainfall(TileGrid grid) {
        for (int y = 0; y < grid.height; y++) {
            sweepRow(grid, y);
        }
    }

    private void sweepRow(TileGrid grid, int y) {
        int w = grid.width;
        double lat = climate.latitude(y);
        boolean eastward = blowsEastward(lat);
        int start = eastward ? 0 : w - 1;
        int step = eastward ? 1 : -1;

        double ts = climate.seaLevelTemperature(lat);
        double saturation = params.saturationPressureConst1 * ts / (params.saturationPressureConst2 + ts);
        double runKm = grid.scaleX * Units.METERS_PER_KM;

        int first;
        double prev;
        if (grid.wrapX) {
            // первый тайл получает предшественника с другого конца строки
            prev = landElevation(grid.get(eastward ? w - 1 : 0, y));
            first = 0;
        } else {
            prev = landElevation(grid.get(start, y));
            first = 1;
        }

        for (int k = first; k < w; k++) {
            Tile t = grid.get(start + k * step, y);
            double rise = t.elevation - prev;
            if (!t.isOcean() && rise != 0.0) {
                double tk = Units.toKelvin(t.temperature());
                double factor = params.condensationRateMultiplier
                        * Math.exp(saturation - t.elevation * (params.moistureScaleHeightDivisor
                        * params.temperatureLapseRate / (tk * tk)));
                t.setPrecipitation(t.precipitation() + factor * (rise / runKm));
            }
            prev = landElevation(t);
        }
    }

    private static double landElevation(Tile t) {
        return t.isOcean() ? 0.0 : t.elevation;
    }
}

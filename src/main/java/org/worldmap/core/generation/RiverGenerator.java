package org.worldmap.core.generation;

import org.worldmap.core.model.RiverCorner;
import org.worldmap.core.model.RiverDirection;
import org.worldmap.core.model.RiverNetwork;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.Units;
import org.worldmap.core.model.config.MapParameters;

import java.util.Random;

/**
 * Реки на сетке углов: случайные истоки и спуск по самому крутому склону.
 * <p>
 * Вероятность истока растёт с осадками и уклоном:
 * p = (4 / PI^2) * atan(rainMult * precip) * atan(slopeMult * slope), p в [0, 1).
 * Спуск останавливается у океана, в яме или при слиянии с уже существующей рекой.
 */
public class RiverGenerator {

    private static final double SOURCE_PROBABILITY_NORM = 4.0 / (Math.PI * Math.PI);

    private final MapParameters params;

    // усреднённые по тайлам значения для каждого угла
    private double[] cornerElevation;
    private double[] cornerPrecip;
    private boolean[] oceanAdjacent;

    public RiverGenerator(MapParameters params) {
        this.params = params;
    }

    /**
     * Заполняет network. Для каждого угла без реки и не у океана тянет один rng.nextDouble(),
     * углы перебираются построчно.
     */
    public void generate(TileGrid grid, RiverNetwork network, Random rng) {
        sampleCorners(grid, network);

        int sources = 0;
        for (int cy = 0; cy < network.cornerHeight; cy++) {
            for (int cx = 0; cx < network.cornerWidth; cx++) {
                int idx = network.index(cx, cy);
                if (oceanAdjacent[idx] || network.hasRiver(idx)) continue;

                Descent down = steepestDescent(network, idx);
                double slope = (down == null) ? 0.0 : down.slope;
                double p = sourceProbability(cornerPrecip[idx], slope);

                if (rng.nextDouble() < p) {
                    walk(network, idx);
                    sources++;
                }
            }
        }
        System.out.println("Rivers: sources=" + sources + " corners=" + network.size());
    }

    public double sourceProbability(double precipitation, double slope) {
        return SOURCE_PROBABILITY_NORM
                * Math.atan(params.riverRainfallMultiplier * precipitation)
                * Math.atan(params.riverSlopeMultiplier * slope);
    }

    private void walk(RiverNetwork network, int start) {
        int idx = start;
        RiverCorner current = place(network, idx);

        while (!oceanAdjacent[idx]) {
            Descent down = steepestDescent(network, idx);
            if (down == null) break; // яма

            boolean merge = network.hasRiver(down.index);
            RiverCorner next = place(network, down.index);
            network.link(current, next, down.direction);
            if (merge) break;

            current = next;
            idx = down.index;
        }
    }

    private RiverCorner place(RiverNetwork network, int idx) {
        return network.place(idx, cornerElevation[idx], cornerPrecip[idx]);
    }

    /**
     * Самый крутой строго нисходящий сосед; при равенстве первый из UP, DOWN, LEFT, RIGHT.
     */
    private Descent steepestDescent(RiverNetwork network, int idx) {
        Descent best = null;
        for (RiverDirection d : RiverDirection.values()) {
            int ni = network.neighbor(idx, d);
            if (ni == Tile.NONE) continue;

            double drop = cornerElevation[idx] - cornerElevation[ni];
            if (!(drop > 0.0)) continue;

            double spacingKm = d.isHorizontal() ? params.tileScaleX : params.tileScaleY;
            double slope = drop / (spacingKm * Units.METERS_PER_KM);
            if (best == null || slope > best.slope) {
                best = new Descent(ni, d, slope);
            }
        }
        return best;
    }

    private void sampleCorners(TileGrid grid, RiverNetwork network) {
        int n = network.cornerCount();
        cornerElevation = new double[n];
        cornerPrecip = new double[n];
        oceanAdjacent = new boolean[n];

        for (int i = 0; i < n; i++) {
            int[] touching = network.touchingTiles(i);
            double elev = 0.0;
            double precip = 0.0;
            boolean ocean = false;
            for (int ti : touching) {
                Tile t = grid.get(ti);
                elev += t.elevation / touching.length;
                precip += t.precipitation() / touching.length;
                ocean |= t.isOcean();
            }
            cornerElevation[i] = elev;
            cornerPrecip[i] = precip;
            oceanAdjacent[i] = ocean;
        }
    }

    private static final class Descent {
        final int index;
        final RiverDirection direction;
        final double slope;

        Descent(int index, RiverDirection direction, double slope) {
            this.index = index;
            this.direction = direction;
            this.slope = slope;
        }
    }
}

package org.worldmap.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Тип поверхности (биом), задаётся диапазонами высоты, температуры и осадков.
 * Внутри одного атрибута диапазоны объединяются по ИЛИ, между атрибутами по И.
 * assetKey не интерпретируется генератором, его читает слой отрисовки.
 */
public class TileType {

    public String name;
    public String assetKey;

    public final List<ValueRange> elevation = new ArrayList<>();
    public final List<ValueRange> temperature = new ArrayList<>();
    public final List<ValueRange> precipitation = new ArrayList<>();

    public TileType(String name) {
        this(name, name);
    }

    public TileType(String name, String assetKey) {
        this.name = name;
        this.assetKey = assetKey;
    }

    public TileType elevation(double min, double max) {
        elevation.add(new ValueRange(min, max));
        return this;
    }

    public TileType temperature(double min, double max) {
        temperature.add(new ValueRange(min, max));
        return this;
    }

    public TileType precipitation(double min, double max) {
        precipitation.add(new ValueRange(min, max));
        return this;
    }

    public boolean matches(double elev, double temp, double precip) {
        return anyContains(elevation, elev)
                && anyContains(temperature, temp)
                && anyContains(precipitation, precip);
    }

    public boolean matches(Tile t) {
        return matches(t.elevation, t.temperature(), t.precipitation());
    }

    /** Максимальная верхняя граница высоты по всем диапазонам, -inf если диапазонов нет. */
    public double maxElevation() {
        double max = Double.NEGATIVE_INFINITY;
        for (ValueRange r : elevation) {
            max = Math.max(max, r.max());
        }
        return max;
    }

    public boolean spansSeaLevel() {
        for (ValueRange r : elevation) {
            if (r.spansZero()) return true;
        }
        return false;
    }

    public TileType copy() {
        TileType c = new TileType(name, assetKey);
        c.elevation.addAll(elevation);
        c.temperature.addAll(temperature);
        c.precipitation.addAll(precipitation);
        return c;
    }

    private static boolean anyContains(List<ValueRange> ranges, double v) {
        for (ValueRange r : ranges) {
            if (r.contains(v)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}

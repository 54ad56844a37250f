package org.worldmap.core.model;

import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.topology.WrapTopology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Прямоугольная сетка тайлов с независимым заворачиванием по X и Y.
 * Строка y = 0 лежит у южного края, y растёт на север.
 */
public class TileGrid {

    public final int width;
    public final int height;
    public final boolean wrapX;
    public final boolean wrapY;

    /** km per tile */
    public final double scaleX;
    public final double scaleY;

    public final List<Tile> tiles;

    public TileGrid(int width, int height, boolean wrapX, boolean wrapY, double scaleX, double scaleY) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid must have at least one tile, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.wrapX = wrapX;
        this.wrapY = wrapY;
        this.scaleX = scaleX;
        this.scaleY = scaleY;

        List<Tile> list = new ArrayList<>(width * height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                list.add(new Tile(y * width + x, x, y));
            }
        }
        this.tiles = Collections.unmodifiableList(list);
    }

    public static TileGrid create(MapParameters p) {
        return new TileGrid(p.width, p.height, p.wrapX, p.wrapY, p.tileScaleX, p.tileScaleY);
    }

    public int size() {
        return tiles.size();
    }

    public int index(int x, int y) {
        return y * width + x;
    }

    public Tile get(int index) {
        return tiles.get(index);
    }

    public Tile get(int x, int y) {
        return tiles.get(index(x, y));
    }

    /**
     * Соседний тайл со сдвигом (dx, dy) с учётом заворачивания.
     * @return индекс или {@link Tile#NONE}, если сосед за краем карты
     */
    public int neighbor(Tile t, int dx, int dy) {
        int nx = WrapTopology.wrap(t.x + dx, width, wrapX);
        int ny = WrapTopology.wrap(t.y + dy, height, wrapY);
        if (nx == WrapTopology.NONE || ny == WrapTopology.NONE) return Tile.NONE;
        return index(nx, ny);
    }

    /** Квадрат расстояния между тайлами в км², по кратчайшему пути через швы. */
    public double distanceSquaredKm(Tile a, Tile b) {
        int dx = WrapTopology.toroidalDelta(a.x, b.x, width, wrapX);
        int dy = WrapTopology.toroidalDelta(a.y, b.y, height, wrapY);
        return WrapTopology.distanceSquared(dx, dy, scaleX, scaleY);
    }
}

package org.worldmap.core.model;

import org.worldmap.core.topology.WrapTopology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Речная сеть на сетке углов (дуальная сетка к тайлам).
 * <p>
 * По незаворачиваемой оси углов на один больше, чем тайлов; по заворачиваемой столько же
 * (последний угол совпадает с первым). Угол создаётся лениво, только когда через него
 * проходит река. Хранение: массив по индексу угла + список в порядке создания.
 */
public class RiverNetwork {

    public final int tileWidth;
    public final int tileHeight;
    public final boolean wrapX;
    public final boolean wrapY;

    public final int cornerWidth;
    public final int cornerHeight;

    private final RiverCorner[] byIndex;
    private final List<RiverCorner> placed = new ArrayList<>();

    public RiverNetwork(int tileWidth, int tileHeight, boolean wrapX, boolean wrapY) {
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.wrapX = wrapX;
        this.wrapY = wrapY;
        this.cornerWidth = wrapX ? tileWidth : tileWidth + 1;
        this.cornerHeight = wrapY ? tileHeight : tileHeight + 1;
        this.byIndex = new RiverCorner[cornerWidth * cornerHeight];
    }

    public static RiverNetwork forGrid(TileGrid grid) {
        return new RiverNetwork(grid.width, grid.height, grid.wrapX, grid.wrapY);
    }

    public int cornerCount() {
        return byIndex.length;
    }

    public int index(int cx, int cy) {
        return cy * cornerWidth + cx;
    }

    public int cornerX(int index) {
        return index % cornerWidth;
    }

    public int cornerY(int index) {
        return index / cornerWidth;
    }

    /** Соседний угол по направлению или {@link Tile#NONE} за краем карты. */
    public int neighbor(int index, RiverDirection d) {
        int nx = WrapTopology.wrap(cornerX(index) + d.dx, cornerWidth, wrapX);
        int ny = WrapTopology.wrap(cornerY(index) + d.dy, cornerHeight, wrapY);
        if (nx == WrapTopology.NONE || ny == WrapTopology.NONE) return Tile.NONE;
        return index(nx, ny);
    }

    /**
     * Индексы тайлов, касающихся угла: (cx-1,cy-1), (cx,cy-1), (cx-1,cy), (cx,cy).
     * На незаворачиваемом краю их меньше четырёх.
     */
    public int[] touchingTiles(int index) {
        int cx = cornerX(index);
        int cy = cornerY(index);
        int[] out = new int[4];
        int n = 0;
        for (int ty = cy - 1; ty <= cy; ty++) {
            int wy = WrapTopology.wrap(ty, tileHeight, wrapY);
            if (wy == WrapTopology.NONE) continue;
            for (int tx = cx - 1; tx <= cx; tx++) {
                int wx = WrapTopology.wrap(tx, tileWidth, wrapX);
                if (wx == WrapTopology.NONE) continue;
                out[n++] = wy * tileWidth + wx;
            }
        }
        int[] result = new int[n];
        System.arraycopy(out, 0, result, 0, n);
        return result;
    }

    public boolean hasRiver(int index) {
        return byIndex[index] != null;
    }

    public RiverCorner get(int index) {
        return byIndex[index];
    }

    public RiverCorner get(int cx, int cy) {
        return byIndex[index(cx, cy)];
    }

    public RiverCorner place(int index, double elevation, double precipitation) {
        RiverCorner existing = byIndex[index];
        if (existing != null) return existing;

        RiverCorner c = new RiverCorner(index, cornerX(index), cornerY(index), elevation, precipitation);
        byIndex[index] = c;
        placed.add(c);
        return c;
    }

    /** Связывает два соседних угла в обе стороны. */
    public void link(RiverCorner from, RiverCorner to, RiverDirection direction) {
        if (neighbor(from.index, direction) != to.index) {
            throw new IllegalArgumentException("Corners are not neighbours: " + from + " " + direction + " " + to);
        }
        from.connect(direction);
        to.connect(direction.opposite());
    }

    /** Углы с реками в порядке создания. */
    public List<RiverCorner> corners() {
        return Collections.unmodifiableList(placed);
    }

    public int size() {
        return placed.size();
    }

    public boolean isEmpty() {
        return placed.isEmpty();
    }

    /**
     * Позиции угла на сетке отображения (tileWidth+1) x (tileHeight+1).
     * Угол на заворачиваемом шве (cx == 0 или cy == 0) дублируется на противоположный край,
     * так что позиций от 1 до 4. Каждая позиция это {x, y}.
     */
    public List<int[]> physicalPositions(RiverCorner c) {
        int[] xs = (wrapX && c.cx == 0) ? new int[]{0, tileWidth} : new int[]{c.cx};
        int[] ys = (wrapY && c.cy == 0) ? new int[]{0, tileHeight} : new int[]{c.cy};

        List<int[]> out = new ArrayList<>(xs.length * ys.length);
        for (int y : ys) {
            for (int x : xs) {
                out.add(new int[]{x, y});
            }
        }
        return out;
    }
}

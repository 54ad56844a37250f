package org.worldmap.core.model;

/**
 * Угол сетки, через который проходит река.
 * Высота и осадки усреднены по тайлам, которые касаются угла.
 */
public class RiverCorner {

    public final int index;
    public final int cx;
    public final int cy;

    public final double elevation;
    public final double precipitation;

    /** битовая маска RiverDirection.bit */
    private int connections;

    public RiverCorner(int index, int cx, int cy, double elevation, double precipitation) {
        this.index = index;
        this.cx = cx;
        this.cy = cy;
        this.elevation = elevation;
        this.precipitation = precipitation;
    }

    public int connections() {
        return connections;
    }

    public boolean connects(RiverDirection d) {
        return (connections & d.bit) != 0;
    }

    public int connectionCount() {
        return Integer.bitCount(connections);
    }

    // only RiverNetwork.link touches the mask so both ends stay in sync
    void connect(RiverDirection d) {
        connections |= d.bit;
    }

    @Override
    public String toString() {
        return "RiverCorner{" + cx + "," + cy + " mask=" + connections + "}";
    }
}

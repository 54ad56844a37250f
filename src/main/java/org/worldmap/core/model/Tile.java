package org.worldmap.core.model;

/**
 * Каноническая модель клетки карты.
 * Тайлы лежат в плоском массиве TileGrid, индекс = y * width + x.
 * Высота в метрах (океан, если elevation <= 0), температура в °C, осадки в мм/год.
 */
public class Tile {

    /** Маркер "нет значения" для индексов (тип, ближайший океан). */
    public static final int NONE = -1;

    public final int id;
    public final int x;
    public final int y;

    public double elevation;

    // температура и осадки всегда через сеттеры: там клампы
    private double temperature;
    private double precipitation;

    /** Индекс ближайшего океанского тайла, NONE пока волна расстояний не дошла. */
    public int nearestOcean = NONE;

    /** Индекс TileType в списке параметров, NONE = ни один тип не подошёл. */
    public int typeIndex = NONE;

    public Tile(int id, int x, int y) {
        this.id = id;
        this.x = x;
        this.y = y;
    }

    public boolean isOcean() {
        return elevation <= 0.0;
    }

    public double temperature() {
        return temperature;
    }

    public void setTemperature(double celsius) {
        this.temperature = Math.max(Units.MIN_TEMPERATURE, Math.min(Double.MAX_VALUE, celsius));
    }

    public double precipitation() {
        return precipitation;
    }

    public void setPrecipitation(double mmPerYear) {
        this.precipitation = Math.max(0.0, Math.min(Double.MAX_VALUE, mmPerYear));
    }

    public boolean hasNearestOcean() {
        return nearestOcean != NONE;
    }

    public boolean hasType() {
        return typeIndex != NONE;
    }

    @Override
    public String toString() {
        return "Tile{" + id + " @" + x + "," + y
                + " elev=" + elevation
                + " t=" + temperature
                + " p=" + precipitation
                + " type=" + typeIndex + "}";
    }
}

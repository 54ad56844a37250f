package org.worldmap.core.generation;

import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.config.MapParameters;

/**
 * Широтная модель климата: температура по широте и высоте, базовые осадки по широте.
 * Широта строки y: (y / height - 0.5) * PI, строка 0 у южного полюса.
 */
public class ClimateModel {

    private final MapParameters params;

    public ClimateModel(MapParameters params) {
        this.params = params;
    }

    public double latitude(int y) {
        return latitude(y, params.height);
    }

    public static double latitude(int y, int height) {
        return ((double) y / height - 0.5) * Math.PI;
    }

    // ---------------------------
    // ТЕМПЕРАТУРА
    // ---------------------------

    public double seaLevelTemperature(double lat) {
        double s = Math.sin(lat);
        return params.equatorTemperature
                - (params.equatorTemperature - params.poleTemperature) * s * s;
    }

    /** Температура тайла; поправка на высоту только для суши. */
    public double temperature(double lat, double elevation) {
        double t = seaLevelTemperature(lat);
        if (elevation > 0.0) {
            t -= elevation * params.temperatureLapseRate;
        }
        return t;
    }

    public void generateTemperature(TileGrid grid) {
        TileLoops.forEachIndex(grid.size(), i -> {
            Tile t = grid.get(i);
            // сеттер держит значение выше абсолютного нуля
            t.setTemperature(temperature(latitude(t.y), t.elevation));
        });
    }

    // ---------------------------
    // ОСАДКИ
    // ---------------------------

    /**
     * Три лоренцевых пика: экватор и два пояса низкого давления.
     */
    public double baselineRainfall(double lat) {
        double c = Math.toRadians(params.lowPressureLatitude);
        return lorentz(lat, 0.0, params.equatorRainfall, params.equatorRainfallEvenness)
                + lorentz(lat, c, params.midLatitudeRainfall, params.midLatitudeRainfallEvenness)
                + lorentz(lat, -c, params.midLatitudeRainfall, params.midLatitudeRainfallEvenness);
    }

    public void generateRainfall(TileGrid grid) {
        TileLoops.forEachIndex(grid.size(), i -> {
            Tile t = grid.get(i);
            t.setPrecipitation(baselineRainfall(latitude(t.y)));
        });
    }

    private static double lorentz(double lat, double center, double peak, double evenness) {
        double d = (lat - center) / evenness;
        return peak / (1.0 + d * d);
    }
}

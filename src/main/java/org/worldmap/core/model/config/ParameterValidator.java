package org.worldmap.core.model.config;

import org.worldmap.core.model.TileType;
import org.worldmap.core.model.Units;
import org.worldmap.core.model.ValueRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка параметров перед генерацией.
 * validate() возвращает копию с зажатыми значениями, warnings() только сообщает.
 * Сама генерация после этого ошибок не ожидает.
 */
public final class ParameterValidator {

    private ParameterValidator() {}

    public static MapParameters validate(MapParameters source) {
        requireUsable(source);
        MapParameters p = source.copy();

        // размер карты
        p.width = Math.max(1, p.width);
        p.height = Math.max(1, p.height);

        // масштаб тайла > 0, полная длина по оси конечна
        p.tileScaleX = clamp(p.tileScaleX, Double.MIN_VALUE, Double.MAX_VALUE / p.width);
        p.tileScaleY = clamp(p.tileScaleY, Double.MIN_VALUE, Double.MAX_VALUE / p.height);

        // хотя бы один тайл суши
        long tileCount = (long) p.width * p.height;
        p.oceanFraction = clamp(p.oceanFraction, 0.0, 1.0 - 1.0 / tileCount);
        if (Double.isNaN(p.oceanFraction)) p.oceanFraction = 0.0;

        if (!(p.noiseScale > 0.0) || Double.isInfinite(p.noiseScale)) {
            p.noiseScale = new MapParameters().noiseScale;
        }

        List<TileType> validatedTypes = new ArrayList<>(p.tileTypes.size());
        for (TileType t : p.tileTypes) {
            validatedTypes.add(validateType(t));
        }
        p.tileTypes = validatedTypes;

        p.highPressureLatitude = clamp(p.highPressureLatitude, 0.0, 90.0);
        p.lowPressureLatitude = clamp(p.lowPressureLatitude, p.highPressureLatitude, 90.0);

        p.equatorTemperature = clamp(p.equatorTemperature, Units.MIN_TEMPERATURE, Double.MAX_VALUE);
        p.poleTemperature = clamp(p.poleTemperature, Units.MIN_TEMPERATURE, Double.MAX_VALUE);

        p.equatorRainfall = Math.max(0.0, p.equatorRainfall);
        p.midLatitudeRainfall = Math.max(0.0, p.midLatitudeRainfall);

        // evenness стоит в знаменателе и потом в квадрате, так что отрицательные не нужны
        p.equatorRainfallEvenness = Math.max(Double.MIN_VALUE, p.equatorRainfallEvenness);
        p.midLatitudeRainfallEvenness = Math.max(Double.MIN_VALUE, p.midLatitudeRainfallEvenness);

        if (p.rainfallOceanEFoldingDistance == 0.0) {
            p.rainfallOceanEFoldingDistance = Double.MIN_VALUE;
        }

        double lowT = Math.min(p.equatorTemperature, p.poleTemperature);
        double highT = Math.max(p.equatorTemperature, p.poleTemperature);
        if (p.saturationPressureConst2 >= lowT && p.saturationPressureConst2 <= highT) {
            p.saturationPressureConst2 = Math.nextUp(highT);
        }

        // отрицательные множители дали бы отрицательную вероятность реки
        p.riverRainfallMultiplier = Math.max(0.0, p.riverRainfallMultiplier);
        p.riverSlopeMultiplier = Math.max(0.0, p.riverSlopeMultiplier);

        return p;
    }

    public static List<ParameterWarning> warnings(MapParameters p) {
        requireUsable(p);
        List<ParameterWarning> out = new ArrayList<>();

        if (p.poleTemperature > p.equatorTemperature) {
            out.add(new ParameterWarning("poleTemperature",
                    "Pole temperature " + p.poleTemperature + " is warmer than equator temperature "
                            + p.equatorTemperature));
        }
        if (p.temperatureLapseRate < 0.0) {
            out.add(new ParameterWarning("temperatureLapseRate",
                    "Negative lapse rate: temperature will increase with elevation"));
        }
        if (p.rainfallOceanEFoldingDistance < 0.0) {
            out.add(new ParameterWarning("rainfallOceanEFoldingDistance",
                    "Negative e-folding distance: rainfall will increase away from the ocean"));
        }
        if (p.condensationRateMultiplier < 0.0) {
            out.add(new ParameterWarning("condensationRateMultiplier",
                    "Negative condensation multiplier: upslopes get drier and downslopes wetter"));
        }

        if (p.tileTypes.isEmpty()) {
            out.add(new ParameterWarning("tileTypes", "No tile types defined, every tile stays untyped"));
        } else {
            for (TileType t : p.tileTypes) {
                if (t.spansSeaLevel()) {
                    out.add(new ParameterWarning("tileTypes." + t.name,
                            "Elevation range spans both ocean and land"));
                }
            }
            if (!(p.maxTileTypeElevation() > 0.0)) {
                out.add(new ParameterWarning("tileTypes",
                        "No tile type reaches above sea level, 1 m is used as maximum elevation"));
            }
        }
        return out;
    }

    private static void requireUsable(MapParameters p) {
        if (p == null) {
            throw new IllegalArgumentException("Map parameters must not be null");
        }
        if (p.tileTypes == null) {
            throw new IllegalArgumentException("Map parameters tileTypes must not be null");
        }
    }

    private static TileType validateType(TileType t) {
        TileType v = new TileType(t.name, t.assetKey);
        for (ValueRange r : t.elevation) {
            v.elevation.add(r.validated(Double.NEGATIVE_INFINITY, Double.MAX_VALUE));
        }
        for (ValueRange r : t.temperature) {
            v.temperature.add(r.validated(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
        }
        for (ValueRange r : t.precipitation) {
            v.precipitation.add(r.validated(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
        }
        return v;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}

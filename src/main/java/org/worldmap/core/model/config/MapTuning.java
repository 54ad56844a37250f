package org.worldmap.core.model.config;

import java.util.function.Function;

/**
 * Скалярные параметры карты по строковым ключам.
 * Один набор ключей для локального файла (map.width=...) и для -D (-Dmapgen.map.width=...).
 * Пустое или битое значение оставляет текущее.
 */
public final class MapTuning {

    public static final String SYSTEM_PREFIX = "mapgen.";

    private MapTuning() {}

    public static void applySystemOverrides(MapParameters p) {
        apply(p, key -> System.getProperty(SYSTEM_PREFIX + key));
    }

    public static void apply(MapParameters p, Function<String, String> source) {
        // --- map ---
        p.width = iprop(source, "map.width", p.width);
        p.height = iprop(source, "map.height", p.height);
        p.wrapX = bprop(source, "map.wrapX", p.wrapX);
        p.wrapY = bprop(source, "map.wrapY", p.wrapY);
        p.tileScaleX = dprop(source, "map.tileScaleX", p.tileScaleX);
        p.tileScaleY = dprop(source, "map.tileScaleY", p.tileScaleY);
        p.oceanFraction = dprop(source, "map.oceanFraction", p.oceanFraction);
        p.noiseScale = dprop(source, "map.noiseScale", p.noiseScale);
        p.rotateWest = bprop(source, "map.rotateWest", p.rotateWest);

        String seed = source.apply("map.seed");
        if (seed != null && !seed.isBlank()) {
            try {
                p.seed = Long.parseLong(seed.trim());
                p.customSeed = true;
            } catch (NumberFormatException ignored) {
                // остаётся прежний сид
            }
        }

        // --- climate ---
        p.highPressureLatitude = dprop(source, "climate.highPressureLatitude", p.highPressureLatitude);
        p.lowPressureLatitude = dprop(source, "climate.lowPressureLatitude", p.lowPressureLatitude);
        p.equatorTemperature = dprop(source, "climate.equatorTemperature", p.equatorTemperature);
        p.poleTemperature = dprop(source, "climate.poleTemperature", p.poleTemperature);
        p.temperatureLapseRate = dprop(source, "climate.lapseRate", p.temperatureLapseRate);

        // --- rain ---
        p.equatorRainfall = dprop(source, "rain.equator", p.equatorRainfall);
        p.equatorRainfallEvenness = dprop(source, "rain.equatorEvenness", p.equatorRainfallEvenness);
        p.midLatitudeRainfall = dprop(source, "rain.midLatitude", p.midLatitudeRainfall);
        p.midLatitudeRainfallEvenness = dprop(source, "rain.midLatitudeEvenness", p.midLatitudeRainfallEvenness);
        p.rainfallOceanEFoldingDistance = dprop(source, "rain.oceanEFoldingKm", p.rainfallOceanEFoldingDistance);

        // --- orographic ---
        p.condensationRateMultiplier = dprop(source, "orographic.condensation", p.condensationRateMultiplier);
        p.saturationPressureConst1 = dprop(source, "orographic.satConst1", p.saturationPressureConst1);
        p.saturationPressureConst2 = dprop(source, "orographic.satConst2", p.saturationPressureConst2);
        p.moistureScaleHeightDivisor = dprop(source, "orographic.moistureDivisor", p.moistureScaleHeightDivisor);

        // --- rivers ---
        p.riverRainfallMultiplier = dprop(source, "river.rainfallMultiplier", p.riverRainfallMultiplier);
        p.riverSlopeMultiplier = dprop(source, "river.slopeMultiplier", p.riverSlopeMultiplier);
    }

    private static double dprop(Function<String, String> source, String key, double fallback) {
        String raw = source.apply(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static int iprop(Function<String, String> source, String key, int fallback) {
        String raw = source.apply(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static boolean bprop(Function<String, String> source, String key, boolean fallback) {
        String raw = source.apply(key);
        if (raw == null || raw.isBlank()) return fallback;
        String v = raw.trim();
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        return fallback;
    }
}

package org.worldmap.core.model.config;

import org.worldmap.core.model.TileType;

import java.util.ArrayList;
import java.util.List;

/**
 * Параметры одной генерации карты.
 * Объект изменяемый (его заполняют пресеты, локальный файл и -D оверрайды),
 * но генерация работает только с проверенной копией из {@link ParameterValidator#validate}.
 */
public class MapParameters {

    // --- Сид ---
    public boolean customSeed;
    public long seed;

    // --- Размер и топология ---
    public int width = 80;
    public int height = 50;
    public boolean wrapX = true;
    public boolean wrapY = false;

    // km на тайл по осям
    public double tileScaleX = 100.0;
    public double tileScaleY = 100.0;

    // --- Рельеф ---
    public double oceanFraction = 0.65;  // доля тайлов с elevation <= 0
    public double noiseScale = 4.0;      // сколько единиц шума укладывается в длинную сторону карты

    // --- Атмосферная циркуляция ---
    public double highPressureLatitude = 30.0; // градусы
    public double lowPressureLatitude = 60.0;  // градусы
    public boolean rotateWest;                 // меняет западные и восточные ветра местами

    // --- Температура, °C ---
    public double equatorTemperature = 28.0;
    public double poleTemperature = -25.0;
    public double temperatureLapseRate = 0.0065; // K/m

    // --- Осадки, мм/год ---
    public double equatorRainfall = 2000.0;
    public double equatorRainfallEvenness = 0.15;     // радианы
    public double midLatitudeRainfall = 1000.0;
    public double midLatitudeRainfallEvenness = 0.2;  // радианы
    public double rainfallOceanEFoldingDistance = 1500.0; // km

    // --- Орографические осадки ---
    public double condensationRateMultiplier = 25000.0;
    public double saturationPressureConst1 = 17.27;
    public double saturationPressureConst2 = 237.3;
    public double moistureScaleHeightDivisor = 5417.0;

    // --- Реки ---
    public double riverRainfallMultiplier = 0.0005;
    public double riverSlopeMultiplier = 50.0;

    // --- Типы тайлов (порядок важен: индекс типа в тайле) ---
    public List<TileType> tileTypes = new ArrayList<>();

    /** Глубокая копия: типы тайлов тоже копируются. */
    public MapParameters copy() {
        MapParameters c = new MapParameters();
        c.customSeed = customSeed;
        c.seed = seed;
        c.width = width;
        c.height = height;
        c.wrapX = wrapX;
        c.wrapY = wrapY;
        c.tileScaleX = tileScaleX;
        c.tileScaleY = tileScaleY;
        c.oceanFraction = oceanFraction;
        c.noiseScale = noiseScale;
        c.highPressureLatitude = highPressureLatitude;
        c.lowPressureLatitude = lowPressureLatitude;
        c.rotateWest = rotateWest;
        c.equatorTemperature = equatorTemperature;
        c.poleTemperature = poleTemperature;
        c.temperatureLapseRate = temperatureLapseRate;
        c.equatorRainfall = equatorRainfall;
        c.equatorRainfallEvenness = equatorRainfallEvenness;
        c.midLatitudeRainfall = midLatitudeRainfall;
        c.midLatitudeRainfallEvenness = midLatitudeRainfallEvenness;
        c.rainfallOceanEFoldingDistance = rainfallOceanEFoldingDistance;
        c.condensationRateMultiplier = condensationRateMultiplier;
        c.saturationPressureConst1 = saturationPressureConst1;
        c.saturationPressureConst2 = saturationPressureConst2;
        c.moistureScaleHeightDivisor = moistureScaleHeightDivisor;
        c.riverRainfallMultiplier = riverRainfallMultiplier;
        c.riverSlopeMultiplier = riverSlopeMultiplier;
        c.tileTypes = new ArrayList<>();
        if (tileTypes != null) {
            for (TileType t : tileTypes) {
                c.tileTypes.add(t.copy());
            }
        }
        return c;
    }

    /** Наибольшая верхняя граница высоты среди всех типов, -inf если типов нет. */
    public double maxTileTypeElevation() {
        double max = Double.NEGATIVE_INFINITY;
        if (tileTypes == null) return max;
        for (TileType t : tileTypes) {
            max = Math.max(max, t.maxElevation());
        }
        return max;
    }
}

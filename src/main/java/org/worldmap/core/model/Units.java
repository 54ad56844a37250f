package org.worldmap.core.model;

/**
 * Физические константы и переводы единиц, общие для всех стадий.
 */
public final class Units {

    private Units() {}

    public static final double CELSIUS_TO_KELVIN = 273.15;

    /** Нижняя граница температуры тайла: строго выше абсолютного нуля. */
    public static final double MIN_TEMPERATURE = Math.nextUp(-CELSIUS_TO_KELVIN);

    public static final double METERS_PER_KM = 1000.0;

    public static double toKelvin(double celsius) {
        return celsius + CELSIUS_TO_KELVIN;
    }
}

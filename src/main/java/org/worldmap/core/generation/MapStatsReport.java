package org.worldmap.core.generation;

import java.util.Comparator;
import java.util.Map;

public class MapStatsReport {

    public static void print(MapStats s) {
        System.out.println();
        System.out.println("========= MAP STATS =========");
        System.out.println("Tiles: " + s.tileCount + ", ocean=" + s.oceanCount
                + " (" + fmt(s.tileCount == 0 ? 0.0 : 100.0 * s.oceanCount / s.tileCount) + "%)");

        System.out.println();
        System.out.println("Elevation (m):  min=" + fmt(s.elevationMin) + " max=" + fmt(s.elevationMax)
                + " avg=" + fmt(s.elevationAvg));
        System.out.println("Temperature (C): min=" + fmt(s.tempMin) + " max=" + fmt(s.tempMax)
                + " avg=" + fmt(s.tempAvg));
        System.out.println("Precip (mm/yr): min=" + fmt(s.precipMin) + " max=" + fmt(s.precipMax)
                + " avg=" + fmt(s.precipAvg));

        System.out.println("Rivers: corners=" + s.riverCorners + " links=" + s.riverLinks
                + " ends=" + s.riverEnds);

        System.out.println();
        System.out.println("Tile types (top):");
        s.typeCounts.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.reverseOrder()))
                .limit(12)
                .forEach(e -> System.out.println("  " + pad(e.getKey()) + " : " + e.getValue()));
        System.out.println("  " + pad("<none>") + " : " + s.untypedCount);

        System.out.println("================================");
        System.out.println();

        System.out.println("Distance-to-ocean (km, land):");
        for (int i = 0; i < s.oceanDistCount.length; i++) {
            int count = s.oceanDistCount[i];
            if (count <= 0) continue;
            double p = s.oceanDistPrecip[i] / count;
            System.out.println("  " + label(i) + " : tiles=" + count + " P=" + fmt(p));
        }
        System.out.println();
    }

    private static String label(int bucket) {
        double[] b = MapStats.OCEAN_DIST_BUCKETS_KM;
        if (bucket >= b.length) return ">" + (int) b[b.length - 1];
        return "<=" + (int) b[bucket];
    }

    private static String fmt(double v) {
        return String.format(java.util.Locale.US, "%.3f", v);
    }

    private static String pad(String name) {
        return String.format("%-18s", name == null ? "null" : name);
    }
}

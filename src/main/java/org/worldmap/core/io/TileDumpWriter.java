package org.worldmap.core.io;

import org.worldmap.core.model.RiverCorner;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.TileType;
import org.worldmap.core.model.config.ParameterWarning;
import org.worldmap.core.service.MapGenerationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * TSV debug dump of a generated map: one line per tile, then one line per river corner.
 * The previous two dumps of the same map are kept as _prev1 and _prev2.
 */
public class TileDumpWriter {

    public static final String TILE_COLUMNS =
            "id\tx\ty\televation\ttemperature\tprecipitation\tnearestOcean\ttype\ttypeName";
    public static final String RIVER_COLUMNS = "R\tcx\tcy\tmask";

    public static Path fileFor(Path outDir, long seed) {
        return outDir.resolve("debug_tiles_map_" + seed + ".tsv");
    }

    public static Path write(Path outDir, MapGenerationResult result) throws IOException {
        Files.createDirectories(outDir);
        Path out = fileFor(outDir, result.seed());
        TileGrid grid = result.grid();
        List<String> lines = new ArrayList<>(grid.size() + result.rivers().size() + 16);

        lines.add("# Map debug dump");
        lines.add("# generatedAtUtc=" + Instant.now());
        lines.add("# seed=" + result.seed());
        lines.add("# size=" + grid.width + "x" + grid.height);
        lines.add("# wrapX=" + grid.wrapX + " wrapY=" + grid.wrapY);
        lines.add("# tileScaleKm=" + fmt(grid.scaleX) + "x" + fmt(grid.scaleY));
        lines.add("# oceanFraction=" + fmt(result.parameters().oceanFraction));
        lines.add("# riverCorners=" + result.rivers().size());
        for (ParameterWarning w : result.warnings()) {
            lines.add("# warning=" + w);
        }
        lines.add(TILE_COLUMNS);

        for (Tile t : grid.tiles) {
            TileType type = result.typeOf(t);
            lines.add(t.id + "\t" +
                    t.x + "\t" +
                    t.y + "\t" +
                    fmt(t.elevation) + "\t" +
                    fmt(t.temperature()) + "\t" +
                    fmt(t.precipitation()) + "\t" +
                    t.nearestOcean + "\t" +
                    t.typeIndex + "\t" +
                    (type != null ? type.name : "")
            );
        }

        lines.add(RIVER_COLUMNS);
        for (RiverCorner c : result.rivers().corners()) {
            lines.add("R\t" + c.cx + "\t" + c.cy + "\t" + c.connections());
        }

        rotateDumpHistory(out);
        Files.write(
                out,
                lines,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
        );
        return out;
    }

    static void rotateDumpHistory(Path current) throws IOException {
        String name = current.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = (dot >= 0) ? name.substring(0, dot) : name;
        String ext = (dot >= 0) ? name.substring(dot) : "";

        Path prev1 = current.resolveSibling(base + "_prev1" + ext);
        Path prev2 = current.resolveSibling(base + "_prev2" + ext);

        Files.deleteIfExists(prev2);
        if (Files.exists(prev1)) {
            Files.move(prev1, prev2, StandardCopyOption.REPLACE_EXISTING);
        }
        if (Files.exists(current)) {
            Files.move(current, prev1, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.4f", v);
    }
}

package org.worldmap.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.worldmap.core.model.RiverCorner;
import org.worldmap.core.model.Tile;
import org.worldmap.core.model.TileGrid;
import org.worldmap.core.model.TileType;
import org.worldmap.core.service.MapGenerationResult;

/**
 * Compact JSON of a generated map.
 * Short-key schema:
 * sv = schemaVersion
 * p  = map meta
 * tt = tile types
 * t  = tiles, row-major (index = y * w + x)
 * r  = river corners
 *
 * p keys:
 * seed, w = width, h = height, wx = wrapX, wy = wrapY, sx/sy = km per tile, of = ocean fraction
 *
 * tt item format: [name, assetKey]
 * t item format:  [elevation, temperature, precipitation, typeIndex]
 * r item format:  [cx, cy, mask]  (mask bits: UP=1, DOWN=2, LEFT=4, RIGHT=8)
 */
public class MapSurfaceSerializer {

    public static final int SCHEMA_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String toJson(MapGenerationResult result) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toTree(result));
    }

    public static ObjectNode toTree(MapGenerationResult result) {
        TileGrid grid = result.grid();

        ObjectNode root = MAPPER.createObjectNode();
        root.put("sv", SCHEMA_VERSION);

        ObjectNode meta = root.putObject("p");
        meta.put("seed", result.seed());
        meta.put("w", grid.width);
        meta.put("h", grid.height);
        meta.put("wx", grid.wrapX);
        meta.put("wy", grid.wrapY);
        meta.put("sx", grid.scaleX);
        meta.put("sy", grid.scaleY);
        meta.put("of", result.parameters().oceanFraction);

        ArrayNode types = root.putArray("tt");
        for (TileType type : result.parameters().tileTypes) {
            ArrayNode tt = MAPPER.createArrayNode();
            tt.add(type.name);
            tt.add(type.assetKey);
            types.add(tt);
        }

        ArrayNode tiles = root.putArray("t");
        for (Tile t : grid.tiles) {
            ArrayNode row = MAPPER.createArrayNode();
            row.add(round2(t.elevation));
            row.add(round2(t.temperature()));
            row.add(round2(t.precipitation()));
            row.add(t.typeIndex);
            tiles.add(row);
        }

        ArrayNode rivers = root.putArray("r");
        for (RiverCorner c : result.rivers().corners()) {
            ArrayNode r = MAPPER.createArrayNode();
            r.add(c.cx);
            r.add(c.cy);
            r.add(c.connections());
            rivers.add(r);
        }
        return root;
    }

    private static double round2(double v) {
        // дальше 1e13 два знака после запятой double уже не хранит, а v * 100 может переполниться
        if (Math.abs(v) >= 1e13) return v;
        return Math.round(v * 100.0) / 100.0;
    }
}

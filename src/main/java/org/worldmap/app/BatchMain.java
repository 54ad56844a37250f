package org.worldmap.app;

import org.worldmap.core.generation.ConsoleStageListener;
import org.worldmap.core.generation.GenerationPipeline;
import org.worldmap.core.generation.StageProfile;
import org.worldmap.core.io.MapSurfaceSerializer;
import org.worldmap.core.io.TileDumpWriter;
import org.worldmap.core.model.config.LocalParamsLoader;
import org.worldmap.core.model.config.MapParameters;
import org.worldmap.core.model.config.MapPresets;
import org.worldmap.core.model.config.MapTuning;
import org.worldmap.core.service.MapGenerationResult;
import org.worldmap.core.service.MapGenerationService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Usage: BatchMain [count] [--seed N] [--out-dir DIR] [--width W] [--height H]
 * [--ocean F] [--params FILE] [--dump]
 * <p>
 * Map i of the batch uses seed + i. Without --seed the first seed comes from the
 * parameters (map.seed) or the clock.
 */
public class BatchMain {
    private static final String BATCH_LOG_NAME = "batch_generation.log";
    private static final Path DEFAULT_OUT_DIR = Paths.get("out");

    public static void main(String[] args) {
        int failed = run(args);
        if (failed > 0) {
            System.exit(1);
        }
    }

    /**
     * @return number of maps that failed
     */
    public static int run(String[] args) {
        int count = 1;
        List<String> positional = collectPositionalArgs(args);
        if (positional.size() >= 1) count = Math.max(1, Integer.parseInt(positional.get(0)));

        Path outDir = Paths.get(pick(findOptionValue(args, "--out-dir"), DEFAULT_OUT_DIR.toString()));
        Path batchLog = outDir.resolve(BATCH_LOG_NAME);
        boolean dump = hasFlag(args, "--dump");

        MapParameters params = buildParams(args);
        String seedArg = findOptionValue(args, "--seed");
        long firstSeed = (seedArg != null)
                ? Long.parseLong(seedArg.trim())
                : MapGenerationService.resolveSeed(params);

        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outDir.toAbsolutePath(), e);
        }

        MapGenerationService service = new MapGenerationService(
                new GenerationPipeline(StageProfile.full(), true, new ConsoleStageListener(), true));

        long batchStartMs = System.currentTimeMillis();
        int ok = 0;
        int fail = 0;
        appendBatchLog(batchLog, "[BATCH_START] count=" + count + " firstSeed=" + firstSeed
                + " size=" + params.width + "x" + params.height);

        for (int i = 0; i < count; i++) {
            long seed = firstSeed + i;
            long mapStartMs = System.currentTimeMillis();
            try {
                MapGenerationResult result = service.generate(params, seed);

                Path json = outDir.resolve("map_" + seed + ".json");
                String payload = MapSurfaceSerializer.toJson(result);
                Files.writeString(json, payload, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

                if (dump) {
                    Path tsv = TileDumpWriter.write(outDir, result);
                    System.out.println("[DUMP] OK seed=" + seed + " -> " + tsv);
                }

                ok++;
                appendBatchLog(batchLog, "[MAP_OK] seed=" + seed
                        + " bytes=" + payload.length()
                        + " rivers=" + result.rivers().size()
                        + " warnings=" + result.warnings().size()
                        + " durMs=" + (System.currentTimeMillis() - mapStartMs));
            } catch (Exception ex) {
                fail++;
                System.out.println("Failed to generate/save map seed=" + seed + ": " + ex.getMessage());
                appendBatchLog(batchLog, "[MAP_FAIL] seed=" + seed
                        + " msg=" + sanitizeLogMessage(ex.getMessage()));
            }
        }

        appendBatchLog(batchLog, "[BATCH_DONE] count=" + count
                + " ok=" + ok
                + " fail=" + fail
                + " durMs=" + (System.currentTimeMillis() - batchStartMs));
        return fail;
    }

    /**
     * Preset, then local properties file, then -Dmapgen.* overrides, then command-line options.
     */
    static MapParameters buildParams(String[] args) {
        MapParameters params = MapPresets.earthLike();

        String paramsFile = findOptionValue(args, "--params");
        if (paramsFile != null) {
            Path path = Paths.get(paramsFile.trim());
            if (!LocalParamsLoader.apply(params, path)) {
                throw new IllegalArgumentException("Params file not found: " + path.toAbsolutePath());
            }
        } else {
            LocalParamsLoader.apply(params);
        }
        MapTuning.applySystemOverrides(params);

        String width = findOptionValue(args, "--width");
        if (width != null) params.width = Integer.parseInt(width.trim());
        String height = findOptionValue(args, "--height");
        if (height != null) params.height = Integer.parseInt(height.trim());
        String ocean = findOptionValue(args, "--ocean");
        if (ocean != null) params.oceanFraction = Double.parseDouble(ocean.trim());
        return params;
    }

    private static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String a : args) {
            if (flag.equals(a)) return true;
        }
        return false;
    }

    private static List<String> collectPositionalArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (isOptionWithValue(token)) {
                i++;
                continue;
            }
            if (token.startsWith("--")) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    private static boolean isOptionWithValue(String token) {
        return "--seed".equals(token)
                || "--out-dir".equals(token)
                || "--width".equals(token)
                || "--height".equals(token)
                || "--ocean".equals(token)
                || "--params".equals(token);
    }

    private static String pick(String candidate, String fallback) {
        if (candidate == null) return fallback;
        String trimmed = candidate.trim();
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    private static synchronized void appendBatchLog(Path file, String line) {
        String msg = Instant.now() + " " + line + System.lineSeparator();
        try {
            Files.writeString(file, msg, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // the batch keeps going without its log
            System.out.println("[WARN] Failed to append batch log " + file + ": " + e.getMessage());
        }
    }

    private static String sanitizeLogMessage(String s) {
        if (s == null) return "";
        return s.replace('\n', ' ').replace('\r', ' ').trim();
    }
}

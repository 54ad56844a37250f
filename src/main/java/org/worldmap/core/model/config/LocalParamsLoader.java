package org.worldmap.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public final class LocalParamsLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "mapgen.local.properties");

    public static final String PATH_PROPERTY = "mapgen.params.path";
    public static final String PATH_ENV = "MAPGEN_PARAMS_PATH";

    private LocalParamsLoader() {
    }

    /**
     * Applies the local properties file if it exists.
     *
     * @return true if a file was read
     */
    public static boolean apply(MapParameters params) {
        return apply(params, resolvePath());
    }

    public static boolean apply(MapParameters params, Path path) {
        if (!Files.exists(path)) {
            return false;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local map params: " + path.toAbsolutePath(), e);
        }

        MapTuning.apply(params, props::getProperty);
        return true;
    }

    static Path resolvePath() {
        String override = pick(
                System.getProperty(PATH_PROPERTY),
                System.getenv(PATH_ENV)
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}

package com.proxynode.core.engine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the directory holding the engine's geo-data files
 * ({@code geoip.dat}, {@code geosite.dat}).
 * <p>
 * Resolution order: the explicitly configured directory, then the
 * {@value #ASSET_ENV} environment variable, then the first of
 * {@link #CANDIDATE_PATHS} that contains {@value #MARKER_FILE}. Runs once at
 * startup; the result is passed to the engine provider rather than stored
 * globally.
 * </p>
 */
public class GeoAssetLocator {

    private static final Logger log = LoggerFactory.getLogger(GeoAssetLocator.class);

    public static final String ASSET_ENV = "XRAY_LOCATION_ASSET";
    public static final String MARKER_FILE = "geoip.dat";
    public static final List<String> CANDIDATE_PATHS = List.of(
            "/usr/local/share/xray",
            "/usr/share/xray",
            "/opt/xray",
            ".");

    private final List<String> candidates;

    public GeoAssetLocator() {
        this(CANDIDATE_PATHS);
    }

    GeoAssetLocator(List<String> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    /**
     * @param configured Directory from node configuration, may be null.
     * @return The asset directory, or empty if none was configured or found.
     */
    public Optional<Path> locate(String configured) {
        if (configured != null && !configured.isBlank()) {
            return Optional.of(Paths.get(configured));
        }

        String fromEnv = getEnv(ASSET_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(Paths.get(fromEnv));
        }

        for (String candidate : candidates) {
            Path dir = Paths.get(candidate);
            if (Files.isRegularFile(dir.resolve(MARKER_FILE))) {
                log.info("Using geo assets from {}", dir.toAbsolutePath());
                return Optional.of(dir);
            }
        }

        log.warn("No geo asset directory found (checked {})", candidates);
        return Optional.empty();
    }

    /**
     * Retrieves an environment variable. Overridable for testing.
     *
     * @param name Name of the environment variable.
     * @return The variable's value.
     */
    String getEnv(String name) {
        return System.getenv(name);
    }
}

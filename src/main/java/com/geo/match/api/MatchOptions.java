package com.geo.match.api;

import com.geo.match.core.model.JoinMode;
import com.geo.match.geocode.FetchConfig;

import java.nio.file.Path;

/**
 * Options for fetch and merge runs.
 * Configures join semantics, match radius, exclusivity and output locations.
 */
public class MatchOptions {

    private static final double DEFAULT_RADIUS_MILES = 0.25;
    private static final String DEFAULT_MATCHES_FILE_NAME = "matches.csv";
    private static final String DEFAULT_COORDS_FILE_SUFFIX = "_coords.csv";

    private final JoinMode joinMode;
    private final boolean exclusive;
    private final double radiusMiles;
    private final Path outputDirectory;
    private final String matchesFileName;
    private final String coordsFileSuffix;
    private final FetchConfig fetchConfig;

    private MatchOptions(Builder builder) {
        this.joinMode = builder.joinMode;
        this.exclusive = builder.exclusive;
        this.radiusMiles = builder.radiusMiles;
        this.outputDirectory = builder.outputDirectory;
        this.matchesFileName = builder.matchesFileName;
        this.coordsFileSuffix = builder.coordsFileSuffix;
        this.fetchConfig = builder.fetchConfig;
    }

    public JoinMode getJoinMode() {
        return joinMode;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    public double getRadiusMiles() {
        return radiusMiles;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public String getMatchesFileName() {
        return matchesFileName;
    }

    public String getCoordsFileSuffix() {
        return coordsFileSuffix;
    }

    public FetchConfig getFetchConfig() {
        return fetchConfig;
    }

    /**
     * Path of the merged output file.
     */
    public Path matchesPath() {
        return outputDirectory.resolve(matchesFileName);
    }

    /**
     * Path of the geocoded copy of {@code source}: its base name without extension
     * plus the coordinates suffix, in the output directory.
     */
    public Path coordsPath(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return outputDirectory.resolve(stem + coordsFileSuffix);
    }

    /**
     * Creates default options: left join, exclusive, 0.25 mile radius, files in the working directory.
     */
    public static MatchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialised from these options.
     */
    public Builder toBuilder() {
        return new Builder()
                .joinMode(joinMode)
                .exclusive(exclusive)
                .radiusMiles(radiusMiles)
                .outputDirectory(outputDirectory)
                .matchesFileName(matchesFileName)
                .coordsFileSuffix(coordsFileSuffix)
                .fetchConfig(fetchConfig);
    }

    @Override
    public String toString() {
        return "Radius: " + radiusMiles + "\n"
                + "MatchMode: " + joinMode + "\n"
                + "Exclusive: " + exclusive;
    }

    public static class Builder {
        private JoinMode joinMode = JoinMode.LEFT;
        private boolean exclusive = true;
        private double radiusMiles = DEFAULT_RADIUS_MILES;
        private Path outputDirectory = Path.of("");
        private String matchesFileName = DEFAULT_MATCHES_FILE_NAME;
        private String coordsFileSuffix = DEFAULT_COORDS_FILE_SUFFIX;
        private FetchConfig fetchConfig = FetchConfig.defaults();

        public Builder joinMode(JoinMode joinMode) {
            if (joinMode == null) {
                throw new IllegalArgumentException("joinMode must not be null");
            }
            this.joinMode = joinMode;
            return this;
        }

        public Builder exclusive(boolean exclusive) {
            this.exclusive = exclusive;
            return this;
        }

        public Builder radiusMiles(double radiusMiles) {
            if (!(radiusMiles > 0) || Double.isInfinite(radiusMiles)) {
                throw new IllegalArgumentException("radiusMiles must be a positive finite number");
            }
            this.radiusMiles = radiusMiles;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory != null ? outputDirectory : Path.of("");
            return this;
        }

        public Builder matchesFileName(String matchesFileName) {
            if (matchesFileName == null || matchesFileName.isBlank()) {
                throw new IllegalArgumentException("matchesFileName must not be blank");
            }
            this.matchesFileName = matchesFileName;
            return this;
        }

        public Builder coordsFileSuffix(String coordsFileSuffix) {
            if (coordsFileSuffix == null || coordsFileSuffix.isBlank()) {
                throw new IllegalArgumentException("coordsFileSuffix must not be blank");
            }
            this.coordsFileSuffix = coordsFileSuffix;
            return this;
        }

        public Builder fetchConfig(FetchConfig fetchConfig) {
            this.fetchConfig = fetchConfig != null ? fetchConfig : FetchConfig.defaults();
            return this;
        }

        public MatchOptions build() {
            return new MatchOptions(this);
        }
    }
}

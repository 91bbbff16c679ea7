package com.geo.match.cli;

import com.geo.match.api.GeoMatchSession;
import com.geo.match.api.MatchOptions;
import com.geo.match.bulk.ProgressBarFactory;
import com.geo.match.cache.CacheConfig;
import com.geo.match.cache.GeocodeCache;
import com.geo.match.exception.GeoMatchException;
import com.geo.match.geocode.GeocodeFetcher;
import com.geo.match.geocode.GoogleGeocodingProvider;
import com.geo.match.matching.MatchEngine;
import com.geo.match.merge.MergeAccumulator;
import com.geo.match.metrics.MetricsService;
import com.geo.match.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point: {@code geomatch [-k <api-key>] <file> [<file> ...]}.
 *
 * <p>The API key falls back to the {@code API_KEY} environment variable. Without a
 * key the shell still starts, but {@code fetch} is unavailable.</p>
 */
public class GeoMatchApplication {
    private static final Logger log = LoggerFactory.getLogger(GeoMatchApplication.class);

    static final String API_KEY_ENV = "API_KEY";

    public static void main(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args, System.getenv(API_KEY_ENV));
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: geomatch [-k <api-key>] <file> [<file> ...]");
            System.err.println();
            System.err.println("Options:");
            System.err.println("  -k <api-key>   Google geocoding API key (defaults to $" + API_KEY_ENV + ")");
            System.exit(1);
            return;
        }

        MeterRegistry registry = new SimpleMeterRegistry();
        MetricsService metrics = new MicrometerMetricsService(registry);
        GeoMatchSession session = createSession(arguments, metrics);

        for (Path file : arguments.files()) {
            try {
                session.addTable(file);
            } catch (GeoMatchException e) {
                System.err.println("Error: " + e.getMessage());
                System.exit(1);
                return;
            }
        }
        if (arguments.apiKey() == null) {
            System.err.println("Warning: no API key given (-k or $" + API_KEY_ENV + "), fetch is disabled");
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            new GeoMatchShell(session, in, System.out).run();
        } catch (IOException e) {
            log.error("shell.failed error={}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } finally {
            logMetricsSummary(registry);
        }
    }

    static GeoMatchSession createSession(Arguments arguments, MetricsService metrics) {
        GeocodeFetcher fetcher = null;
        if (arguments.apiKey() != null) {
            fetcher = GeocodeFetcher.builder()
                    .provider(GoogleGeocodingProvider.builder().apiKey(arguments.apiKey()).build())
                    .cache(GeocodeCache.from(CacheConfig.defaults()))
                    .metrics(metrics)
                    .build();
        }
        boolean progress = !log.isInfoEnabled();
        return GeoMatchSession.builder()
                .fetcher(fetcher)
                .mergeAccumulator(new MergeAccumulator(new MatchEngine(), metrics))
                .progressBars(new ProgressBarFactory(progress))
                .options(MatchOptions.defaults())
                .build();
    }

    static void logMetricsSummary(MeterRegistry registry) {
        for (Meter meter : registry.getMeters()) {
            StringBuilder values = new StringBuilder();
            for (Measurement measurement : meter.measure()) {
                if (values.length() > 0) {
                    values.append(' ');
                }
                values.append(measurement.getStatistic().getTagValueRepresentation())
                        .append('=').append(measurement.getValue());
            }
            log.info("metrics.summary name={} tags={} {}", meter.getId().getName(), meter.getId().getTags(), values);
        }
    }

    /**
     * Parsed command line.
     *
     * @param files  tables to load, in order
     * @param apiKey geocoding API key, or null
     */
    record Arguments(List<Path> files, String apiKey) {

        static Arguments parse(String[] args, String environmentKey) {
            List<Path> files = new ArrayList<>();
            String apiKey = null;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("-k".equals(arg) || "--api-key".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException(arg + " requires a value");
                    }
                    apiKey = args[++i];
                    continue;
                }
                files.add(Path.of(arg));
            }
            if (files.isEmpty()) {
                throw new IllegalArgumentException("at least one file is required");
            }
            if (apiKey == null && environmentKey != null && !environmentKey.isBlank()) {
                apiKey = environmentKey;
            }
            return new Arguments(List.copyOf(files), apiKey);
        }
    }
}

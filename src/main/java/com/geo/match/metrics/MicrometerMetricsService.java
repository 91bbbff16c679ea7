package com.geo.match.metrics;

import com.geo.match.core.model.JoinMode;
import com.geo.match.geocode.GeocodeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code geocode.request.duration} - Timer</li>
 *   <li>{@code geocode.outcome} - Counter (tag: status)</li>
 *   <li>{@code geocode.cache.hit} / {@code geocode.cache.miss} - Counter</li>
 *   <li>{@code merge.duration} - Timer (tag: mode)</li>
 *   <li>{@code merge.matches} - Counter (tag: mode)</li>
 *   <li>{@code merge.output.rows} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer geocodeTimer;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final DistributionSummary outputRowsSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.geocodeTimer = Timer.builder("geocode.request.duration")
                .description("Duration of geocoding requests")
                .register(registry);
        this.cacheHitCounter = Counter.builder("geocode.cache.hit")
                .description("Number of addresses answered from the geocode cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("geocode.cache.miss")
                .description("Number of addresses sent to the geocoding provider")
                .register(registry);
        this.outputRowsSummary = DistributionSummary.builder("merge.output.rows")
                .description("Rows written per merge")
                .register(registry);
    }

    @Override
    public void recordGeocodeDuration(Duration duration) {
        geocodeTimer.record(duration);
    }

    @Override
    public void incrementGeocodeOutcome(GeocodeStatus status) {
        String key = "outcome:" + status.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("geocode.outcome")
                        .description("Geocoded rows by outcome")
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordMergeDuration(JoinMode mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(mode.name(), k ->
                Timer.builder("merge.duration")
                        .description("Duration of merge operations")
                        .tag("mode", mode.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMatches(JoinMode mode, long count) {
        String key = "matches:" + mode.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("merge.matches")
                        .description("Rows matched during merges")
                        .tag("mode", mode.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordOutputRows(int rows) {
        outputRowsSummary.record(rows);
    }
}

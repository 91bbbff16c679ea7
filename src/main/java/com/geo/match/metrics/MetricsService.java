package com.geo.match.metrics;

import com.geo.match.core.model.JoinMode;
import com.geo.match.geocode.GeocodeStatus;

import java.time.Duration;

/**
 * Interface for recording geocoding and merge metrics.
 * The default {@link NoOpMetricsService} does nothing; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry.
 */
public interface MetricsService {

    void recordGeocodeDuration(Duration duration);

    void incrementGeocodeOutcome(GeocodeStatus status);

    void recordCacheHit();

    void recordCacheMiss();

    void recordMergeDuration(JoinMode mode, Duration duration);

    void incrementMatches(JoinMode mode, long count);

    void recordOutputRows(int rows);
}

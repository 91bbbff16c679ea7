package com.geo.match.metrics;

import com.geo.match.core.model.JoinMode;
import com.geo.match.geocode.GeocodeStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordGeocodeDuration(Duration duration) {
    }

    @Override
    public void incrementGeocodeOutcome(GeocodeStatus status) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordMergeDuration(JoinMode mode, Duration duration) {
    }

    @Override
    public void incrementMatches(JoinMode mode, long count) {
    }

    @Override
    public void recordOutputRows(int rows) {
    }
}

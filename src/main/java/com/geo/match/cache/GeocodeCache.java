package com.geo.match.cache;

import com.geo.match.geocode.GeocodeResult;

import java.util.Optional;

/**
 * Cache of geocoding outcomes keyed by formatted address.
 * Only definitive outcomes (resolved or not found) should be stored, so that
 * transient failures are retried on the next run.
 */
public interface GeocodeCache {

    Optional<GeocodeResult> get(String address);

    void put(String address, GeocodeResult result);

    long size();

    void clear();

    /**
     * Creates the cache described by the configuration.
     */
    static GeocodeCache from(CacheConfig config) {
        if (config == null || !config.enabled()) {
            return new NoOpGeocodeCache();
        }
        return new CaffeineGeocodeCache(config);
    }
}

package com.geo.match.cache;

import com.geo.match.geocode.GeocodeResult;

import java.util.Optional;

/**
 * No-op geocode cache. Every lookup misses.
 */
public class NoOpGeocodeCache implements GeocodeCache {

    @Override
    public Optional<GeocodeResult> get(String address) {
        return Optional.empty();
    }

    @Override
    public void put(String address, GeocodeResult result) {
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public void clear() {
    }
}

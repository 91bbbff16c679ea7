package com.geo.match.cache;

import com.geo.match.geocode.GeocodeResult;
import com.geo.match.geocode.GeocodeStatus;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Caffeine-backed geocode cache. Keys are compared ignoring case and surrounding whitespace.
 * Results other than {@link GeocodeStatus#RESOLVED} and {@link GeocodeStatus#NOT_FOUND}
 * are not stored.
 */
public class CaffeineGeocodeCache implements GeocodeCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineGeocodeCache.class);

    private final Cache<String, GeocodeResult> cache;

    public CaffeineGeocodeCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .build();
        log.info("CaffeineGeocodeCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<GeocodeResult> get(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key(address)));
    }

    @Override
    public void put(String address, GeocodeResult result) {
        if (address == null || result == null) {
            return;
        }
        if (result.status() != GeocodeStatus.RESOLVED && result.status() != GeocodeStatus.NOT_FOUND) {
            return;
        }
        cache.put(key(address), result);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    private static String key(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}

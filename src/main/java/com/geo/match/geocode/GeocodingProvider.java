package com.geo.match.geocode;

/**
 * Resolves a postal address to a location.
 *
 * <p>Implementations must be thread-safe: the fetcher calls them from many worker
 * threads at once. Expected failures (network errors, malformed responses, quota
 * exhaustion) are reported through {@link GeocodeResult#status()} rather than thrown.</p>
 */
public interface GeocodingProvider {

    /**
     * Geocodes one formatted address. Makes at most one external request.
     *
     * @param address single-line postal address
     * @return the outcome; never null
     */
    GeocodeResult geocode(String address);

    /**
     * Returns the name of this provider.
     */
    String getProviderName();
}

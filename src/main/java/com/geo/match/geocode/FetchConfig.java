package com.geo.match.geocode;

/**
 * Throughput limits for a geocoding run.
 *
 * @param requestsPerSecond rate at which requests are submitted
 * @param maxConcurrency    maximum requests in flight at once
 * @param workerThreads     size of the worker pool running requests
 */
public record FetchConfig(
        double requestsPerSecond,
        int maxConcurrency,
        int workerThreads
) {

    public static final double DEFAULT_REQUESTS_PER_SECOND = 30;
    public static final int DEFAULT_MAX_CONCURRENCY = 30;

    public FetchConfig {
        if (!(requestsPerSecond > 0)) {
            requestsPerSecond = DEFAULT_REQUESTS_PER_SECOND;
        }
        if (maxConcurrency <= 0) {
            maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        }
        if (workerThreads <= 0) {
            workerThreads = maxConcurrency;
        }
    }

    /**
     * Default limits: 30 requests per second, 30 in flight. The Google geocoding API
     * starts rejecting requests above 50 per second.
     */
    public static FetchConfig defaults() {
        return new FetchConfig(DEFAULT_REQUESTS_PER_SECOND, DEFAULT_MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY);
    }

    public static FetchConfig of(double requestsPerSecond, int maxConcurrency) {
        return new FetchConfig(requestsPerSecond, maxConcurrency, maxConcurrency);
    }
}

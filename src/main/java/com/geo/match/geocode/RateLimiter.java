package com.geo.match.geocode;

/**
 * Gates how fast work is submitted. Independent of how much work may run at once.
 */
@FunctionalInterface
public interface RateLimiter {

    /**
     * Blocks until the caller may submit one more unit of work.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void acquire() throws InterruptedException;

    /**
     * A limiter that never waits.
     */
    static RateLimiter unlimited() {
        return () -> {};
    }
}

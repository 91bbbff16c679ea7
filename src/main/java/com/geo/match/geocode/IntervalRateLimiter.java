package com.geo.match.geocode;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Fixed-interval ticker: permits are handed out no closer together than
 * {@code 1 / permitsPerSecond} seconds. The first permit is immediate.
 * Missed ticks are not made up in a burst.
 * Thread-safe using CAS operations.
 */
public class IntervalRateLimiter implements RateLimiter {

    private final long intervalNanos;
    private final LongSupplier clock;
    private final AtomicLong nextSlotNanos = new AtomicLong(Long.MIN_VALUE);

    public IntervalRateLimiter(double permitsPerSecond) {
        this(permitsPerSecond, System::nanoTime);
    }

    IntervalRateLimiter(double permitsPerSecond, LongSupplier clock) {
        if (!(permitsPerSecond > 0)) {
            throw new IllegalArgumentException("permitsPerSecond must be > 0");
        }
        this.intervalNanos = (long) (1_000_000_000.0 / permitsPerSecond);
        this.clock = clock;
    }

    @Override
    public void acquire() throws InterruptedException {
        long waitNanos = reserve();
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /**
     * Claims the next free slot and returns how long the caller must wait for it.
     */
    long reserve() {
        while (true) {
            long now = clock.getAsLong();
            long next = nextSlotNanos.get();
            long slot = Math.max(now, next);
            if (nextSlotNanos.compareAndSet(next, slot + intervalNanos)) {
                return slot - now;
            }
            // CAS failed, retry
        }
    }

    public long getIntervalNanos() {
        return intervalNanos;
    }
}

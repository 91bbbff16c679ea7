package com.geo.match.geocode;

import com.geo.match.bulk.ProgressCallback;
import com.geo.match.cache.GeocodeCache;
import com.geo.match.cache.NoOpGeocodeCache;
import com.geo.match.core.model.GeoPoint;
import com.geo.match.core.model.Table;
import com.geo.match.exception.ConfigurationException;
import com.geo.match.logging.LogContext;
import com.geo.match.metrics.MetricsService;
import com.geo.match.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Geocodes every row of a table and adds the results to it.
 *
 * <p>One task per row runs on a fixed worker pool. Submission is paced by a
 * {@link RateLimiter} and requests in flight are capped by a semaphore; the two
 * are independent. The caller blocks until every task has finished.</p>
 *
 * <p>Failures stay inside their row: a row whose lookup fails in any way ends up
 * with NaN coordinates and an empty normalized address, and its siblings carry on.
 * Quota exhaustion is logged once per run.</p>
 *
 * <p>Each distinct address is requested at most once per run: later rows with the
 * same address wait for the first request and reuse its answer.</p>
 *
 * Usage:
 * <pre>
 * GeocodeFetcher fetcher = GeocodeFetcher.builder()
 *     .provider(GoogleGeocodingProvider.builder().apiKey(key).build())
 *     .build();
 * FetchResult result = fetcher.fetch(table, FetchConfig.defaults(), ProgressCallback.NOOP);
 * </pre>
 */
public class GeocodeFetcher {
    private static final Logger log = LoggerFactory.getLogger(GeocodeFetcher.class);

    /**
     * Header of the column holding the provider's canonical address.
     */
    public static final String NORMALIZED_ADDRESS_HEADER = "norm_address";

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final GeocodingProvider provider;
    private final GeocodeCache cache;
    private final MetricsService metrics;
    private final RateLimiter rateLimiter;

    private GeocodeFetcher(Builder builder) {
        if (builder.provider == null) {
            throw new IllegalArgumentException("provider is required");
        }
        this.provider = builder.provider;
        this.cache = builder.cache != null ? builder.cache : new NoOpGeocodeCache();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.rateLimiter = builder.rateLimiter;
    }

    /**
     * Geocodes the table in place: sets one coordinate per row and puts a
     * {@value #NORMALIZED_ADDRESS_HEADER} column.
     *
     * @throws ConfigurationException if address line 1, city or state is unbound
     */
    public FetchResult fetch(Table table, FetchConfig config, ProgressCallback callback) {
        if (!table.readyToFetch()) {
            throw new ConfigurationException("Table " + table.getSource()
                    + " needs addr1, city and state bound before fetch");
        }
        FetchConfig cfg = config != null ? config : FetchConfig.defaults();
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (LogContext ctx = LogContext.forFetch(LogContext.generateCorrelationId(), table.getSource())) {
            log.info("fetch.started source={} rows={} provider={} rps={} maxConcurrency={}",
                    table.getSource(), table.rowCount(), provider.getProviderName(),
                    cfg.requestsPerSecond(), cfg.maxConcurrency());

            Instant start = Instant.now();
            Run run = new Run(table.rowCount(), cfg, cb);
            List<RowOutcome> outcomes = run.execute(table);
            Duration duration = Duration.between(start, Instant.now());

            apply(table, outcomes);
            FetchResult result = summarize(table, outcomes, duration);
            cb.onProgress(result.totalRows(), result.totalRows(), "Fetch completed");
            log.info("fetch.completed result={}", result);
            return result;
        }
    }

    private void apply(Table table, List<RowOutcome> outcomes) {
        List<GeoPoint> points = new ArrayList<>(outcomes.size());
        List<String> addresses = new ArrayList<>(outcomes.size());
        for (RowOutcome outcome : outcomes) {
            points.add(outcome.result().point());
            addresses.add(outcome.result().formattedAddress());
        }
        table.setCoordinates(points);
        table.putColumn(NORMALIZED_ADDRESS_HEADER, addresses);
    }

    private FetchResult summarize(Table table, List<RowOutcome> outcomes, Duration duration) {
        long resolved = 0, notFound = 0, quota = 0, failed = 0, skipped = 0, cacheHits = 0;
        List<FetchResult.RowError> errors = new ArrayList<>();
        for (int row = 0; row < outcomes.size(); row++) {
            RowOutcome outcome = outcomes.get(row);
            GeocodeResult result = outcome.result();
            if (outcome.fromCache()) {
                cacheHits++;
            }
            switch (result.status()) {
                case RESOLVED -> resolved++;
                case NOT_FOUND -> notFound++;
                case SKIPPED -> skipped++;
                case QUOTA_EXCEEDED -> {
                    quota++;
                    errors.add(new FetchResult.RowError(row, outcome.address(), result.status(), result.message()));
                }
                case FAILED -> {
                    failed++;
                    errors.add(new FetchResult.RowError(row, outcome.address(), result.status(), result.message()));
                }
            }
        }
        return new FetchResult(table.getSource(), outcomes.size(), resolved, notFound, quota, failed,
                skipped, cacheHits, errors, duration);
    }

    /**
     * State of one fetch run: the worker pool, admission gate, pacing and progress counter.
     */
    private final class Run {
        private final int rows;
        private final FetchConfig config;
        private final ProgressCallback callback;
        private final RateLimiter limiter;
        private final Semaphore gate;
        private final AtomicLong completed = new AtomicLong();
        private final AtomicBoolean quotaReported = new AtomicBoolean();
        private final Map<String, CompletableFuture<RowOutcome>> requested = new HashMap<>();

        Run(int rows, FetchConfig config, ProgressCallback callback) {
            this.rows = rows;
            this.config = config;
            this.callback = callback;
            this.limiter = rateLimiter != null ? rateLimiter : new IntervalRateLimiter(config.requestsPerSecond());
            this.gate = new Semaphore(config.maxConcurrency());
        }

        List<RowOutcome> execute(Table table) {
            ExecutorService executor = Executors.newFixedThreadPool(config.workerThreads(), workerThreadFactory());
            List<CompletableFuture<RowOutcome>> futures = new ArrayList<>(rows);
            try {
                boolean interrupted = false;
                for (int row = 0; row < rows; row++) {
                    Optional<String> address = table.formattedAddress(row);
                    if (address.isEmpty()) {
                        futures.add(CompletableFuture.completedFuture(finish(null, GeocodeResult.skipped(), false)));
                        continue;
                    }
                    String addr = address.get();
                    Optional<GeocodeResult> cached = cache.get(addr);
                    if (cached.isPresent()) {
                        metrics.recordCacheHit();
                        futures.add(CompletableFuture.completedFuture(finish(addr, cached.get(), true)));
                        continue;
                    }
                    CompletableFuture<RowOutcome> pending = requested.get(requestKey(addr));
                    if (pending != null) {
                        // same address already requested in this run: share its answer
                        metrics.recordCacheHit();
                        futures.add(pending.thenApply(first -> finish(addr, first.result(), true)));
                        continue;
                    }
                    if (!interrupted) {
                        try {
                            limiter.acquire();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            interrupted = true;
                            log.warn("fetch.interrupted submitted={} rows={}", futures.size(), rows);
                        }
                    }
                    if (interrupted) {
                        futures.add(CompletableFuture.completedFuture(
                                finish(addr, GeocodeResult.failed("Interrupted before submission"), false)));
                        continue;
                    }
                    metrics.recordCacheMiss();
                    CompletableFuture<RowOutcome> request = CompletableFuture.supplyAsync(() -> resolve(addr), executor);
                    requested.put(requestKey(addr), request);
                    futures.add(request);
                }

                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
                return futures.stream().map(CompletableFuture::join).toList();
            } finally {
                shutdown(executor);
            }
        }

        private RowOutcome resolve(String address) {
            GeocodeResult result;
            try {
                gate.acquire();
                try {
                    Instant start = Instant.now();
                    result = provider.geocode(address);
                    metrics.recordGeocodeDuration(Duration.between(start, Instant.now()));
                } finally {
                    gate.release();
                }
                if (result == null) {
                    result = GeocodeResult.failed("Provider returned no result");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result = GeocodeResult.failed("Interrupted");
            } catch (RuntimeException e) {
                log.debug("geocode.error address='{}' error={}", address, e.toString());
                result = GeocodeResult.failed(e.toString());
            }
            return finish(address, result, false);
        }

        /**
         * Records a row's outcome. Failures of the cache, metrics or progress callback
         * are logged and never change the row's result.
         */
        private RowOutcome finish(String address, GeocodeResult result, boolean fromCache) {
            try {
                metrics.incrementGeocodeOutcome(result.status());
                if (!fromCache && address != null) {
                    cache.put(address, result);
                }
            } catch (RuntimeException e) {
                log.warn("geocode.recordFailed address='{}' error={}", address, e.toString());
            }
            if (result.status() == GeocodeStatus.QUOTA_EXCEEDED && quotaReported.compareAndSet(false, true)) {
                log.warn("geocode.quotaExceeded provider={} message='{}' - remaining rows will likely fail too",
                        provider.getProviderName(), result.message());
            }
            log.debug("geocode.row status={} address='{}'", result.status(), address);
            long done = completed.incrementAndGet();
            try {
                callback.onProgress(done, rows, null);
            } catch (RuntimeException e) {
                log.warn("geocode.progressFailed processed={} error={}", done, e.toString());
            }
            return new RowOutcome(address, result, fromCache);
        }
    }

    private static String requestKey(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "geocode-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record RowOutcome(String address, GeocodeResult result, boolean fromCache) {}

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GeocodingProvider provider;
        private GeocodeCache cache;
        private MetricsService metrics;
        private RateLimiter rateLimiter;

        public Builder provider(GeocodingProvider provider) {
            this.provider = provider;
            return this;
        }

        public Builder cache(GeocodeCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Overrides the pacing otherwise derived from {@link FetchConfig#requestsPerSecond()}.
         */
        public Builder rateLimiter(RateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public GeocodeFetcher build() {
            return new GeocodeFetcher(this);
        }
    }
}

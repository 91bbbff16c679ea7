package com.geo.match.geocode;

import com.geo.match.bulk.ProgressCallback;
import com.geo.match.cache.CacheConfig;
import com.geo.match.cache.CaffeineGeocodeCache;
import com.geo.match.core.model.ColumnRole;
import com.geo.match.core.model.GeoPoint;
import com.geo.match.core.model.Table;
import com.geo.match.exception.ConfigurationException;
import com.geo.match.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GeocodeFetcher Tests")
class GeocodeFetcherTest {

    @Mock
    private GeocodingProvider provider;

    @Mock
    private MetricsService metrics;

    private static Table addressTable(List<List<String>> rows) {
        Table table = new Table("stores.csv", ',', List.of("addr1", "city", "state"));
        rows.forEach(table::addRow);
        table.bind(ColumnRole.ADDRESS_LINE1, "addr1");
        table.bind(ColumnRole.CITY, "city");
        table.bind(ColumnRole.STATE, "state");
        return table;
    }

    private GeocodeFetcher fetcher() {
        return GeocodeFetcher.builder()
                .provider(provider)
                .metrics(metrics)
                .rateLimiter(RateLimiter.unlimited())
                .build();
    }

    @Nested
    @DisplayName("Row outcomes")
    class RowOutcomes {

        private Table table;

        @BeforeEach
        void setUp() {
            table = addressTable(List.of(
                    List.of("1 Main St", "Springfield", "IL"),
                    List.of("", "Springfield", "IL"),
                    List.of("9 Elm St", "Shelbyville", "IL")));
        }

        @Test
        @DisplayName("Resolved rows should get coordinates and a normalized address")
        void resolvedRows() {
            when(provider.geocode("1 Main St Springfield IL"))
                    .thenReturn(GeocodeResult.resolved(39.8, -89.6, "1 Main St, Springfield, IL 62701, USA"));
            when(provider.geocode("9 Elm St Shelbyville IL"))
                    .thenReturn(GeocodeResult.notFound());

            FetchResult result = fetcher().fetch(table, FetchConfig.of(100, 4), ProgressCallback.NOOP);

            assertEquals(1, result.resolved());
            assertEquals(1, result.notFound());
            assertEquals(1, result.skipped());
            assertEquals(new GeoPoint(39.8, -89.6), table.coordinate(0));
            assertFalse(table.coordinate(1).isResolved());
            assertFalse(table.coordinate(2).isResolved());

            int normalized = table.columnIndex(GeocodeFetcher.NORMALIZED_ADDRESS_HEADER);
            assertEquals("1 Main St, Springfield, IL 62701, USA", table.value(0, normalized));
            assertEquals("", table.value(1, normalized));
            assertEquals("", table.value(2, normalized));
            assertTrue(table.readyToMatch());
        }

        @Test
        @DisplayName("Blank addresses should never reach the provider")
        void blankRowsSkipped() {
            Table blanks = addressTable(List.of(
                    List.of("", "", ""),
                    List.of("  ", "Springfield", "IL")));

            FetchResult result = fetcher().fetch(blanks, FetchConfig.defaults(), ProgressCallback.NOOP);

            verify(provider, never()).geocode(anyString());
            assertEquals(2, result.skipped());
            assertEquals(2, blanks.rowCount());
        }

        @Test
        @DisplayName("A provider exception should fail only its own row")
        void exceptionDegradesRow() {
            when(provider.geocode("1 Main St Springfield IL")).thenThrow(new IllegalStateException("boom"));
            when(provider.geocode("9 Elm St Shelbyville IL"))
                    .thenReturn(GeocodeResult.resolved(39.4, -88.8, "9 Elm St"));

            FetchResult result = fetcher().fetch(table, FetchConfig.of(100, 4), ProgressCallback.NOOP);

            assertEquals(1, result.failed());
            assertEquals(1, result.resolved());
            assertFalse(table.coordinate(0).isResolved());
            assertEquals(new GeoPoint(39.4, -88.8), table.coordinate(2));
            assertEquals(1, result.errors().size());
            assertEquals(0, result.errors().get(0).row());
        }

        @Test
        @DisplayName("Quota exhaustion should be counted and reported per row")
        void quotaExceeded() {
            when(provider.geocode(anyString())).thenReturn(GeocodeResult.quotaExceeded("OVER_QUERY_LIMIT"));

            FetchResult result = fetcher().fetch(table, FetchConfig.of(100, 4), ProgressCallback.NOOP);

            assertTrue(result.isQuotaExceeded());
            assertEquals(2, result.quotaExceeded());
            assertEquals(2, result.unresolved() - result.skipped());
            verify(metrics, times(2)).incrementGeocodeOutcome(GeocodeStatus.QUOTA_EXCEEDED);
        }

        @Test
        @DisplayName("Progress should reach the row count")
        void progressReachesRowCount() {
            when(provider.geocode(anyString())).thenReturn(GeocodeResult.notFound());
            AtomicLong maxProcessed = new AtomicLong();
            ConcurrentLinkedQueue<Long> totals = new ConcurrentLinkedQueue<>();

            fetcher().fetch(table, FetchConfig.of(100, 2), (processed, total, message) -> {
                maxProcessed.accumulateAndGet(processed, Math::max);
                totals.add(total);
            });

            assertEquals(3, maxProcessed.get());
            assertTrue(totals.stream().allMatch(t -> t == 3));
        }

        @Test
        @DisplayName("Each submitted request should take one rate limiter permit")
        void rateLimiterPerRequest() {
            when(provider.geocode(anyString())).thenReturn(GeocodeResult.notFound());
            AtomicInteger permits = new AtomicInteger();
            GeocodeFetcher fetcher = GeocodeFetcher.builder()
                    .provider(provider)
                    .rateLimiter(permits::incrementAndGet)
                    .build();

            fetcher.fetch(table, FetchConfig.of(100, 4), ProgressCallback.NOOP);

            assertEquals(2, permits.get());
        }
    }

    @Test
    @DisplayName("A table without address roles should be rejected")
    void notReady() {
        Table table = new Table("x.csv", ',', List.of("addr1"));
        table.addRow(List.of("1 Main St"));

        assertThrows(ConfigurationException.class,
                () -> fetcher().fetch(table, FetchConfig.defaults(), ProgressCallback.NOOP));
        verify(provider, never()).geocode(anyString());
    }

    @Test
    @DisplayName("A second fetch should be answered from the cache")
    void cacheAnswersRepeatFetch() {
        when(provider.geocode(anyString())).thenReturn(GeocodeResult.resolved(1.0, 2.0, "x"));
        Table table = addressTable(List.of(
                List.of("1 Main St", "Springfield", "IL"),
                List.of("2 Main St", "Springfield", "IL")));
        GeocodeFetcher fetcher = GeocodeFetcher.builder()
                .provider(provider)
                .metrics(metrics)
                .cache(new CaffeineGeocodeCache(CacheConfig.defaults()))
                .rateLimiter(RateLimiter.unlimited())
                .build();

        fetcher.fetch(table, FetchConfig.of(100, 2), ProgressCallback.NOOP);
        FetchResult second = fetcher.fetch(table, FetchConfig.of(100, 2), ProgressCallback.NOOP);

        verify(provider, times(2)).geocode(anyString());
        assertEquals(2, second.cacheHits());
        assertEquals(2, second.resolved());
        assertEquals(List.of("addr1", "city", "state", GeocodeFetcher.NORMALIZED_ADDRESS_HEADER), table.getHeaders());
        verify(metrics, times(2)).recordCacheHit();
    }

    @Test
    @DisplayName("In-flight requests should never exceed the concurrency cap")
    void concurrencyCap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        GeocodingProvider slowProvider = new GeocodingProvider() {
            @Override
            public GeocodeResult geocode(String address) {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    inFlight.decrementAndGet();
                }
                return GeocodeResult.notFound();
            }

            @Override
            public String getProviderName() {
                return "slow";
            }
        };
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(List.of(i + " Main St", "Springfield", "IL"));
        }
        Table table = addressTable(rows);
        GeocodeFetcher fetcher = GeocodeFetcher.builder()
                .provider(slowProvider)
                .rateLimiter(RateLimiter.unlimited())
                .build();

        FetchResult result = fetcher.fetch(table, new FetchConfig(1000, 3, 8), ProgressCallback.NOOP);

        assertEquals(20, result.notFound());
        assertTrue(peak.get() <= 3, "peak in-flight was " + peak.get());
        assertTrue(peak.get() >= 1);
    }

    @Test
    @DisplayName("Rows sharing an address should cost a single provider request")
    void duplicateAddressesRequestedOnce() {
        AtomicInteger calls = new AtomicInteger();
        GeocodingProvider slowProvider = new GeocodingProvider() {
            @Override
            public GeocodeResult geocode(String address) {
                calls.incrementAndGet();
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return GeocodeResult.resolved(39.8, -89.6, "1 Main St, Springfield, IL");
            }

            @Override
            public String getProviderName() {
                return "slow";
            }
        };
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rows.add(List.of(i % 2 == 0 ? "1 Main St" : "1 MAIN ST ", "Springfield", "IL"));
        }
        Table table = addressTable(rows);
        GeocodeFetcher fetcher = GeocodeFetcher.builder()
                .provider(slowProvider)
                .cache(new CaffeineGeocodeCache(CacheConfig.defaults()))
                .rateLimiter(RateLimiter.unlimited())
                .build();

        FetchResult result = fetcher.fetch(table, FetchConfig.of(100, 5), ProgressCallback.NOOP);

        assertEquals(1, calls.get());
        assertEquals(5, result.resolved());
        assertEquals(4, result.cacheHits());
        for (int row = 0; row < 5; row++) {
            assertEquals(new GeoPoint(39.8, -89.6), table.coordinate(row));
        }
    }

    @Test
    @DisplayName("A failed request should be shared by duplicate rows without being cached")
    void duplicateFailureNotCached() {
        when(provider.geocode(anyString())).thenReturn(GeocodeResult.failed("timeout"));
        Table table = addressTable(List.of(
                List.of("1 Main St", "Springfield", "IL"),
                List.of("1 Main St", "Springfield", "IL")));
        CaffeineGeocodeCache cache = new CaffeineGeocodeCache(CacheConfig.defaults());
        GeocodeFetcher fetcher = GeocodeFetcher.builder()
                .provider(provider)
                .cache(cache)
                .rateLimiter(RateLimiter.unlimited())
                .build();

        FetchResult result = fetcher.fetch(table, FetchConfig.of(100, 2), ProgressCallback.NOOP);

        verify(provider, times(1)).geocode(anyString());
        assertEquals(2, result.failed());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("A throwing progress callback should not fail any row")
    void failingCallbackIsolated() {
        when(provider.geocode(anyString())).thenReturn(GeocodeResult.resolved(1.0, 2.0, "x"));
        Table table = addressTable(List.of(
                List.of("1 Main St", "Springfield", "IL"),
                List.of("2 Main St", "Springfield", "IL"),
                List.of("3 Main St", "Springfield", "IL")));

        FetchResult result = fetcher().fetch(table, FetchConfig.of(100, 3), (processed, total, message) -> {
            if (message == null) {
                throw new IllegalStateException("progress display closed");
            }
        });

        assertEquals(3, result.resolved());
        assertEquals(0, result.failed());
        assertEquals(new GeoPoint(1.0, 2.0), table.coordinate(2));
    }

    @Test
    @DisplayName("The builder should require a provider")
    void builderRequiresProvider() {
        assertThrows(IllegalArgumentException.class, () -> GeocodeFetcher.builder().build());
    }
}

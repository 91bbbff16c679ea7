package com.geo.match.geocode;

import java.time.Duration;
import java.util.List;

/**
 * Result of geocoding every row of one table.
 *
 * @param source        table source
 * @param totalRows     rows in the table
 * @param resolved      rows that received a location
 * @param notFound      rows the provider had no result for
 * @param quotaExceeded rows rejected because the API quota ran out
 * @param failed        rows that failed for any other reason
 * @param skipped       rows with no usable address
 * @param cacheHits     rows answered from the cache
 * @param errors        detail for failed and quota-rejected rows
 * @param duration      wall-clock time of the run
 */
public record FetchResult(
        String source,
        long totalRows,
        long resolved,
        long notFound,
        long quotaExceeded,
        long failed,
        long skipped,
        long cacheHits,
        List<RowError> errors,
        Duration duration
) {
    public FetchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long unresolved() {
        return totalRows - resolved;
    }

    public boolean isQuotaExceeded() {
        return quotaExceeded > 0;
    }

    /**
     * A row whose lookup failed.
     *
     * @param row     zero-based row index
     * @param address formatted address that was sent
     * @param status  outcome
     * @param message failure detail
     */
    public record RowError(int row, String address, GeocodeStatus status, String message) {}

    @Override
    public String toString() {
        return "FetchResult{source=" + source +
                ", total=" + totalRows +
                ", resolved=" + resolved +
                ", notFound=" + notFound +
                ", quotaExceeded=" + quotaExceeded +
                ", failed=" + failed +
                ", skipped=" + skipped +
                ", cacheHits=" + cacheHits +
                ", duration=" + duration.toMillis() + "ms}";
    }
}

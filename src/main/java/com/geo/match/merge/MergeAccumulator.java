package com.geo.match.merge;

import com.geo.match.bulk.ProgressCallback;
import com.geo.match.core.model.GeoPoint;
import com.geo.match.core.model.JoinMode;
import com.geo.match.core.model.MatchCandidate;
import com.geo.match.core.model.Table;
import com.geo.match.exception.ConfigurationException;
import com.geo.match.logging.LogContext;
import com.geo.match.matching.MatchEngine;
import com.geo.match.metrics.MetricsService;
import com.geo.match.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Folds a sequence of coordinate-bearing tables into one merged table.
 *
 * <p>Tables are processed in order. For each table, every row already in the output
 * is matched against the table; a match copies the table's output values into the
 * row's slice, averages the row's location with the match, and marks the row as
 * matched. Then the table's remaining rows are appended as new output rows, always
 * for the first table and for later tables unless the mode is {@link JoinMode#LEFT}.
 * With exclusive matching only rows that were not consumed by a match are appended.</p>
 *
 * <p>Input tables are only read. The output table is owned by the merge until it is
 * returned. Single-threaded.</p>
 */
public class MergeAccumulator {
    private static final Logger log = LoggerFactory.getLogger(MergeAccumulator.class);

    static final String DISTANCE_HEADER = "distance";

    private final MatchEngine matchEngine;
    private final MetricsService metrics;

    public MergeAccumulator() {
        this(new MatchEngine(), new NoOpMetricsService());
    }

    public MergeAccumulator(MatchEngine matchEngine, MetricsService metrics) {
        this.matchEngine = matchEngine;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public MergeResult merge(List<Table> tables, JoinMode mode, boolean exclusive, double radiusMiles) {
        return merge(tables, mode, exclusive, radiusMiles, ProgressCallback.NOOP);
    }

    /**
     * Merges the tables under the given join semantics.
     *
     * @throws ConfigurationException if there are no tables, a table lacks coordinates,
     *                                or no table selects any output column
     */
    public MergeResult merge(List<Table> tables, JoinMode mode, boolean exclusive, double radiusMiles,
                             ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        validate(tables, radiusMiles);

        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(), mode.name())) {
            Accumulation acc = new Accumulation(tables, mode);
            long totalRows = tables.stream().mapToLong(Table::rowCount).sum();
            long processed = 0;
            List<MergeResult.TableStats> stats = new ArrayList<>(tables.size());

            for (int index = 0; index < tables.size(); index++) {
                Table table = tables.get(index);
                stats.add(acc.fold(index, table, exclusive, radiusMiles));
                processed += table.rowCount();
                cb.onProgress(processed, totalRows, "Merged " + table.getSource());
            }

            int matchedRows = acc.matched.cardinality();
            if (mode == JoinMode.INNER) {
                acc.dropUnmatched();
            }

            Duration duration = Duration.between(start, Instant.now());
            MergeResult result = new MergeResult(acc.output, mode, exclusive, stats, matchedRows, duration);
            metrics.recordMergeDuration(mode, duration);
            metrics.incrementMatches(mode, result.totalMatches());
            metrics.recordOutputRows(result.outputRows());
            cb.onProgress(totalRows, totalRows, "Merge completed");
            log.info("merge.completed result={}", result);
            return result;
        }
    }

    private void validate(List<Table> tables, double radiusMiles) {
        if (tables == null || tables.isEmpty()) {
            throw new ConfigurationException("No tables to merge");
        }
        if (!(radiusMiles > 0)) {
            throw new ConfigurationException("Radius must be a positive number, got " + radiusMiles);
        }
        int selected = 0;
        for (Table table : tables) {
            if (!table.readyToMatch()) {
                throw new ConfigurationException("Table " + table.getSource() + " has no coordinates");
            }
            selected += table.outputColumnCount();
        }
        if (selected == 0) {
            throw new ConfigurationException("No output columns supplied");
        }
    }

    /**
     * Mutable state of one merge: the growing output table, the per-row matched flags
     * and the compare values gathered from every input row merged into each output row.
     */
    private final class Accumulation {
        final JoinMode mode;
        final Table output;
        final int width;
        final int distanceColumn;
        final BitSet matched = new BitSet();
        final List<List<String>> compareValues = new ArrayList<>();
        int offset;

        Accumulation(List<Table> tables, JoinMode mode) {
            this.mode = mode;
            List<String> headers = new ArrayList<>();
            for (Table table : tables) {
                headers.addAll(table.outputHeaders());
            }
            if (mode == JoinMode.LEFT) {
                headers.add(DISTANCE_HEADER);
            }
            this.output = Table.withCoordinates("matches", headers);
            this.width = headers.size();
            this.distanceColumn = mode == JoinMode.LEFT ? width - 1 : -1;
        }

        MergeResult.TableStats fold(int index, Table table, boolean exclusive, double radiusMiles) {
            BitSet consumed = new BitSet(table.rowCount());
            int columns = table.outputColumnCount();
            int existingRows = output.rowCount();
            int matches = 0;

            for (int row = 0; row < existingRows; row++) {
                Optional<MatchCandidate> candidate = matchEngine.findBestMatch(
                        output.coordinate(row), compareValues.get(row), table, consumed, exclusive, radiusMiles);
                if (candidate.isEmpty()) {
                    continue;
                }
                absorb(row, table, candidate.get());
                consumed.set(candidate.get().rowIndex());
                matches++;
            }

            int appended = 0;
            BitSet appendedRows = new BitSet(table.rowCount());
            if (index == 0 || mode != JoinMode.LEFT) {
                for (int row = 0; row < table.rowCount(); row++) {
                    if (!exclusive || !consumed.get(row)) {
                        append(table, row);
                        appendedRows.set(row);
                        appended++;
                    }
                }
            }

            BitSet kept = (BitSet) consumed.clone();
            kept.or(appendedRows);
            int dropped = table.rowCount() - kept.cardinality();

            log.info("merge.table index={} source={} rows={} matched={} appended={} dropped={}",
                    index, table.getSource(), table.rowCount(), matches, appended, dropped);
            offset += columns;
            return new MergeResult.TableStats(table.getSource(), table.rowCount(), matches, appended, dropped);
        }

        private void absorb(int outputRow, Table table, MatchCandidate candidate) {
            int source = candidate.rowIndex();
            List<String> values = table.outputRow(source);
            for (int col = 0; col < values.size(); col++) {
                output.setValue(outputRow, offset + col, values.get(col));
            }
            if (distanceColumn >= 0) {
                output.setValue(outputRow, distanceColumn, Double.toString(candidate.distance()));
            }
            GeoPoint centroid = output.coordinate(outputRow).midpoint(table.coordinate(source));
            output.setCoordinate(outputRow, centroid);
            compareValues.get(outputRow).addAll(table.compareRow(source));
            matched.set(outputRow);
        }

        private void append(Table table, int row) {
            List<String> values = new ArrayList<>(Collections.nCopies(width, ""));
            List<String> slice = table.outputRow(row);
            for (int col = 0; col < slice.size(); col++) {
                values.set(offset + col, slice.get(col));
            }
            output.addRow(values, table.coordinate(row));
            compareValues.add(new ArrayList<>(table.compareRow(row)));
        }

        void dropUnmatched() {
            for (int row = output.rowCount() - 1; row >= 0; row--) {
                if (!matched.get(row)) {
                    output.removeRow(row);
                    compareValues.remove(row);
                }
            }
        }
    }
}

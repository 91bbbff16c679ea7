package com.geo.match.api;

import com.geo.match.bulk.CsvTableReader;
import com.geo.match.bulk.CsvTableWriter;
import com.geo.match.bulk.ProgressBarFactory;
import com.geo.match.core.model.ColumnRole;
import com.geo.match.core.model.JoinMode;
import com.geo.match.core.model.Table;
import com.geo.match.exception.ConfigurationException;
import com.geo.match.geocode.FetchResult;
import com.geo.match.geocode.GeocodeFetcher;
import com.geo.match.merge.MergeAccumulator;
import com.geo.match.merge.MergeResult;
import me.tongfei.progressbar.ProgressBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The working state of one interactive run: the loaded tables, in load order,
 * and the current {@link MatchOptions}.
 *
 * <p>Tables are addressed by their zero-based load index. Every configuration
 * mistake surfaces as a {@link ConfigurationException} and leaves the session
 * unchanged.</p>
 *
 * Usage:
 * <pre>
 * GeoMatchSession session = GeoMatchSession.builder().fetcher(fetcher).build();
 * session.addTable(Path.of("stores.csv"));
 * session.addTable(Path.of("sites.csv"));
 * session.fetch();
 * session.merge();
 * </pre>
 */
public class GeoMatchSession {
    private static final Logger log = LoggerFactory.getLogger(GeoMatchSession.class);

    private final List<Table> tables = new ArrayList<>();
    private final List<Path> paths = new ArrayList<>();
    private final GeocodeFetcher fetcher;
    private final MergeAccumulator mergeAccumulator;
    private final CsvTableReader reader;
    private final CsvTableWriter writer;
    private final ProgressBarFactory progressBars;
    private MatchOptions options;

    private GeoMatchSession(Builder builder) {
        this.fetcher = builder.fetcher;
        this.mergeAccumulator = builder.mergeAccumulator != null ? builder.mergeAccumulator : new MergeAccumulator();
        this.reader = builder.reader != null ? builder.reader : new CsvTableReader();
        this.writer = builder.writer != null ? builder.writer : new CsvTableWriter();
        this.progressBars = builder.progressBars != null ? builder.progressBars : new ProgressBarFactory(false);
        this.options = builder.options != null ? builder.options : MatchOptions.defaults();
    }

    // ========== Tables ==========

    /**
     * Loads a table and infers its column roles.
     *
     * @return the index of the new table
     */
    public int addTable(Path path) {
        Table table = reader.read(path);
        tables.add(table);
        paths.add(path);
        log.info("session.tableAdded index={} source={}", tables.size() - 1, path);
        return tables.size() - 1;
    }

    /**
     * Adds an already loaded table, for callers that build tables themselves.
     */
    public int addTable(Table table) {
        tables.add(table);
        paths.add(Path.of(table.getSource()));
        return tables.size() - 1;
    }

    public List<Table> getTables() {
        return Collections.unmodifiableList(tables);
    }

    /**
     * @throws ConfigurationException if no table has that index
     */
    public Table table(int index) {
        if (index < 0 || index >= tables.size()) {
            throw new ConfigurationException("Index out of Bounds: " + index + " (tables: " + tables.size() + ")");
        }
        return tables.get(index);
    }

    public List<String> listColumns(int index) {
        return table(index).getHeaders();
    }

    // ========== Per-table configuration ==========

    /**
     * Binds a role, given by its shell key, to a column of a table.
     */
    public void bindRole(int index, String roleKey, String columnName) {
        Table table = table(index);
        ColumnRole role = ColumnRole.fromKey(roleKey)
                .orElseThrow(() -> new ConfigurationException("Unknown variable: " + roleKey));
        table.bind(role, columnName);
    }

    public void addOutputColumn(int index, String columnName) {
        table(index).addOutputColumn(columnName);
    }

    public void addCompareColumn(int index, String columnName) {
        table(index).addCompareColumn(columnName);
    }

    public void setPrefix(int index, String prefix) {
        table(index).setPrefix(prefix);
    }

    // ========== Options ==========

    public MatchOptions getOptions() {
        return options;
    }

    public void setJoinMode(JoinMode joinMode) {
        options = options.toBuilder().joinMode(joinMode).build();
    }

    /**
     * @throws ConfigurationException if the radius is not a positive number
     */
    public void setRadius(double radiusMiles) {
        try {
            options = options.toBuilder().radiusMiles(radiusMiles).build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Radius must be a positive number, got " + radiusMiles, e);
        }
    }

    public void setExclusive(boolean exclusive) {
        options = options.toBuilder().exclusive(exclusive).build();
    }

    // ========== Readiness ==========

    /**
     * At least one table is loaded and every table has address line 1, city and state bound.
     */
    public boolean readyToFetch() {
        return !tables.isEmpty() && tables.stream().allMatch(Table::readyToFetch);
    }

    /**
     * At least one table is loaded and every table carries coordinates.
     */
    public boolean readyToMatch() {
        return !tables.isEmpty() && tables.stream().allMatch(Table::readyToMatch);
    }

    // ========== Operations ==========

    /**
     * Geocodes every table in load order, writing each augmented table into the
     * configured output directory as {@code <stem>_coords.csv}.
     *
     * @throws ConfigurationException if any table is not ready to fetch, or no geocoder is configured
     */
    public List<FetchResult> fetch() {
        if (!readyToFetch()) {
            throw new ConfigurationException("Invalid config for fetch");
        }
        if (fetcher == null) {
            throw new ConfigurationException("No geocoder configured (missing API key)");
        }

        List<FetchResult> results = new ArrayList<>(tables.size());
        for (int i = 0; i < tables.size(); i++) {
            Table table = tables.get(i);
            FetchResult result;
            try (ProgressBar bar = progressBars.create("Fetching " + paths.get(i).getFileName(), table.rowCount())) {
                result = fetcher.fetch(table, options.getFetchConfig(), ProgressBarFactory.callbackFor(bar));
            }
            writer.writeWithCoordinates(table, options.coordsPath(paths.get(i)));
            results.add(result);
        }

        long quotaRows = results.stream().mapToLong(FetchResult::quotaExceeded).sum();
        if (quotaRows > 0) {
            log.warn("fetch.quotaExceeded rows={} - the geocoding API quota ran out, affected rows have no coordinates",
                    quotaRows);
        }
        return results;
    }

    /**
     * Merges every table under the current options and writes the matches file.
     *
     * @throws ConfigurationException if any table lacks coordinates or no output column is selected
     */
    public MergeResult merge() {
        if (!readyToMatch()) {
            throw new ConfigurationException("Invalid config for match");
        }
        long totalRows = tables.stream().mapToLong(Table::rowCount).sum();
        MergeResult result;
        try (ProgressBar bar = progressBars.create("Matching", totalRows)) {
            result = mergeAccumulator.merge(tables, options.getJoinMode(), options.isExclusive(),
                    options.getRadiusMiles(), ProgressBarFactory.callbackFor(bar));
        }
        writer.writeMatches(result.output(), options.matchesPath());
        return result;
    }

    /**
     * Every table's configuration by index, followed by radius, mode and exclusivity.
     */
    public String describeConfig() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tables.size(); i++) {
            sb.append(i).append(": ").append(tables.get(i).describe()).append('\n');
        }
        sb.append(options);
        return sb.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GeocodeFetcher fetcher;
        private MergeAccumulator mergeAccumulator;
        private CsvTableReader reader;
        private CsvTableWriter writer;
        private ProgressBarFactory progressBars;
        private MatchOptions options;

        public Builder fetcher(GeocodeFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder mergeAccumulator(MergeAccumulator mergeAccumulator) {
            this.mergeAccumulator = mergeAccumulator;
            return this;
        }

        public Builder reader(CsvTableReader reader) {
            this.reader = reader;
            return this;
        }

        public Builder writer(CsvTableWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder progressBars(ProgressBarFactory progressBars) {
            this.progressBars = progressBars;
            return this;
        }

        public Builder options(MatchOptions options) {
            this.options = options;
            return this;
        }

        public GeoMatchSession build() {
            return new GeoMatchSession(this);
        }
    }
}

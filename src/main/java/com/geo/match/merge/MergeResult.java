package com.geo.match.merge;

import com.geo.match.core.model.JoinMode;
import com.geo.match.core.model.Table;

import java.time.Duration;
import java.util.List;

/**
 * Result of merging a sequence of tables.
 *
 * @param output        the merged table, already filtered for the join mode
 * @param mode          join mode used
 * @param exclusive     whether matching was exclusive
 * @param tables        per-input-table statistics, in merge order
 * @param matchedRows   output rows that matched at least once (before filtering)
 * @param duration      wall-clock time of the merge
 */
public record MergeResult(
        Table output,
        JoinMode mode,
        boolean exclusive,
        List<TableStats> tables,
        int matchedRows,
        Duration duration
) {
    public MergeResult {
        tables = tables != null ? List.copyOf(tables) : List.of();
    }

    public int outputRows() {
        return output.rowCount();
    }

    public long totalMatches() {
        return tables.stream().mapToLong(TableStats::matched).sum();
    }

    /**
     * What happened to the rows of one input table.
     *
     * @param source   table source
     * @param rows     rows in the table
     * @param matched  rows merged into an existing output row
     * @param appended rows added as new output rows
     * @param dropped  rows neither matched nor appended
     */
    public record TableStats(String source, int rows, int matched, int appended, int dropped) {}

    @Override
    public String toString() {
        return "MergeResult{mode=" + mode +
                ", exclusive=" + exclusive +
                ", outputRows=" + output.rowCount() +
                ", matchedRows=" + matchedRows +
                ", matches=" + totalMatches() +
                ", duration=" + duration.toMillis() + "ms}";
    }
}

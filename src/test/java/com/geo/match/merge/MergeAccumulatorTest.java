package com.geo.match.merge;

import com.geo.match.core.model.ColumnRole;
import com.geo.match.core.model.GeoPoint;
import com.geo.match.core.model.JoinMode;
import com.geo.match.core.model.Table;
import com.geo.match.exception.ConfigurationException;
import com.geo.match.geo.GeoDistance;
import com.geo.match.matching.MatchEngine;
import com.geo.match.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("MergeAccumulator Tests")
class MergeAccumulatorTest {

    @Mock
    private MetricsService metrics;

    private MergeAccumulator accumulator;

    @BeforeEach
    void setUp() {
        accumulator = new MergeAccumulator(new MatchEngine(), metrics);
    }

    /**
     * Builds a table of (name, lat, lng) rows with coordinates extracted and "name" selected for output.
     */
    private static Table table(String source, String prefix, Object... rows) {
        Table table = new Table(source, ',', List.of("name", "lat", "lng"));
        for (int i = 0; i < rows.length; i += 3) {
            table.addRow(List.of((String) rows[i], String.valueOf(rows[i + 1]), String.valueOf(rows[i + 2])));
        }
        table.bind(ColumnRole.LATITUDE, "lat");
        table.bind(ColumnRole.LONGITUDE, "lng");
        table.addOutputColumn("name");
        table.setPrefix(prefix);
        return table;
    }

    private static List<List<String>> rows(Table output) {
        List<List<String>> rows = new ArrayList<>();
        for (int row = 0; row < output.rowCount(); row++) {
            rows.add(output.outputRow(row));
        }
        return rows;
    }

    @Nested
    @DisplayName("Join modes")
    class JoinModes {

        private Table left;
        private Table right;

        @BeforeEach
        void setUp() {
            left = table("a.csv", "a",
                    "A1", 40.0, -75.0,
                    "A2", 41.0, -75.0);
            right = table("b.csv", "b",
                    "B1", 40.001, -75.0,
                    "B2", 45.0, -75.0);
        }

        @Test
        @DisplayName("LEFT should keep only first-table rows and add a distance column")
        void leftJoin() {
            MergeResult result = accumulator.merge(List.of(left, right), JoinMode.LEFT, true, 0.25);
            Table output = result.output();

            assertEquals(List.of("a_name", "b_name", "distance"), output.outputHeaders());
            assertEquals(2, result.outputRows());
            assertEquals(List.of("A1", "B1"), output.outputRow(0).subList(0, 2));
            assertEquals(List.of("A2", "", ""), output.outputRow(1));

            double expected = GeoDistance.haversine(new GeoPoint(40.0, -75.0), new GeoPoint(40.001, -75.0));
            assertEquals(expected, Double.parseDouble(output.outputRow(0).get(2)), 1e-12);
        }

        @Test
        @DisplayName("A match should move the output location to the midpoint")
        void matchAveragesLocation() {
            Table output = accumulator.merge(List.of(left, right), JoinMode.LEFT, true, 0.25).output();

            assertEquals(40.0005, output.coordinate(0).latitude(), 1e-12);
            assertEquals(new GeoPoint(41.0, -75.0), output.coordinate(1));
        }

        @Test
        @DisplayName("INNER should keep only rows that matched at least once")
        void innerJoin() {
            MergeResult result = accumulator.merge(List.of(left, right), JoinMode.INNER, true, 0.25);

            assertEquals(List.of("a_name", "b_name"), result.output().outputHeaders());
            assertEquals(List.of(List.of("A1", "B1")), rows(result.output()));
            assertEquals(1, result.matchedRows());
        }

        @Test
        @DisplayName("OUTER should keep every row, merged where matched")
        void outerJoin() {
            MergeResult result = accumulator.merge(List.of(left, right), JoinMode.OUTER, true, 0.25);

            assertEquals(List.of(
                    List.of("A1", "B1"),
                    List.of("A2", ""),
                    List.of("", "B2")), rows(result.output()));
        }

        @Test
        @DisplayName("Non-exclusive OUTER should append matched rows of later tables again")
        void nonExclusiveOuterAppendsEverything() {
            MergeResult result = accumulator.merge(List.of(left, right), JoinMode.OUTER, false, 0.25);

            assertEquals(4, result.outputRows());
            assertEquals(List.of("", "B1"), result.output().outputRow(2));
        }

        @Test
        @DisplayName("A single table should pass through unchanged except for filtering")
        void singleTable() {
            assertEquals(2, accumulator.merge(List.of(left), JoinMode.OUTER, true, 0.25).outputRows());
            assertEquals(0, accumulator.merge(List.of(left), JoinMode.INNER, true, 0.25).outputRows());
        }

        @Test
        @DisplayName("Input tables should not be modified")
        void inputsUntouched() {
            accumulator.merge(List.of(left, right), JoinMode.OUTER, true, 0.25);

            assertEquals(2, left.rowCount());
            assertEquals(new GeoPoint(40.0, -75.0), left.coordinate(0));
            assertEquals(new GeoPoint(40.001, -75.0), right.coordinate(0));
        }
    }

    @Nested
    @DisplayName("Radius")
    class Radius {

        @Test
        @DisplayName("A row 0.864 miles away should only match once the radius covers it")
        void radiusScenario() {
            Table a = table("a.csv", "", "A", 40.0, -75.0);
            Table b = table("b.csv", "", "B", 40.0125, -75.0);

            MergeResult narrow = accumulator.merge(List.of(a, b), JoinMode.LEFT, true, 0.25);
            assertEquals(List.of("A", "", ""), narrow.output().outputRow(0));

            MergeResult wide = accumulator.merge(List.of(a, b), JoinMode.LEFT, true, 1.0);
            assertEquals("B", wide.output().outputRow(0).get(1));
            assertEquals(0.8637, Double.parseDouble(wide.output().outputRow(0).get(2)), 1e-3);
        }

        @Test
        @DisplayName("Exact matches should report a distance of 0.0")
        void exactDistance() {
            Table a = table("a.csv", "", "A", 40.0, -75.0);
            Table b = table("b.csv", "", "B", 40.0, -75.0);

            Table output = accumulator.merge(List.of(a, b), JoinMode.LEFT, true, 0.25).output();

            assertEquals("0.0", output.outputRow(0).get(2));
        }
    }

    @Nested
    @DisplayName("Exclusivity")
    class Exclusivity {

        private Table left;
        private Table right;

        @BeforeEach
        void setUp() {
            left = table("a.csv", "a",
                    "A1", 40.0, -75.0,
                    "A2", 40.0005, -75.0);
            right = table("b.csv", "b", "B1", 40.001, -75.0);
        }

        @Test
        @DisplayName("Exclusive matching should let a row be claimed only once")
        void exclusiveClaimsOnce() {
            Table output = accumulator.merge(List.of(left, right), JoinMode.LEFT, true, 0.25).output();

            assertEquals("B1", output.outputRow(0).get(1));
            assertEquals("", output.outputRow(1).get(1));
        }

        @Test
        @DisplayName("Non-exclusive matching should let every row claim the nearest candidate")
        void nonExclusiveClaimsMany() {
            Table output = accumulator.merge(List.of(left, right), JoinMode.LEFT, false, 0.25).output();

            assertEquals("B1", output.outputRow(0).get(1));
            assertEquals("B1", output.outputRow(1).get(1));
        }

        @Test
        @DisplayName("Per-table statistics should count matched, appended and dropped rows")
        void statistics() {
            MergeResult result = accumulator.merge(List.of(left, right), JoinMode.OUTER, true, 0.25);

            MergeResult.TableStats first = result.tables().get(0);
            MergeResult.TableStats second = result.tables().get(1);
            assertEquals(new MergeResult.TableStats("a.csv", 2, 0, 2, 0), first);
            assertEquals(new MergeResult.TableStats("b.csv", 1, 1, 0, 0), second);
            assertEquals(1, result.totalMatches());
        }
    }

    @Nested
    @DisplayName("Multiple tables")
    class MultipleTables {

        @Test
        @DisplayName("Later tables should match against the averaged location of earlier matches")
        void matchesAgainstCentroid() {
            Table a = table("a.csv", "a", "A", 40.0, -75.0);
            // binary-exact offsets so the averaged latitude is exactly representable
            Table b = table("b.csv", "b", "B", 40.001953125, -75.0);
            Table c = table("c.csv", "c", "C", 40.0009765625, -75.0);

            Table output = accumulator.merge(List.of(a, b, c), JoinMode.LEFT, true, 0.25).output();

            assertEquals(List.of("A", "B", "C", "0.0"), output.outputRow(0));
        }

        @Test
        @DisplayName("Compare values gathered from merged rows should break later ties")
        void compareValuesCarryForward() {
            Table a = table("a.csv", "a", "Corner Cafe", 40.0, -75.0);
            a.addCompareColumn("name");
            Table b = table("b.csv", "b", "Other", 40.000244140625, -75.0);
            Table c = table("c.csv", "c",
                    "Hardware Depot", 40.0001220703125, -75.0,
                    "Corner Cafe", 40.0001220703125, -75.0);
            c.addCompareColumn("name");

            Table output = accumulator.merge(List.of(a, b, c), JoinMode.LEFT, true, 0.25).output();

            assertEquals("Corner Cafe", output.outputRow(0).get(2));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("No selected output columns should fail, even under LEFT")
        void zeroWidth() {
            Table a = new Table("a.csv", ',', List.of("lat", "lng"));
            a.addRow(List.of("1", "2"));
            a.bind(ColumnRole.LATITUDE, "lat");
            a.bind(ColumnRole.LONGITUDE, "lng");

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                    () -> accumulator.merge(List.of(a), JoinMode.LEFT, true, 0.25));
            assertEquals("No output columns supplied", ex.getMessage());
        }

        @Test
        @DisplayName("A table without coordinates should fail")
        void missingCoordinates() {
            Table a = new Table("a.csv", ',', List.of("name"));
            a.addOutputColumn("name");

            assertThrows(ConfigurationException.class,
                    () -> accumulator.merge(List.of(a), JoinMode.OUTER, true, 0.25));
        }

        @Test
        @DisplayName("A non-positive radius should fail")
        void nonPositiveRadius() {
            Table a = table("a.csv", "", "A", 40.0, -75.0);

            assertThrows(ConfigurationException.class,
                    () -> accumulator.merge(List.of(a), JoinMode.OUTER, true, 0.0));
            assertThrows(ConfigurationException.class,
                    () -> accumulator.merge(List.of(a), JoinMode.OUTER, true, Double.NaN));
        }

        @Test
        @DisplayName("No tables should fail")
        void noTables() {
            assertThrows(ConfigurationException.class,
                    () -> accumulator.merge(List.of(), JoinMode.OUTER, true, 0.25));
        }
    }

    @Test
    @DisplayName("Metrics should be recorded for each merge")
    void recordsMetrics() {
        Table a = table("a.csv", "a", "A", 40.0, -75.0);
        Table b = table("b.csv", "b", "B", 40.0, -75.0);

        accumulator.merge(List.of(a, b), JoinMode.INNER, true, 0.25);

        verify(metrics).recordMergeDuration(eq(JoinMode.INNER), any(Duration.class));
        verify(metrics).incrementMatches(JoinMode.INNER, 1L);
        verify(metrics).recordOutputRows(1);
    }
}

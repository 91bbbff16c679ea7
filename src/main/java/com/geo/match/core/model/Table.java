package com.geo.match.core.model;

import com.geo.match.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * In-memory columnar table of text columns with an optional numeric coordinate pair.
 *
 * <p>Coordinates are stored apart from the text columns. They are absent until
 * both a latitude and a longitude column are bound (or the table is geocoded);
 * binding them removes the two text columns and re-indexes every other binding,
 * output column and compare column.</p>
 *
 * <p>Not thread-safe. Geocoding mutates a table in place; merges only read
 * their inputs.</p>
 */
public class Table {

    private final String source;
    private final char delimiter;
    private final List<String> headers;
    private final List<List<String>> columns;
    private List<GeoPoint> coordinates;
    private int rowCount;

    private final RoleBindings bindings = new RoleBindings();
    private final List<Integer> outputColumns = new ArrayList<>();
    private final List<Integer> compareColumns = new ArrayList<>();
    private String prefix = "";

    /**
     * Creates an empty table with the given headers and no coordinates.
     *
     * @param source    where the table came from (path or label)
     * @param delimiter field delimiter of the source file
     * @param headers   column names
     */
    public Table(String source, char delimiter, List<String> headers) {
        this.source = source;
        this.delimiter = delimiter;
        this.headers = new ArrayList<>(headers);
        this.columns = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            columns.add(new ArrayList<>());
        }
    }

    /**
     * Creates an empty table that carries coordinates from the start, with every
     * column selected for output.
     */
    public static Table withCoordinates(String source, List<String> headers) {
        Table table = new Table(source, '|', headers);
        table.coordinates = new ArrayList<>();
        for (int i = 0; i < headers.size(); i++) {
            table.outputColumns.add(i);
        }
        return table;
    }

    // ========== Shape ==========

    public String getSource() {
        return source;
    }

    public char getDelimiter() {
        return delimiter;
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return headers.size();
    }

    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * Finds a column by exact header name.
     *
     * @throws ConfigurationException if no column has that name
     */
    public int columnIndex(String name) {
        int index = headers.indexOf(name);
        if (index < 0) {
            throw new ConfigurationException("No column named " + name);
        }
        return index;
    }

    // ========== Rows ==========

    /**
     * Appends a row of text values. Short rows are padded with blanks, extra values are ignored.
     * If the table carries coordinates, the new row's location is unresolved.
     */
    public void addRow(List<String> values) {
        addRow(values, GeoPoint.unresolved());
    }

    /**
     * Appends a row of text values with a location.
     */
    public void addRow(List<String> values, GeoPoint point) {
        for (int col = 0; col < columns.size(); col++) {
            columns.get(col).add(col < values.size() && values.get(col) != null ? values.get(col) : "");
        }
        if (coordinates != null) {
            coordinates.add(point);
        }
        rowCount++;
    }

    /**
     * Removes a row from every text column and from the coordinates.
     */
    public void removeRow(int row) {
        checkRow(row);
        for (List<String> column : columns) {
            column.remove(row);
        }
        if (coordinates != null) {
            coordinates.remove(row);
        }
        rowCount--;
    }

    public String value(int row, int column) {
        return columns.get(column).get(row);
    }

    public void setValue(int row, int column, String value) {
        columns.get(column).set(row, value);
    }

    /**
     * Adds a text column holding one value per row, or replaces the values of the
     * column that already has this header.
     */
    public void putColumn(String header, List<String> values) {
        if (values.size() != rowCount) {
            throw new IllegalArgumentException("Column " + header + " has " + values.size()
                    + " values, table has " + rowCount + " rows");
        }
        int existing = headers.indexOf(header);
        if (existing >= 0) {
            columns.set(existing, new ArrayList<>(values));
            return;
        }
        headers.add(header);
        columns.add(new ArrayList<>(values));
    }

    private void removeColumn(int index) {
        headers.remove(index);
        columns.remove(index);
        bindings.onColumnRemoved(index);
        shiftAfterRemoval(outputColumns, index);
        shiftAfterRemoval(compareColumns, index);
    }

    private static void shiftAfterRemoval(List<Integer> indexes, int removed) {
        indexes.removeIf(i -> i == removed);
        indexes.replaceAll(i -> i > removed ? i - 1 : i);
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range (rows: " + rowCount + ")");
        }
    }

    // ========== Coordinates ==========

    public boolean hasCoordinates() {
        return coordinates != null;
    }

    public GeoPoint coordinate(int row) {
        if (coordinates == null) {
            return GeoPoint.unresolved();
        }
        return coordinates.get(row);
    }

    public void setCoordinate(int row, GeoPoint point) {
        if (coordinates == null) {
            throw new IllegalStateException("Table " + source + " has no coordinates");
        }
        coordinates.set(row, point);
    }

    /**
     * Replaces the coordinate pair with one point per row.
     */
    public void setCoordinates(List<GeoPoint> points) {
        if (points.size() != rowCount) {
            throw new IllegalArgumentException("Expected " + rowCount + " coordinates, got " + points.size());
        }
        this.coordinates = new ArrayList<>(points);
    }

    private void extractCoordinates(int latColumn, int lngColumn) {
        List<String> lat = columns.get(latColumn);
        List<String> lng = columns.get(lngColumn);
        List<GeoPoint> points = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            points.add(new GeoPoint(parseCoordinate(lat.get(row)), parseCoordinate(lng.get(row))));
        }
        // remove the higher index first so the lower one stays valid
        removeColumn(Math.max(latColumn, lngColumn));
        removeColumn(Math.min(latColumn, lngColumn));
        this.coordinates = points;
    }

    static double parseCoordinate(String value) {
        if (value == null || value.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    // ========== Roles ==========

    /**
     * Binds a role to a column by header name.
     *
     * @throws ConfigurationException if no column has that name
     */
    public void bind(ColumnRole role, String columnName) {
        bind(role, columnIndex(columnName));
    }

    /**
     * Binds a role to a column by index. Once both coordinate roles are bound
     * the two columns are moved into the coordinate pair.
     *
     * @throws ConfigurationException if the index is out of range, or the other
     *                                coordinate role is bound to the same column
     */
    public void bind(ColumnRole role, int columnIndex) {
        if (role.isCoordinate()) {
            ColumnRole other = role == ColumnRole.LATITUDE ? ColumnRole.LONGITUDE : ColumnRole.LATITUDE;
            OptionalInt otherIndex = bindings.get(other);
            if (otherIndex.isPresent() && otherIndex.getAsInt() == columnIndex) {
                throw new ConfigurationException("lat and lng cannot share column " + headers.get(columnIndex));
            }
        }
        bindings.bind(role, columnIndex, headers.size());

        OptionalInt lat = bindings.get(ColumnRole.LATITUDE);
        OptionalInt lng = bindings.get(ColumnRole.LONGITUDE);
        if (lat.isPresent() && lng.isPresent()) {
            extractCoordinates(lat.getAsInt(), lng.getAsInt());
        }
    }

    public OptionalInt binding(ColumnRole role) {
        return bindings.get(role);
    }

    /**
     * All of address line 1, city and state are bound.
     */
    public boolean readyToFetch() {
        return bindings.isBound(ColumnRole.ADDRESS_LINE1)
                && bindings.isBound(ColumnRole.CITY)
                && bindings.isBound(ColumnRole.STATE);
    }

    public boolean readyToMatch() {
        return hasCoordinates();
    }

    /**
     * Builds the geocodable address of a row: line 1, line 2, city, state, postal code,
     * joined by single spaces. Optional parts that are blank are left out.
     *
     * @return empty if any required part is unbound or blank
     */
    public Optional<String> formattedAddress(int row) {
        Optional<String> line1 = roleValue(ColumnRole.ADDRESS_LINE1, row);
        Optional<String> city = roleValue(ColumnRole.CITY, row);
        Optional<String> state = roleValue(ColumnRole.STATE, row);
        if (line1.isEmpty() || city.isEmpty() || state.isEmpty()) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>(5);
        parts.add(line1.get());
        roleValue(ColumnRole.ADDRESS_LINE2, row).ifPresent(parts::add);
        parts.add(city.get());
        parts.add(state.get());
        roleValue(ColumnRole.POSTAL_CODE, row).ifPresent(parts::add);
        return Optional.of(String.join(" ", parts));
    }

    private Optional<String> roleValue(ColumnRole role, int row) {
        OptionalInt column = bindings.get(role);
        if (column.isEmpty()) {
            return Optional.empty();
        }
        String value = value(row, column.getAsInt()).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    // ========== Output / compare selection ==========

    public void addOutputColumn(String columnName) {
        outputColumns.add(columnIndex(columnName));
    }

    public void addCompareColumn(String columnName) {
        compareColumns.add(columnIndex(columnName));
    }

    public List<Integer> getOutputColumns() {
        return Collections.unmodifiableList(outputColumns);
    }

    public List<Integer> getCompareColumns() {
        return Collections.unmodifiableList(compareColumns);
    }

    public int outputColumnCount() {
        return outputColumns.size();
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix != null ? prefix : "";
    }

    /**
     * Names of the selected output columns, each joined to the prefix by an underscore when one is set.
     */
    public List<String> outputHeaders() {
        List<String> result = new ArrayList<>(outputColumns.size());
        for (int col : outputColumns) {
            result.add(prefix.isEmpty() ? headers.get(col) : prefix + "_" + headers.get(col));
        }
        return result;
    }

    public List<String> outputRow(int row) {
        List<String> result = new ArrayList<>(outputColumns.size());
        for (int col : outputColumns) {
            result.add(value(row, col));
        }
        return result;
    }

    public List<String> compareRow(int row) {
        List<String> result = new ArrayList<>(compareColumns.size());
        for (int col : compareColumns) {
            result.add(value(row, col));
        }
        return result;
    }

    /**
     * Multi-line summary of the table's configuration, as shown by the shell's {@code config} command.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        sb.append("\tpath:\t").append(source).append('\n');
        sb.append("\tprefix:\t").append(prefix).append("\n\n");
        for (ColumnRole role : ColumnRole.values()) {
            if (role.isCoordinate()) {
                continue;
            }
            OptionalInt index = bindings.get(role);
            sb.append('\t').append(role.key()).append(":\t\t")
                    .append(index.isPresent() ? headers.get(index.getAsInt()) : "None").append('\n');
        }
        sb.append('\n');
        sb.append("\tcoordinates:\t").append(hasCoordinates() ? "Found" : "Not Found").append("\n\n");
        appendColumnList(sb, "output_cols", outputColumns);
        appendColumnList(sb, "compare_cols", compareColumns);
        sb.append('}');
        return sb.toString();
    }

    private void appendColumnList(StringBuilder sb, String label, List<Integer> indexes) {
        sb.append('\t').append(label).append(": {\n");
        for (int col : indexes) {
            sb.append("\t\t").append(headers.get(col)).append('\n');
        }
        sb.append("\t}\n");
    }

    @Override
    public String toString() {
        return "Table{source=" + source + ", rows=" + rowCount + ", columns=" + headers.size()
                + ", coordinates=" + hasCoordinates() + '}';
    }
}

package com.geo.match.bulk;

import com.geo.match.core.model.ColumnRole;
import com.geo.match.core.model.Table;
import com.geo.match.exception.TableIOException;
import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a delimited text file into a {@link Table}.
 *
 * <p>The first record is the header. The delimiter is {@code ','} unless the
 * header splits into more fields on {@code '|'}. Roles are inferred from header
 * names; the first column matching a role wins. If both a latitude and a longitude
 * column are recognised the coordinates are extracted on load.</p>
 *
 * <pre>
 * store_id,address,city,state,zip
 * 17,"1 Main St",Springfield,IL,62701
 * </pre>
 */
public class CsvTableReader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    static final char COMMA = ',';
    static final char PIPE = '|';

    /**
     * Reads the file at {@code path}.
     *
     * @throws TableIOException if the file cannot be read or has no header
     */
    public Table read(Path path) {
        char delimiter = detectDelimiter(path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Table table = read(reader, path.toString(), delimiter);
            log.info("table.loaded source={} rows={} columns={} delimiter='{}' coordinates={}",
                    path, table.rowCount(), table.columnCount(), delimiter, table.hasCoordinates());
            return table;
        } catch (IOException e) {
            throw new TableIOException(path, "Failed to read table", e);
        }
    }

    /**
     * Reads a table from an open reader with a known delimiter.
     *
     * @throws IOException if the content is unreadable or empty
     */
    public Table read(Reader reader, String source, char delimiter) throws IOException {
        try (CSVReader csv = newReader(reader, delimiter)) {
            String[] header = csv.readNext();
            if (header == null) {
                throw new IOException("Missing header row");
            }
            List<String> headers = Arrays.stream(header).map(String::trim).toList();
            Table table = new Table(source, delimiter, headers);

            String[] record;
            while ((record = csv.readNext()) != null) {
                if (record.length == 1 && record[0].isBlank()) {
                    continue;
                }
                table.addRow(Arrays.asList(record));
            }
            inferRoles(table);
            return table;
        } catch (CsvValidationException e) {
            throw new IOException("Malformed record at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
    }

    private static CSVReader newReader(Reader reader, char delimiter) {
        CSVParser parser = new CSVParserBuilder()
                .withSeparator(delimiter)
                .build();
        return new CSVReaderBuilder(reader)
                .withCSVParser(parser)
                .build();
    }

    char detectDelimiter(Path path) {
        String headerLine;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            headerLine = reader.readLine();
        } catch (IOException e) {
            throw new TableIOException(path, "Failed to read table", e);
        }
        if (headerLine == null) {
            throw new TableIOException(path, "Missing header row", null);
        }
        return detectDelimiter(headerLine);
    }

    static char detectDelimiter(String headerLine) {
        return fieldCount(headerLine, PIPE) > fieldCount(headerLine, COMMA) ? PIPE : COMMA;
    }

    private static int fieldCount(String line, char separator) {
        try {
            return new CSVParserBuilder().withSeparator(separator).build().parseLine(line).length;
        } catch (IOException e) {
            // an unterminated quote under this separator; the other one wins
            return 0;
        }
    }

    /**
     * Binds every role whose aliases match a header. Latitude and longitude are bound last
     * so that extracting them does not shift the indexes of the other bindings mid-way.
     */
    static void inferRoles(Table table) {
        Map<ColumnRole, String> found = new EnumMap<>(ColumnRole.class);
        for (String header : table.getHeaders()) {
            Optional<ColumnRole> role = ColumnRole.inferFromHeader(header);
            role.ifPresent(r -> found.putIfAbsent(r, header));
        }
        found.forEach((role, header) -> {
            if (!role.isCoordinate()) {
                table.bind(role, header);
            }
        });
        String lat = found.get(ColumnRole.LATITUDE);
        String lng = found.get(ColumnRole.LONGITUDE);
        if (lat != null) {
            table.bind(ColumnRole.LATITUDE, lat);
        }
        if (lng != null) {
            table.bind(ColumnRole.LONGITUDE, lng);
        }
        log.debug("table.rolesInferred source={} roles={}", table.getSource(), found.keySet());
    }
}

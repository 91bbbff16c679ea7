package com.geo.match.bulk;

import com.geo.match.core.model.GeoPoint;
import com.geo.match.core.model.Table;
import com.geo.match.exception.TableIOException;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes tables as delimited text.
 *
 * <p>Output goes to a temporary file in the target directory which then replaces
 * the target, so an interrupted write never leaves a truncated file behind.</p>
 */
public class CsvTableWriter {
    private static final Logger log = LoggerFactory.getLogger(CsvTableWriter.class);

    static final String LATITUDE_HEADER = "lat";
    static final String LONGITUDE_HEADER = "lng";

    /**
     * Writes every text column followed by {@code lat} and {@code lng}, in the
     * table's own delimiter. Unresolved coordinates are written as {@code NaN}.
     */
    public void writeWithCoordinates(Table table, Path target) {
        List<String> headers = new ArrayList<>(table.getHeaders());
        headers.add(LATITUDE_HEADER);
        headers.add(LONGITUDE_HEADER);

        write(target, table.getDelimiter(), csv -> {
            csv.writeNext(headers.toArray(new String[0]), false);
            int columns = table.columnCount();
            for (int row = 0; row < table.rowCount(); row++) {
                String[] record = new String[columns + 2];
                for (int col = 0; col < columns; col++) {
                    record[col] = table.value(row, col);
                }
                GeoPoint point = table.coordinate(row);
                record[columns] = Double.toString(point.latitude());
                record[columns + 1] = Double.toString(point.longitude());
                csv.writeNext(record, false);
            }
        });
        log.info("table.written target={} rows={} delimiter='{}'", target, table.rowCount(), table.getDelimiter());
    }

    /**
     * Writes the selected output columns of a merged table, pipe-delimited.
     */
    public void writeMatches(Table output, Path target) {
        write(target, CsvTableReader.PIPE, csv -> {
            csv.writeNext(output.outputHeaders().toArray(new String[0]), false);
            for (int row = 0; row < output.rowCount(); row++) {
                csv.writeNext(output.outputRow(row).toArray(new String[0]), false);
            }
        });
        log.info("matches.written target={} rows={}", target, output.rowCount());
    }

    private void write(Path target, char delimiter, RecordSink sink) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 ICSVWriter csv = new CSVWriterBuilder(writer)
                         .withSeparator(delimiter)
                         .withLineEnd("\n")
                         .build()) {
                sink.accept(csv);
                csv.flush();
                if (csv.checkError()) {
                    throw new IOException("Write error", csv.getException());
                }
            }
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TableIOException(target, "Failed to write table", e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("table.tempCleanupFailed path={} error={}", temp, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface RecordSink {
        void accept(ICSVWriter csv) throws IOException;
    }
}

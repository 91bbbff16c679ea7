package com.geo.match.cli;

import com.geo.match.api.GeoMatchSession;
import com.geo.match.core.model.JoinMode;
import com.geo.match.exception.ConfigurationException;
import com.geo.match.exception.GeoMatchException;
import com.geo.match.geocode.FetchResult;
import com.geo.match.merge.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented command loop over a {@link GeoMatchSession}.
 *
 * <p>Each line is split on whitespace; the first word is the command. Column names
 * may contain spaces, so commands taking a column join the remaining words with a
 * single space. Errors are printed and the loop continues.</p>
 */
public class GeoMatchShell {
    private static final Logger log = LoggerFactory.getLogger(GeoMatchShell.class);

    static final String PROMPT = "geomatch> ";

    static final String SPLASH = """
            ---------------------- GEOMATCH -------------------------
            type help to see commands and options
            """;

    static final String HELP = """
            HELP:
                list [index]                List out all columns in the file with index
                set [index] [var] [col]     Assign a column to a runtime variable
                    fetch var Options:
                        addr1   [required]
                        addr2   [optional]
                        city    [required]
                        state   [required]
                        zipcode [optional]
                    match var Options:
                        lat     [required]
                        lng     [required]
                    other:
                        id
                add [index] [type] [col]    Add a column for a specific purpose
                    type Options:
                        output      Write the column to the matches file
                        compare     Use the column to tell apart entries at the same location
                prefix [index] [val]        Set prefix for a specified file's columns
                method [method]             Set method for matching
                    method Options:
                        left    Keep the entries of the first file, with their matches
                        inner   Keep only entries that matched at least once
                        outer   Keep every entry, merged where matched
                radius [radius]             Defaults to 0.25 miles. Max distance for two locations to match.
                exclusive [true or false]   Defaults to true. Whether an entry can be matched only once.
                    Non-exclusive makes the most sense with a left join, giving the closest
                    match for each location.
                config      Print out the current configuration
                fetch       Fetch all the coordinate pairs and write a new csv file per input
                match       Match all the files together and write the matches file
                quit        Quit the application
                help        List out this help message
            """;

    private final GeoMatchSession session;
    private final BufferedReader in;
    private final PrintStream out;

    public GeoMatchShell(GeoMatchSession session, BufferedReader in, PrintStream out) {
        this.session = session;
        this.in = in;
        this.out = out;
    }

    /**
     * Reads and executes commands until {@code quit} or end of input.
     */
    public void run() throws IOException {
        out.println(SPLASH);
        prompt();
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) {
                return;
            }
            prompt();
        }
    }

    /**
     * Executes one command line.
     *
     * @return false if the shell should stop
     */
    boolean execute(String line) {
        List<String> words = Arrays.asList(line.trim().split("\\s+"));
        String command = words.get(0);
        if (command.isEmpty()) {
            return true;
        }
        log.debug("shell.command line='{}'", line.trim());

        try {
            switch (command) {
                case "list" -> list(words);
                case "config" -> out.println(session.describeConfig());
                case "set" -> set(words);
                case "add" -> add(words);
                case "prefix" -> prefix(words);
                case "method" -> method(words);
                case "radius" -> radius(words);
                case "exclusive" -> exclusive(words);
                case "fetch" -> fetch();
                case "match" -> match();
                case "help" -> out.println(HELP);
                case "quit" -> {
                    return false;
                }
                default -> {
                    out.println("Unknown command: '" + command + "'");
                    out.println(HELP);
                }
            }
        } catch (GeoMatchException e) {
            log.debug("shell.error command={} error={}", command, e.getMessage());
            out.println(e.getMessage());
        }
        return true;
    }

    private void list(List<String> words) {
        int index = index(words);
        for (String column : session.listColumns(index)) {
            out.println("\t" + column);
        }
    }

    private void set(List<String> words) {
        int index = index(words);
        String role = argument(words, 2, "key is required");
        String column = rest(words, 3, "val is required");
        session.bindRole(index, role, column);
    }

    private void add(List<String> words) {
        int index = index(words);
        String type = argument(words, 2, "type required");
        String column = rest(words, 3, "column required");
        switch (type) {
            case "output" -> session.addOutputColumn(index, column);
            case "compare" -> session.addCompareColumn(index, column);
            default -> throw new ConfigurationException("Invalid type: " + type);
        }
    }

    private void prefix(List<String> words) {
        int index = index(words);
        session.setPrefix(index, argument(words, 2, "prefix required"));
    }

    private void method(List<String> words) {
        String value = argument(words, 1, "method required");
        JoinMode mode = JoinMode.parse(value)
                .orElseThrow(() -> new ConfigurationException("Invalid match mode: " + value));
        session.setJoinMode(mode);
    }

    private void radius(List<String> words) {
        String value = argument(words, 1, "radius required");
        try {
            session.setRadius(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid radius: " + value, e);
        }
    }

    private void exclusive(List<String> words) {
        String value = argument(words, 1, "val required").toLowerCase(Locale.ROOT);
        switch (value) {
            case "true" -> session.setExclusive(true);
            case "false" -> session.setExclusive(false);
            default -> throw new ConfigurationException("val must be true or false");
        }
    }

    private void fetch() {
        for (FetchResult result : session.fetch()) {
            out.printf("%s: %d/%d resolved%n", result.source(), result.resolved(), result.totalRows());
            if (result.isQuotaExceeded()) {
                out.printf("Warning: geocoding quota exceeded, %d rows have no coordinates%n",
                        result.quotaExceeded());
            }
        }
    }

    private void match() {
        MergeResult result = session.merge();
        out.printf("Wrote %d rows to %s%n", result.outputRows(), session.getOptions().matchesPath());
    }

    private void prompt() {
        out.print(PROMPT);
        out.flush();
    }

    private static int index(List<String> words) {
        String value = argument(words, 1, "file_index required");
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid index: " + value, e);
        }
    }

    private static String argument(List<String> words, int position, String missing) {
        if (words.size() <= position) {
            throw new ConfigurationException(missing);
        }
        return words.get(position);
    }

    private static String rest(List<String> words, int from, String missing) {
        if (words.size() <= from) {
            throw new ConfigurationException(missing);
        }
        return String.join(" ", words.subList(from, words.size()));
    }
}

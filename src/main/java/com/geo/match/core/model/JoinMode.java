package com.geo.match.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Join semantics controlling which rows survive a merge.
 */
public enum JoinMode {
    /**
     * Only rows reachable from the first table survive. Later tables contribute
     * matches but never new rows. A {@code distance} column is emitted.
     */
    LEFT,

    /**
     * Only rows that matched at least once during the merge survive.
     */
    INNER,

    /**
     * Every row from every table survives, merged where matched, appended otherwise.
     */
    OUTER;

    /**
     * Parses a mode name case-insensitively ({@code left}, {@code inner}, {@code outer}).
     */
    public static Optional<JoinMode> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "left" -> Optional.of(LEFT);
            case "inner" -> Optional.of(INNER);
            case "outer" -> Optional.of(OUTER);
            default -> Optional.empty();
        };
    }
}

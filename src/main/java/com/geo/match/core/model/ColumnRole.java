package com.geo.match.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Special meanings a table column can be bound to.
 * Address roles feed the geocoder; coordinate roles are extracted into the
 * table's numeric coordinate pair once both are bound.
 */
public enum ColumnRole {
    ID("id", List.of("id")),
    ADDRESS_LINE1("addr1", List.of("addr1", "address", "addr")),
    ADDRESS_LINE2("addr2", List.of("addr2", "address2")),
    CITY("city", List.of("city")),
    STATE("state", List.of("state")),
    POSTAL_CODE("zipcode", List.of("zipcode", "zip", "postalcode")),
    LATITUDE("lat", List.of("lat", "latitude")),
    LONGITUDE("lng", List.of("lng", "longitude"));

    private final String key;
    private final List<String> headerAliases;

    ColumnRole(String key, List<String> headerAliases) {
        this.key = key;
        this.headerAliases = headerAliases;
    }

    /**
     * Short name used by the shell's {@code set} command.
     */
    public String key() {
        return key;
    }

    public boolean isCoordinate() {
        return this == LATITUDE || this == LONGITUDE;
    }

    /**
     * Looks up a role by its shell key, case-insensitively.
     */
    public static Optional<ColumnRole> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String lower = key.trim().toLowerCase(Locale.ROOT);
        for (ColumnRole role : values()) {
            if (role.key.equals(lower)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Infers the role of a header. Matching ignores case and all whitespace.
     */
    public static Optional<ColumnRole> inferFromHeader(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String normalized = header.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        for (ColumnRole role : values()) {
            if (role.headerAliases.contains(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}

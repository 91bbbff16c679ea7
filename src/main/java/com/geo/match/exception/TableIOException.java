package com.geo.match.exception;

import java.nio.file.Path;

/**
 * Thrown when a tabular file cannot be read or written.
 */
public class TableIOException extends GeoMatchException {

    private final transient Path path;

    public TableIOException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}

package com.geo.match.exception;

/**
 * Thrown when a command or option is invalid: unknown column, bad table index,
 * malformed argument, or an operation requested before its inputs are configured.
 * Raised before any state is changed.
 */
public class ConfigurationException extends GeoMatchException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

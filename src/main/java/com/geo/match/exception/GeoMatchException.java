package com.geo.match.exception;

/**
 * Base class for errors surfaced to the operator.
 */
public class GeoMatchException extends RuntimeException {

    public GeoMatchException(String message) {
        super(message);
    }

    public GeoMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

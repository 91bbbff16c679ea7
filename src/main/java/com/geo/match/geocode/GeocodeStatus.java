package com.geo.match.geocode;

/**
 * Outcome of resolving one row's address.
 */
public enum GeocodeStatus {
    /**
     * The provider returned a location.
     */
    RESOLVED,

    /**
     * The provider answered but had no result for the address.
     */
    NOT_FOUND,

    /**
     * The provider refused the request because the API quota is used up.
     */
    QUOTA_EXCEEDED,

    /**
     * Transport error, malformed response, or unexpected failure.
     */
    FAILED,

    /**
     * The row has no usable address; no request was made.
     */
    SKIPPED;

    public boolean isResolved() {
        return this == RESOLVED;
    }
}

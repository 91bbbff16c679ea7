package com.geo.match.geocode;

import com.geo.match.core.model.GeoPoint;

/**
 * Result of geocoding one address. Every status other than {@link GeocodeStatus#RESOLVED}
 * carries an unresolved point and an empty formatted address.
 *
 * @param status           outcome
 * @param point            resolved location, or NaN/NaN
 * @param formattedAddress provider's canonical address, or empty
 * @param message          failure detail, or null
 */
public record GeocodeResult(
        GeocodeStatus status,
        GeoPoint point,
        String formattedAddress,
        String message
) {
    public GeocodeResult {
        point = point != null ? point : GeoPoint.unresolved();
        formattedAddress = formattedAddress != null ? formattedAddress : "";
    }

    public static GeocodeResult resolved(double latitude, double longitude, String formattedAddress) {
        return new GeocodeResult(GeocodeStatus.RESOLVED, new GeoPoint(latitude, longitude), formattedAddress, null);
    }

    public static GeocodeResult notFound() {
        return new GeocodeResult(GeocodeStatus.NOT_FOUND, null, null, null);
    }

    public static GeocodeResult quotaExceeded(String message) {
        return new GeocodeResult(GeocodeStatus.QUOTA_EXCEEDED, null, null, message);
    }

    public static GeocodeResult failed(String message) {
        return new GeocodeResult(GeocodeStatus.FAILED, null, null, message);
    }

    public static GeocodeResult skipped() {
        return new GeocodeResult(GeocodeStatus.SKIPPED, null, null, null);
    }

    public boolean isResolved() {
        return status.isResolved();
    }
}

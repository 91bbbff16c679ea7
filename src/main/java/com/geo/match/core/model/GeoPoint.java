package com.geo.match.core.model;

/**
 * A latitude/longitude pair in decimal degrees.
 * Either axis may be {@link Double#NaN}, meaning the location is unresolved.
 *
 * @param latitude  latitude in degrees
 * @param longitude longitude in degrees
 */
public record GeoPoint(double latitude, double longitude) {

    private static final GeoPoint UNRESOLVED = new GeoPoint(Double.NaN, Double.NaN);

    /**
     * The unresolved location (NaN on both axes).
     */
    public static GeoPoint unresolved() {
        return UNRESOLVED;
    }

    /**
     * Returns true if both axes hold a number.
     */
    public boolean isResolved() {
        return !Double.isNaN(latitude) && !Double.isNaN(longitude);
    }

    /**
     * Returns true if both axes compare equal to the other point's.
     * Unresolved points never coincide, not even with themselves.
     */
    public boolean coincidesWith(GeoPoint other) {
        return latitude == other.latitude && longitude == other.longitude;
    }

    /**
     * Arithmetic mean of this point and another, per axis.
     */
    public GeoPoint midpoint(GeoPoint other) {
        return new GeoPoint((latitude + other.latitude) * 0.5, (longitude + other.longitude) * 0.5);
    }
}

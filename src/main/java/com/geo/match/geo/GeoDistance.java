package com.geo.match.geo;

import com.geo.match.core.model.GeoPoint;

/**
 * Distance functions over latitude/longitude points.
 */
public final class GeoDistance {

    /**
     * Mean Earth radius in miles.
     */
    public static final double EARTH_RADIUS_MILES = 3958.8;

    private GeoDistance() {
    }

    /**
     * Great-circle distance in miles using the haversine formula.
     */
    public static double haversine(GeoPoint a, GeoPoint b) {
        return haversine(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    public static double haversine(double lat1, double lng1, double lat2, double lng2) {
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLng = Math.toRadians(lng2 - lng1);

        double sinLat = Math.sin(deltaLat * 0.5);
        double sinLng = Math.sin(deltaLng * 0.5);
        double a = sinLat * sinLat
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) * sinLng * sinLng;
        double c = 2.0 * Math.atan2(Math.sqrt(a), Math.sqrt(1.0 - a));
        return EARTH_RADIUS_MILES * c;
    }

    /**
     * Squared Euclidean distance in degree space. Only meaningful for ranking
     * nearby candidates against each other, never as a reported distance.
     */
    public static double planarProxy(GeoPoint a, GeoPoint b) {
        double dLat = b.latitude() - a.latitude();
        double dLng = b.longitude() - a.longitude();
        return dLat * dLat + dLng * dLng;
    }
}

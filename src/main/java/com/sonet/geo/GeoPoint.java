package com.sonet.geo;

/**
 * A latitude/longitude pair in decimal degrees.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!isValidLatitude(latitude)) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        if (!isValidLongitude(longitude)) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
    }

    public static boolean isValidLatitude(double latitude) {
        return latitude >= -90.0 && latitude <= 90.0;
    }

    public static boolean isValidLongitude(double longitude) {
        return longitude >= -180.0 && longitude <= 180.0;
    }
}

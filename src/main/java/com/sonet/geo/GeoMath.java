package com.sonet.geo;

/**
 * Spherical-earth helpers shared by both geo query strategies.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Mean sphere radius PostGIS uses for {@code ST_DistanceSphere} and for geography
     * functions called with {@code use_spheroid = false}.
     */
    public static final double POSTGIS_SPHERE_RADIUS_M = 6371008.771415;

    /** Slack added to the radius so that an exact-radius match is never lost to rounding. */
    public static final double BOUNDARY_EPSILON_KM = 1e-9;

    private static final double KM_PER_DEGREE_LAT = 111.0;
    private static final double SAFETY_MARGIN = 1.2;
    private static final double MIN_COS_LAT = 1e-9;

    private GeoMath() {}

    /**
     * Estimates a box that contains every point within {@code radiusKm} of the center.
     * The box may contain extra points; it never misses one.
     */
    public static BoundingBox estimateBoundingBox(double lat, double lng, double radiusKm) {
        double latDelta = (radiusKm * SAFETY_MARGIN) / KM_PER_DEGREE_LAT;
        double minLat = Math.max(-90.0, lat - latDelta);
        double maxLat = Math.min(90.0, lat + latDelta);

        // a band touching a pole wraps around every meridian
        if (minLat <= -90.0 || maxLat >= 90.0) {
            return unboundedLongitude(minLat, maxLat);
        }

        double cosLat = Math.cos(Math.toRadians(lat));
        if (cosLat < MIN_COS_LAT) {
            return unboundedLongitude(minLat, maxLat);
        }

        double lngDelta = (radiusKm * SAFETY_MARGIN) / (KM_PER_DEGREE_LAT * cosLat);

        // the circle widens towards the pole; never go narrower than its true extent
        double sinRatio = Math.sin(radiusKm / EARTH_RADIUS_KM) / cosLat;
        if (sinRatio >= 1.0) {
            return unboundedLongitude(minLat, maxLat);
        }
        lngDelta = Math.max(lngDelta, Math.toDegrees(Math.asin(sinRatio)));

        double minLng = lng - lngDelta;
        double maxLng = lng + lngDelta;
        if (lngDelta >= 180.0 || minLng < -180.0 || maxLng > 180.0) {
            return unboundedLongitude(minLat, maxLat);
        }
        return new BoundingBox(minLat, maxLat, minLng, maxLng, true);
    }

    /**
     * Great-circle distance in kilometers (haversine, R = 6371 km).
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        // rounding can push a a hair above 1 for antipodal points
        a = Math.min(1.0, a);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(GeoPoint from, double lat, double lng) {
        return distanceKm(from.latitude(), from.longitude(), lat, lng);
    }

    /**
     * Inclusive radius test.
     */
    public static boolean withinRadius(double distanceKm, double radiusKm) {
        return distanceKm <= radiusKm + BOUNDARY_EPSILON_KM;
    }

    /**
     * Converts a radius on the 6371 km sphere into meters on the PostGIS sphere, so the
     * same angular distance is accepted by both backends.
     */
    public static double toPostgisSphereMeters(double radiusKm) {
        return (radiusKm + BOUNDARY_EPSILON_KM) * 1000.0 * (POSTGIS_SPHERE_RADIUS_M / (EARTH_RADIUS_KM * 1000.0));
    }

    private static BoundingBox unboundedLongitude(double minLat, double maxLat) {
        return new BoundingBox(minLat, maxLat, -180.0, 180.0, false);
    }
}

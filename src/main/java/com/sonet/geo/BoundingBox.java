package com.sonet.geo;

/**
 * Rectangular prefilter region. When {@code longitudeBounded} is false every longitude
 * qualifies and only the latitude band restricts candidates.
 */
public record BoundingBox(double minLat,
                          double maxLat,
                          double minLng,
                          double maxLng,
                          boolean longitudeBounded) {

    public boolean contains(double lat, double lng) {
        if (lat < minLat || lat > maxLat) {
            return false;
        }
        return !longitudeBounded || (lng >= minLng && lng <= maxLng);
    }
}

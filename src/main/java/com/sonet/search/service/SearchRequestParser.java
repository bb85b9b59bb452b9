package com.sonet.search.service;

import com.sonet.common.exception.BusinessException;
import com.sonet.config.SearchProperties;
import com.sonet.geo.GeoPoint;
import com.sonet.post.store.PageWindow;
import com.sonet.search.model.SearchCriteria;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Turns raw query-string values into {@link SearchCriteria} and {@link PageWindow}.
 * Malformed or out-of-range criteria are rejected as INVALID_PARAMETER; malformed paging
 * values fall back to their defaults.
 */
@Component
@RequiredArgsConstructor
public class SearchRequestParser {

    private final SearchProperties props;

    /**
     * Combined search: coordinate, city and text are all optional but at least one is required.
     */
    public SearchCriteria parseSearch(String q, String city, String lat, String lng, String radius) {
        String query = trimToNull(q);
        String cityName = blankToNull(city);
        GeoPoint center = parseCenter(lat, lng, false);

        if (center != null) {
            return SearchCriteria.nearby(center, parseRadius(radius), query);
        }
        if (cityName != null) {
            return SearchCriteria.city(cityName, query);
        }
        if (query != null) {
            return SearchCriteria.text(query);
        }
        throw BusinessException.invalidParameter(
                "At least one search criteria (query, city, or location) is required");
    }

    /**
     * Nearby listing: both coordinates are mandatory.
     */
    public SearchCriteria parseNearby(String lat, String lng, String radius) {
        GeoPoint center = parseCenter(lat, lng, true);
        return SearchCriteria.nearby(center, parseRadius(radius), null);
    }

    /**
     * City listing from a raw, still percent-encoded path segment. The segment is decoded
     * once with form rules, so {@code San+Francisco} and {@code San%20Francisco} both name
     * "San Francisco".
     */
    public SearchCriteria parseCityPathSegment(String rawSegment) {
        if (rawSegment == null) {
            return parseCity(null);
        }
        String decoded;
        try {
            decoded = URLDecoder.decode(rawSegment, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw BusinessException.invalidParameter("Invalid city name format");
        }
        return parseCity(decoded);
    }

    public SearchCriteria parseCity(String city) {
        String cityName = blankToNull(city);
        if (cityName == null) {
            throw BusinessException.invalidParameter("City name is required");
        }
        return SearchCriteria.city(cityName, null);
    }

    /**
     * page defaults to 1 and is floored at 1; limit defaults to the configured default and
     * is clamped to [1, maxLimit].
     */
    public PageWindow parsePage(String page, String limit) {
        int p = parseIntOr(page, 1);
        if (p < 1) {
            p = 1;
        }
        int l = parseIntOr(limit, props.getDefaultLimit());
        l = Math.max(1, Math.min(l, props.getMaxLimit()));
        return PageWindow.of(p, l);
    }

    private GeoPoint parseCenter(String latRaw, String lngRaw, boolean required) {
        String latStr = trimToNull(latRaw);
        String lngStr = trimToNull(lngRaw);
        if (latStr == null && lngStr == null) {
            if (required) {
                throw BusinessException.invalidParameter("Latitude and longitude are required");
            }
            return null;
        }
        if (latStr == null || lngStr == null) {
            throw BusinessException.invalidParameter("Latitude and longitude must be provided together");
        }
        double lat = parseFiniteDouble(latStr, "latitude");
        double lng = parseFiniteDouble(lngStr, "longitude");
        if (!GeoPoint.isValidLatitude(lat)) {
            throw BusinessException.invalidParameter("Latitude must be between -90 and 90");
        }
        if (!GeoPoint.isValidLongitude(lng)) {
            throw BusinessException.invalidParameter("Longitude must be between -180 and 180");
        }
        return new GeoPoint(lat, lng);
    }

    private double parseRadius(String raw) {
        String s = trimToNull(raw);
        if (s == null) {
            return props.getDefaultRadiusKm();
        }
        double radius = parseFiniteDouble(s, "radius");
        if (radius <= 0) {
            throw BusinessException.invalidParameter("Radius must be greater than 0");
        }
        return radius;
    }

    private static double parseFiniteDouble(String s, String name) {
        double v;
        try {
            v = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw BusinessException.invalidParameter("Invalid " + name + " format");
        }
        if (!Double.isFinite(v)) {
            throw BusinessException.invalidParameter("Invalid " + name + " format");
        }
        return v;
    }

    private static int parseIntOr(String s, int fallback) {
        String v = trimToNull(s);
        if (v == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String trimToNull(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    // city is matched exactly, so only an all-blank value is treated as absent
    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}

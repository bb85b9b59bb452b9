package com.sonet.search.model;

import com.sonet.geo.GeoPoint;
import com.sonet.post.model.Post;

/**
 * Validated search inputs. At least one of center, city or query is present; radiusKm is
 * set exactly when center is.
 */
public record SearchCriteria(String query, String city, GeoPoint center, Double radiusKm) {

    public SearchCriteria {
        if (center == null && city == null && query == null) {
            throw new IllegalArgumentException("at least one criterion is required");
        }
        if ((center == null) != (radiusKm == null)) {
            throw new IllegalArgumentException("radius goes with a center");
        }
    }

    public static SearchCriteria nearby(GeoPoint center, double radiusKm, String query) {
        return new SearchCriteria(query, null, center, radiusKm);
    }

    public static SearchCriteria city(String city, String query) {
        return new SearchCriteria(query, city, null, null);
    }

    public static SearchCriteria text(String query) {
        return new SearchCriteria(query, null, null, null);
    }

    public boolean hasQuery() {
        return query != null;
    }

    public SearchMode mode() {
        if (center != null) {
            return SearchMode.NEARBY;
        }
        if (city != null) {
            return SearchMode.CITY;
        }
        return SearchMode.TEXT;
    }

    /**
     * Case-insensitive substring test used for in-process text filtering; folds the same way
     * as the stored {@code content_folded} column.
     */
    public boolean matchesQuery(String content) {
        if (query == null) {
            return true;
        }
        return content != null && Post.foldText(content).contains(Post.foldText(query));
    }
}

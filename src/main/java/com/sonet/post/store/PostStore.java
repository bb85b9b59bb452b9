package com.sonet.post.store;

import com.sonet.geo.GeoPoint;
import com.sonet.post.model.Post;

import java.util.List;

/**
 * Storage boundary for posts. One implementation is bound at startup; callers never see
 * which backend answers. Storage failures propagate as Spring {@code DataAccessException}.
 */
public interface PostStore {

    /**
     * Short backend name used in logs and the health endpoint.
     */
    String adapterName();

    void insert(Post post);

    /**
     * @return the post, or null when no post has this id
     */
    Post findById(String id);

    /**
     * Posts whose city equals {@code city} exactly (case-sensitive), newest first.
     */
    List<Post> listByCity(String city, PageWindow window);

    /**
     * Posts with a coordinate whose great-circle distance from {@code center} is at most
     * {@code radiusKm}, nearest first; ties keep newest-first order.
     */
    List<Post> findNearby(GeoPoint center, double radiusKm, PageWindow window);

    /**
     * Posts whose content contains {@code query} ignoring case, newest first.
     */
    List<Post> searchByText(String query, PageWindow window);

    /**
     * Cheapest possible round trip to the backend.
     */
    void ping();
}

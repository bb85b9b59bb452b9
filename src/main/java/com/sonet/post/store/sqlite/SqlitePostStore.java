package com.sonet.post.store.sqlite;

import com.sonet.geo.BoundingBox;
import com.sonet.geo.GeoMath;
import com.sonet.geo.GeoPoint;
import com.sonet.post.mapper.PostMapper;
import com.sonet.post.model.Post;
import com.sonet.post.store.PageWindow;
import com.sonet.post.store.PostStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Store for backends without spatial indexing. Nearby queries narrow the table with a
 * bounding box in SQL, then filter by exact distance, sort and page in memory.
 */
public class SqlitePostStore implements PostStore {

    private static final Logger log = LoggerFactory.getLogger(SqlitePostStore.class);

    private final PostMapper mapper;

    public SqlitePostStore(PostMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String adapterName() {
        return "sqlite";
    }

    @Override
    public void insert(Post post) {
        mapper.insert(post);
    }

    @Override
    public Post findById(String id) {
        return mapper.findById(id);
    }

    @Override
    public List<Post> listByCity(String city, PageWindow window) {
        return mapper.listByCity(city, window.limit(), window.offset());
    }

    @Override
    public List<Post> findNearby(GeoPoint center, double radiusKm, PageWindow window) {
        BoundingBox box = GeoMath.estimateBoundingBox(center.latitude(), center.longitude(), radiusKm);
        List<Post> candidates = mapper.listInBoundingBox(
                box.minLat(), box.maxLat(), box.minLng(), box.maxLng(), box.longitudeBounded());

        List<Ranked> matched = new ArrayList<>(candidates.size());
        for (Post post : candidates) {
            if (!post.hasCoordinate()) {
                continue;
            }
            double distance = GeoMath.distanceKm(center, post.getLatitude(), post.getLongitude());
            if (GeoMath.withinRadius(distance, radiusKm)) {
                matched.add(new Ranked(post, distance));
            }
        }
        // List.sort is stable: equal distances keep the newest-first order from SQL
        matched.sort(Comparator.comparingDouble(Ranked::distanceKm));

        List<Post> ordered = new ArrayList<>(matched.size());
        for (Ranked r : matched) {
            ordered.add(r.post());
        }
        log.debug("search.nearby adapter=sqlite lat={} lng={} radiusKm={} candidates={} matched={}",
                center.latitude(), center.longitude(), radiusKm, candidates.size(), ordered.size());
        return window.slice(ordered);
    }

    @Override
    public List<Post> searchByText(String query, PageWindow window) {
        return mapper.searchByContent(Post.foldText(query), window.limit(), window.offset());
    }

    @Override
    public void ping() {
        mapper.ping();
    }

    private record Ranked(Post post, double distanceKm) {}
}

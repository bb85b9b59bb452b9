package com.sonet.post.store.postgis;

import com.sonet.geo.GeoMath;
import com.sonet.geo.GeoPoint;
import com.sonet.post.mapper.PostMapper;
import com.sonet.post.model.Post;
import com.sonet.post.store.PageWindow;
import com.sonet.post.store.PostStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Store for PostgreSQL with PostGIS. Radius containment, distance ordering and paging all
 * run in the database against the GiST index on the location expression.
 */
public class PostgisPostStore implements PostStore {

    private static final Logger log = LoggerFactory.getLogger(PostgisPostStore.class);

    private final PostMapper mapper;

    public PostgisPostStore(PostMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String adapterName() {
        return "postgres";
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
        // ST_DWithin takes meters on PostGIS's own sphere; rescale to keep the 6371 km semantics
        double radiusMeters = GeoMath.toPostgisSphereMeters(radiusKm);
        List<Post> posts = mapper.listWithinRadius(
                center.latitude(), center.longitude(), radiusMeters, window.limit(), window.offset());
        log.debug("search.nearby adapter=postgres lat={} lng={} radiusKm={} returned={}",
                center.latitude(), center.longitude(), radiusKm, posts.size());
        return posts;
    }

    @Override
    public List<Post> searchByText(String query, PageWindow window) {
        return mapper.searchByContent(Post.foldText(query), window.limit(), window.offset());
    }

    @Override
    public void ping() {
        mapper.ping();
    }
}

package com.sonet.post.mapper;

import com.sonet.post.model.Post;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Statements that differ between SQLite and PostGIS are split by databaseId in PostMapper.xml.
 */
@Mapper
public interface PostMapper {

    void insert(Post post);

    Post findById(@Param("id") String id);

    // Exact, case-sensitive city match; newest first.
    List<Post> listByCity(@Param("city") String city,
                          @Param("limit") int limit,
                          @Param("offset") int offset);

    // Substring match on content_folded; the caller folds the query with Post.foldText. Newest first.
    List<Post> searchByContent(@Param("foldedQuery") String foldedQuery,
                               @Param("limit") int limit,
                               @Param("offset") int offset);

    // SQLite only: every located post inside the box, newest first, no paging.
    List<Post> listInBoundingBox(@Param("minLat") double minLat,
                                 @Param("maxLat") double maxLat,
                                 @Param("minLng") double minLng,
                                 @Param("maxLng") double maxLng,
                                 @Param("lngBounded") boolean lngBounded);

    // PostGIS only: posts within radiusMeters on the sphere, nearest first.
    List<Post> listWithinRadius(@Param("lat") double lat,
                                @Param("lng") double lng,
                                @Param("radiusMeters") double radiusMeters,
                                @Param("limit") int limit,
                                @Param("offset") int offset);

    int ping();
}

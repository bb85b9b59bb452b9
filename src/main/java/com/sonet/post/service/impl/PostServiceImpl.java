package com.sonet.post.service.impl;

import com.sonet.common.exception.BusinessException;
import com.sonet.common.exception.ErrorCode;
import com.sonet.geo.GeoPoint;
import com.sonet.post.api.dto.PostCreateRequest;
import com.sonet.post.api.dto.PostResponse;
import com.sonet.post.id.SnowflakeIdGenerator;
import com.sonet.post.model.Post;
import com.sonet.post.service.PostService;
import com.sonet.post.service.PostViewMapper;
import com.sonet.post.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostServiceImpl implements PostService {

    private final PostStore postStore;
    private final SnowflakeIdGenerator idGen;
    private final PostViewMapper viewMapper;
    private final Clock clock;

    @Override
    @Transactional
    public PostResponse create(String userId, PostCreateRequest request) {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        Double lat = request.latitude();
        Double lng = request.longitude();
        if ((lat == null) != (lng == null)) {
            throw BusinessException.invalidParameter("latitude and longitude must be provided together");
        }
        if (lat != null && !GeoPoint.isValidLatitude(lat)) {
            throw BusinessException.invalidParameter("Latitude must be between -90 and 90");
        }
        if (lng != null && !GeoPoint.isValidLongitude(lng)) {
            throw BusinessException.invalidParameter("Longitude must be between -180 and 180");
        }

        Instant now = clock.instant();
        Post post = Post.builder()
                .id(idGen.nextIdString())
                .userId(userId)
                .content(request.content())
                .imageUrl(request.imageUrl())
                .metadata(viewMapper.writeMetadata(request.metadata()))
                .city(blankToNull(request.city()))
                .latitude(lat)
                .longitude(lng)
                .createdAt(now)
                .updatedAt(now)
                .build();
        postStore.insert(post);
        log.info("post.create id={} userId={} located={} city={}", post.getId(), userId, post.hasCoordinate(), post.getCity());
        return viewMapper.toResponse(post);
    }

    @Override
    public PostResponse get(String id) {
        Post post = postStore.findById(id);
        if (post == null) {
            throw new BusinessException(ErrorCode.NOT_FOUND, "Post not found: " + id);
        }
        return viewMapper.toResponse(post);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}

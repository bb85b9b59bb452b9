package com.sonet.post.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * A post as returned by the API. {@code distanceKm} is only present on geo search results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PostResponse(
        String id,
        String userId,
        String content,
        String imageUrl,
        Map<String, Object> metadata,
        String city,
        Double latitude,
        Double longitude,
        Instant createdAt,
        Instant updatedAt,
        Double distanceKm
) {}

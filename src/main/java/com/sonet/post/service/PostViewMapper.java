package com.sonet.post.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonet.common.exception.BusinessException;
import com.sonet.common.exception.ErrorCode;
import com.sonet.post.api.dto.PostResponse;
import com.sonet.post.model.Post;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts between stored posts and API views, including the metadata JSON column.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostViewMapper {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PostResponse toResponse(Post post) {
        return toResponse(post, null);
    }

    public PostResponse toResponse(Post post, Double distanceKm) {
        return new PostResponse(
                post.getId(),
                post.getUserId(),
                post.getContent(),
                post.getImageUrl(),
                readMetadata(post),
                post.getCity(),
                post.getLatitude(),
                post.getLongitude(),
                post.getCreatedAt(),
                post.getUpdatedAt(),
                distanceKm
        );
    }

    /**
     * Absent metadata stays NULL; an empty map is stored as {@code {}} and read back as one.
     */
    public String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_PARAMETER, "metadata is not serializable");
        }
    }

    private Map<String, Object> readMetadata(Post post) {
        String json = post.getMetadata();
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            // a broken column must not hide the post itself
            log.warn("post.metadata unreadable id={} error={}", post.getId(), e.getOriginalMessage());
            return null;
        }
    }
}

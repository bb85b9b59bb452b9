package com.sonet.post.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Body of POST /api/v1/posts. Latitude and longitude are given together or not at all.
 */
public record PostCreateRequest(
        @NotBlank @Size(max = 10000) String content,
        @Size(max = 2048) String imageUrl,
        Map<String, Object> metadata,
        @Size(max = 255) String city,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude
) {}

package com.sonet.post.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {
    private String id;
    private String userId;
    private String content;
    private String imageUrl;
    /** JSON object text, e.g. {"mood":"sunny","score":3} */
    private String metadata;
    private String city;
    /** Set together with longitude or not at all. */
    private Double latitude;
    private Double longitude;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasCoordinate() {
        return latitude != null && longitude != null;
    }

    /**
     * Lower-cased content written to {@code content_folded}; text search compares against it
     * so that every backend folds case the same way, non-ASCII letters included.
     */
    public String getContentFolded() {
        return foldText(content);
    }

    public static String foldText(String text) {
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }
}

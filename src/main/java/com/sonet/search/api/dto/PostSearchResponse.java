package com.sonet.search.api.dto;

import com.sonet.post.api.dto.PostResponse;

import java.util.List;

public record PostSearchResponse(
        List<PostResponse> items,
        SearchMeta meta
) {}

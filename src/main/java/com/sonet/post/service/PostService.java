package com.sonet.post.service;

import com.sonet.post.api.dto.PostCreateRequest;
import com.sonet.post.api.dto.PostResponse;

public interface PostService {

    /**
     * Creates a post for {@code userId}. Rejects a coordinate with only one half set.
     */
    PostResponse create(String userId, PostCreateRequest request);

    /**
     * @throws com.sonet.common.exception.BusinessException NOT_FOUND when the id is unknown
     */
    PostResponse get(String id);
}

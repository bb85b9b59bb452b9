package com.sonet.post.api;

import com.sonet.post.api.dto.PostCreateRequest;
import com.sonet.post.api.dto.PostResponse;
import com.sonet.post.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/posts")
@Validated
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    /**
     * Creates a post owned by the caller named in X-User-ID.
     */
    @PostMapping
    public ResponseEntity<PostResponse> create(@RequestHeader("X-User-ID") String userId,
                                               @Valid @RequestBody PostCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(postService.create(userId, request));
    }

    @GetMapping("/{id}")
    public PostResponse get(@PathVariable("id") String id) {
        return postService.get(id);
    }
}

package com.sonet.search.api;

import com.sonet.post.store.PageWindow;
import com.sonet.search.api.dto.PostSearchResponse;
import com.sonet.search.model.SearchCriteria;
import com.sonet.search.service.PostSearchService;
import com.sonet.search.service.SearchRequestParser;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-side post queries. Parameters arrive as raw strings so that malformed values get the
 * same error body as out-of-range ones.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PostSearchController {

    private final PostSearchService searchService;
    private final SearchRequestParser parser;

    /**
     * Combined search; also served at /search/posts.
     * @param q      text to look for in content (optional)
     * @param city   exact city name (optional)
     * @param lat    latitude, requires lng
     * @param lng    longitude, requires lat
     * @param radius km, defaults to the configured radius
     */
    @GetMapping({"/posts/search", "/search/posts"})
    public PostSearchResponse search(@RequestParam(value = "q", required = false) String q,
                                     @RequestParam(value = "city", required = false) String city,
                                     @RequestParam(value = "lat", required = false) String lat,
                                     @RequestParam(value = "lng", required = false) String lng,
                                     @RequestParam(value = "radius", required = false) String radius,
                                     @RequestParam(value = "page", required = false) String page,
                                     @RequestParam(value = "limit", required = false) String limit) {
        SearchCriteria criteria = parser.parseSearch(q, city, lat, lng, radius);
        PageWindow window = parser.parsePage(page, limit);
        return searchService.search(criteria, window);
    }

    @GetMapping("/posts/nearby")
    public PostSearchResponse nearby(@RequestParam(value = "lat", required = false) String lat,
                                     @RequestParam(value = "lng", required = false) String lng,
                                     @RequestParam(value = "radius", required = false) String radius,
                                     @RequestParam(value = "page", required = false) String page,
                                     @RequestParam(value = "limit", required = false) String limit) {
        return searchService.search(parser.parseNearby(lat, lng, radius), parser.parsePage(page, limit));
    }

    /**
     * Exact city listing. The path segment is decoded here rather than by Spring MVC, which
     * leaves '+' untouched; clients commonly form-encode spaces in city names.
     */
    @GetMapping("/posts/city/{cityName}")
    public PostSearchResponse byCity(HttpServletRequest request,
                                     @RequestParam(value = "page", required = false) String page,
                                     @RequestParam(value = "limit", required = false) String limit) {
        SearchCriteria criteria = parser.parseCityPathSegment(rawLastSegment(request));
        return searchService.search(criteria, parser.parsePage(page, limit));
    }

    private static String rawLastSegment(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.substring(uri.lastIndexOf('/') + 1);
    }
}

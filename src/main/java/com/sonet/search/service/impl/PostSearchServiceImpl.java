package com.sonet.search.service.impl;

import com.sonet.geo.GeoMath;
import com.sonet.geo.GeoPoint;
import com.sonet.post.api.dto.PostResponse;
import com.sonet.post.model.Post;
import com.sonet.post.service.PostViewMapper;
import com.sonet.post.store.PageWindow;
import com.sonet.post.store.PostStore;
import com.sonet.search.api.dto.PostSearchResponse;
import com.sonet.search.api.dto.SearchMeta;
import com.sonet.search.model.SearchCriteria;
import com.sonet.search.model.SearchMode;
import com.sonet.search.service.PostSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostSearchServiceImpl implements PostSearchService {

    private final PostStore postStore;
    private final PostViewMapper viewMapper;

    @Override
    public PostSearchResponse search(SearchCriteria criteria, PageWindow window) {
        SearchMode mode = criteria.mode();
        List<Post> page = switch (mode) {
            case NEARBY -> nearby(criteria, window);
            case CITY -> city(criteria, window);
            case TEXT -> postStore.searchByText(criteria.query(), window);
        };

        List<PostResponse> items = new ArrayList<>(page.size());
        GeoPoint center = criteria.center();
        for (Post p : page) {
            Double distance = (center != null && p.hasCoordinate())
                    ? GeoMath.distanceKm(center, p.getLatitude(), p.getLongitude())
                    : null;
            items.add(viewMapper.toResponse(p, distance));
        }

        log.info("search.posts mode={} adapter={} hasQuery={} page={} limit={} count={}",
                mode, postStore.adapterName(), criteria.hasQuery(), window.page(), window.limit(), items.size());
        return new PostSearchResponse(items, meta(criteria, mode, window, items.size()));
    }

    // With a secondary query the store cannot page for us: the filter must see every
    // candidate first, otherwise pages would come back short or skip matches.
    private List<Post> nearby(SearchCriteria c, PageWindow window) {
        if (!c.hasQuery()) {
            return postStore.findNearby(c.center(), c.radiusKm(), window);
        }
        List<Post> all = postStore.findNearby(c.center(), c.radiusKm(), PageWindow.unbounded());
        return window.slice(filterByQuery(all, c));
    }

    private List<Post> city(SearchCriteria c, PageWindow window) {
        if (!c.hasQuery()) {
            return postStore.listByCity(c.city(), window);
        }
        List<Post> all = postStore.listByCity(c.city(), PageWindow.unbounded());
        return window.slice(filterByQuery(all, c));
    }

    private static List<Post> filterByQuery(List<Post> posts, SearchCriteria c) {
        return posts.stream()
                .filter(p -> c.matchesQuery(p.getContent()))
                .collect(Collectors.toList());
    }

    private static SearchMeta meta(SearchCriteria c, SearchMode mode, PageWindow window, int count) {
        GeoPoint center = c.center();
        return new SearchMeta(
                mode.name().toLowerCase(Locale.ROOT),
                c.query(),
                c.city(),
                center == null ? null : center.latitude(),
                center == null ? null : center.longitude(),
                c.radiusKm(),
                window.page(),
                window.limit(),
                window.offset(),
                count
        );
    }
}

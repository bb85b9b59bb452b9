package com.sonet.search.service;

import com.sonet.post.store.PageWindow;
import com.sonet.search.api.dto.PostSearchResponse;
import com.sonet.search.model.SearchCriteria;

public interface PostSearchService {

    /**
     * Runs one search. Geo criteria take priority over city, city over text; a query that is
     * not the primary criterion narrows the result before the page is cut.
     *
     * @param criteria validated criteria
     * @param window   requested page
     * @return the page of posts plus a description of how it was resolved
     */
    PostSearchResponse search(SearchCriteria criteria, PageWindow window);
}

package com.sonet.post.store;

import java.util.Collections;
import java.util.List;

/**
 * A limit/offset window over an ordered result.
 *
 * @param page   1-based page number the window was derived from
 * @param limit  maximum number of items
 * @param offset items to skip
 */
public record PageWindow(int page, int limit, int offset) {

    private static final PageWindow UNBOUNDED = new PageWindow(1, Integer.MAX_VALUE, 0);

    public PageWindow {
        if (page < 1 || limit < 1 || offset < 0) {
            throw new IllegalArgumentException("invalid window page=" + page + " limit=" + limit + " offset=" + offset);
        }
    }

    public static PageWindow of(int page, int limit) {
        long offset = (long) (page - 1) * limit;
        return new PageWindow(page, limit, (int) Math.min(offset, Integer.MAX_VALUE));
    }

    /**
     * The whole result; used when filtering continues after the store returns.
     */
    public static PageWindow unbounded() {
        return UNBOUNDED;
    }

    public boolean isUnbounded() {
        return offset == 0 && limit == Integer.MAX_VALUE;
    }

    /**
     * Applies the window to an already filtered and ordered list.
     */
    public <T> List<T> slice(List<T> items) {
        if (offset >= items.size()) {
            return Collections.emptyList();
        }
        int end = (int) Math.min((long) offset + limit, items.size());
        return List.copyOf(items.subList(offset, end));
    }
}

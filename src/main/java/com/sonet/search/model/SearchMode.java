package com.sonet.search.model;

/**
 * Retrieval path chosen for a request, in priority order.
 */
public enum SearchMode {
    NEARBY,
    CITY,
    TEXT
}

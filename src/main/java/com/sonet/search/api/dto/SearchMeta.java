package com.sonet.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Echo of the resolved criteria and the page window.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchMeta(
        String mode,
        String query,
        String city,
        Double lat,
        Double lng,
        Double radius,
        int page,
        int limit,
        int offset,
        int count
) {}

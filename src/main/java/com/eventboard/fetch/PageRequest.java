package com.eventboard.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable parameters of one page request. A new instance is built for every page.
 */
public record PageRequest(
        String endpoint,
        Map<String, String> params,
        int page,
        int perPage
) {
    public static final int MAX_PER_PAGE = 1000;

    public PageRequest {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        endpoint = endpoint.trim();
        perPage = clampPerPage(perPage);
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static PageRequest of(String endpoint, Map<String, String> params, int page, int perPage) {
        return new PageRequest(endpoint, params, page, perPage);
    }

    public static int clampPerPage(int perPage) {
        return Math.max(1, Math.min(MAX_PER_PAGE, perPage));
    }

    /**
     * Endpoint selectors followed by {@code page} and {@code per_page}.
     */
    public Map<String, String> query() {
        Map<String, String> query = new LinkedHashMap<>(params);
        query.put("page", Integer.toString(page));
        query.put("per_page", Integer.toString(perPage));
        return query;
    }
}

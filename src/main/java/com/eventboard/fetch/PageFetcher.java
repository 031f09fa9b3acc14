package com.eventboard.fetch;

import com.eventboard.core.Outcome;
import com.eventboard.model.PageResponse;

import java.util.Map;

/**
 * Issues a single page request. Implementations never retry; a failed attempt is returned as a failure outcome.
 */
public interface PageFetcher {

    Outcome<PageResponse> fetch(PageRequest request);

    default Outcome<PageResponse> fetch(String endpoint, Map<String, String> params, int page, int perPage) {
        return fetch(PageRequest.of(endpoint, params, page, perPage));
    }
}

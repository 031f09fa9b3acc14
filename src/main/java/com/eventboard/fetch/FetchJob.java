package com.eventboard.fetch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One dataset to fetch: its name (e.g. {@code announcements_equity}), family, endpoint path and selectors.
 */
public record FetchJob(
        String datasetName,
        String family,
        String endpoint,
        Map<String, String> params
) {
    public FetchJob {
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String market() {
        return params.get("market");
    }
}

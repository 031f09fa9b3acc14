package com.eventboard.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cross-dataset index written next to the dataset files after a bulk fetch.
 */
public final class SummaryIndex {
    public final String fetchTimestamp;
    public final String sourceUrl;
    public final Map<String, Entry> datasets;

    public SummaryIndex(String fetchTimestamp, String sourceUrl, Map<String, Entry> datasets) {
        this.fetchTimestamp = fetchTimestamp == null ? "" : fetchTimestamp;
        this.sourceUrl = sourceUrl == null ? "" : sourceUrl;
        this.datasets = datasets == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    public int totalFiles() {
        return datasets.size();
    }

    public long totalRecords() {
        long total = 0L;
        for (Entry entry : datasets.values()) {
            total += entry.recordCount;
        }
        return total;
    }

    @Value
    @AllArgsConstructor(access = AccessLevel.PUBLIC)
    public static class Entry {
        public final int recordCount;
        public final String fileReference;
    }
}

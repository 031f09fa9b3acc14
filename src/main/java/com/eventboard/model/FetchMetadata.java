package com.eventboard.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Provenance of a page or of a whole dataset. {@code totalRecords} and {@code totalPagesScraped} count what was
 * actually obtained; the {@code sourceTotal*} fields hold what the source last reported.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FetchMetadata {
    public final String sourceEndpoint;
    public final Map<String, String> requestParams;
    public final String scrapeTimestamp;
    public final int totalRecords;
    public final int totalPagesScraped;
    public final String marketType;
    public final String sourceUrl;
    public final int sourceTotalPages;
    public final int sourceTotalRecords;

    public String marketTypeOr(String fallback) {
        return marketType == null || marketType.isBlank() ? fallback : marketType;
    }
}

package com.eventboard.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Pagination block reported by the source with every page; re-read on each response.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PaginationInfo {
    public final int page;
    public final int perPage;
    public final int totalPages;
    public final int totalRecords;
}

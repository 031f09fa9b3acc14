package com.eventboard.model;

import java.util.List;

/**
 * One accepted page: its records plus the pagination and metadata envelope.
 */
public record PageResponse(
        List<DataRecord> records,
        PaginationInfo pagination,
        FetchMetadata metadata
) {
    public PageResponse {
        records = records == null ? List.of() : List.copyOf(records);
    }
}

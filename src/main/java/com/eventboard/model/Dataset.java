package com.eventboard.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Records of one endpoint/market combination plus provenance.
 * A non-null {@code fetchError} marks a partial dataset: pages after the failure were never requested.
 */
public final class Dataset {
    public final FetchMetadata metadata;
    public final List<DataRecord> records;
    public final FetchError fetchError;
    public final Instant fetchedAt;

    public Dataset(FetchMetadata metadata, List<DataRecord> records, FetchError fetchError, Instant fetchedAt) {
        this.metadata = metadata;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.fetchError = fetchError;
        this.fetchedAt = fetchedAt == null ? Instant.now() : fetchedAt;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public boolean isPartial() {
        return fetchError != null;
    }

    public Optional<FetchError> error() {
        return Optional.ofNullable(fetchError);
    }
}

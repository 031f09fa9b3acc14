package com.eventboard.fetch;

import com.eventboard.config.Config;
import com.eventboard.core.Outcome;
import com.eventboard.model.DataRecord;
import com.eventboard.model.Dataset;
import com.eventboard.model.FetchError;
import com.eventboard.model.FetchMetadata;
import com.eventboard.model.PageResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Walks every page of one endpoint/parameter combination and assembles a {@link Dataset}.
 * <p>
 * The page count is re-read from each response. The first failed page ends the walk: records of the accepted
 * pages are kept and the error is recorded on the dataset rather than thrown. A cancel request or thread
 * interrupt observed between pages ends the walk the same way, with an {@code INTERRUPTED} error.
 */
public final class Aggregator {
    private static final Logger LOG = LogManager.getLogger(Aggregator.class);

    private final PageFetcher fetcher;
    private final int perPage;
    private final long requestDelayMs;
    private final Sleeper sleeper;
    private final BooleanSupplier cancelled;

    public Aggregator(Config config, PageFetcher fetcher, BooleanSupplier cancelled) {
        this(
                fetcher,
                config.getInt("api.per_page", PageRequest.MAX_PER_PAGE),
                Math.max(0L, config.getLong("api.request_delay_ms", 500L)),
                Sleeper.SYSTEM,
                cancelled
        );
    }

    public Aggregator(PageFetcher fetcher, int perPage, long requestDelayMs, Sleeper sleeper, BooleanSupplier cancelled) {
        this.fetcher = fetcher;
        this.perPage = PageRequest.clampPerPage(perPage);
        this.requestDelayMs = Math.max(0L, requestDelayMs);
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.cancelled = cancelled == null ? () -> false : cancelled;
    }

    public Dataset fetchAll(String endpoint, Map<String, String> params) {
        Map<String, String> fixedParams = params == null ? Map.of() : new LinkedHashMap<>(params);
        List<DataRecord> accumulated = new ArrayList<>();
        FetchMetadata lastMetadata = null;
        FetchError error = null;
        int page = 1;
        int totalPages = 1;
        int pagesFetched = 0;

        LOG.info("Fetching from: {} {}", endpoint, fixedParams);
        while (page <= totalPages) {
            if (isCancelled()) {
                error = FetchError.interrupted(page);
                LOG.warn("Fetch of {} interrupted before page {}", endpoint, page);
                break;
            }
            Outcome<PageResponse> outcome = fetcher.fetch(PageRequest.of(endpoint, fixedParams, page, perPage));
            if (!outcome.success) {
                error = outcome.error == null ? FetchError.api("unknown failure", page) : outcome.error;
                LOG.warn("Error on {} page {}: {}", endpoint, page, error.describe());
                break;
            }

            PageResponse response = outcome.value;
            totalPages = response.pagination() == null ? 1 : response.pagination().totalPages;
            accumulated.addAll(response.records());
            lastMetadata = response.metadata();
            pagesFetched++;
            LOG.info("  Page {}/{} - {} records ({} total)", page, totalPages, response.records().size(), accumulated.size());

            page++;
            pause();
        }

        Dataset dataset = new Dataset(
                buildMetadata(endpoint, fixedParams, lastMetadata, accumulated.size(), pagesFetched),
                accumulated,
                error,
                Instant.now()
        );
        if (error != null) {
            LOG.warn("Partial dataset for {}: {} pages / {} records before {}",
                    endpoint, pagesFetched, accumulated.size(), error.describe());
        }
        return dataset;
    }

    private boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    private void pause() {
        if (requestDelayMs <= 0L) {
            return;
        }
        try {
            sleeper.sleep(requestDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static FetchMetadata buildMetadata(
            String endpoint,
            Map<String, String> params,
            FetchMetadata last,
            int recordCount,
            int pagesFetched
    ) {
        FetchMetadata.FetchMetadataBuilder builder = last == null
                ? FetchMetadata.builder().scrapeTimestamp("").sourceUrl("").marketType(params.get("market"))
                : last.toBuilder();
        return builder
                .sourceEndpoint(endpoint)
                .requestParams(Collections.unmodifiableMap(new LinkedHashMap<>(params)))
                .totalRecords(recordCount)
                .totalPagesScraped(pagesFetched)
                .build();
    }
}

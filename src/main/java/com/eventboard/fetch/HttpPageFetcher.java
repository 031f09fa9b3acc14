package com.eventboard.fetch;

import com.eventboard.config.Config;
import com.eventboard.core.Outcome;
import com.eventboard.data.http.HttpClientEx;
import com.eventboard.data.json.OrderedJson;
import com.eventboard.data.json.RecordCodec;
import com.eventboard.model.DataRecord;
import com.eventboard.model.FetchError;
import com.eventboard.model.FetchMetadata;
import com.eventboard.model.PageResponse;
import com.eventboard.model.PaginationInfo;
import org.json.JSONException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * {@link PageFetcher} over the remote HTTP/JSON API.
 * <p>
 * Response envelope: {@code {success, error?, metadata, pagination, data}}.
 */
public final class HttpPageFetcher implements PageFetcher {
    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public HttpPageFetcher(Config config, HttpClientEx http) {
        this(http, config.getString("api.base_url"), Math.max(1, config.getInt("api.timeout_sec", 30)));
    }

    public HttpPageFetcher(HttpClientEx http, String baseUrl, int timeoutSec) {
        this.http = http;
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    @Override
    public Outcome<PageResponse> fetch(PageRequest request) {
        String url = HttpClientEx.buildUrl(baseUrl, request.endpoint(), request.query());
        HttpClientEx.Response resp;
        try {
            resp = http.get(url, timeoutSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(FetchError.interrupted(request.page()), request.endpoint());
        } catch (IOException | RuntimeException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return Outcome.failure(FetchError.transport(reason, request.page()), request.endpoint(), Map.of("url", url));
        }
        if (!resp.isSuccess()) {
            return Outcome.failure(
                    FetchError.http(resp.statusCode, abbreviate(resp.body, 200), request.page()),
                    request.endpoint(),
                    Map.of("url", url)
            );
        }
        return parseEnvelope(request, resp.body);
    }

    static Outcome<PageResponse> parseEnvelope(PageRequest request, String body) {
        Map<String, Object> root;
        try {
            root = OrderedJson.parseObject(body);
        } catch (JSONException e) {
            return Outcome.failure(
                    FetchError.api("malformed response: " + e.getMessage(), request.page()),
                    request.endpoint()
            );
        }
        if (!OrderedJson.optBoolean(root, "success", false)) {
            String error = OrderedJson.optString(root, "error", "request reported success=false");
            return Outcome.failure(FetchError.api(error, request.page()), request.endpoint());
        }

        Map<String, Object> pagination = OrderedJson.asObject(root.get("pagination"));
        PaginationInfo info = new PaginationInfo(
                OrderedJson.optInt(pagination, "page", request.page()),
                OrderedJson.optInt(pagination, "per_page", request.perPage()),
                OrderedJson.optInt(pagination, "total_pages", 1),
                OrderedJson.optInt(pagination, "total_records", 0)
        );

        Map<String, Object> meta = OrderedJson.asObject(root.get("metadata"));
        FetchMetadata metadata = FetchMetadata.builder()
                .sourceEndpoint(request.endpoint())
                .requestParams(request.params())
                .scrapeTimestamp(OrderedJson.optString(meta, "scrape_timestamp", ""))
                .totalRecords(OrderedJson.optInt(meta, "total_records", info.totalRecords))
                .totalPagesScraped(OrderedJson.optInt(meta, "total_pages_scraped", OrderedJson.optInt(meta, "total_pages", 0)))
                .marketType(OrderedJson.optString(meta, "market_type", request.params().get("market")))
                .sourceUrl(OrderedJson.optString(meta, "source_url", ""))
                .sourceTotalPages(info.totalPages)
                .sourceTotalRecords(info.totalRecords)
                .build();

        List<DataRecord> records = RecordCodec.toRecords(root.get("data"));
        return Outcome.success(
                new PageResponse(records, info, metadata),
                request.endpoint(),
                Map.of("records", records.size())
        );
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        String t = text.trim();
        return t.length() <= max ? t : t.substring(0, max) + "...";
    }
}

package com.eventboard.storage;

import com.eventboard.data.json.OrderedJson;
import com.eventboard.data.json.RecordCodec;
import com.eventboard.model.Dataset;
import com.eventboard.model.DataRecord;
import com.eventboard.model.FetchError;
import com.eventboard.model.FetchErrorKind;
import com.eventboard.model.FetchMetadata;
import com.eventboard.model.SummaryIndex;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes dataset files and the run summary in one output directory.
 * <p>
 * Dataset file: {@code {metadata, total_records, fetched_at, source, params, fetch_error?, data}}.
 * Summary file: {@code {fetch_timestamp, api_url, total_files, total_records, datasets{name:{records, file}}}}.
 */
public class DatasetStore {
    private static final Logger LOG = LogManager.getLogger(DatasetStore.class);

    public static final String SUMMARY_FILE = "summary.json";
    private static final String FILE_SUFFIX = "_all.json";

    private final Path dir;
    private final String sourceUrl;

    public DatasetStore(Path dir, String sourceUrl) {
        this.dir = dir;
        this.sourceUrl = sourceUrl == null ? "" : sourceUrl;
    }

    public Path dir() {
        return dir;
    }

    public static String fileNameFor(String datasetName) {
        return datasetName + FILE_SUFFIX;
    }

    /**
     * Writes the dataset to {@code <dir>/<name>_all.json}, replacing any previous file of that name.
     * The file is written to a temporary sibling first and moved into place.
     */
    public Path save(Dataset dataset, String name) throws StorageException {
        if (dataset == null || dataset.isEmpty()) {
            throw new IllegalArgumentException("refusing to persist an empty dataset: " + name);
        }
        Path target = dir.resolve(fileNameFor(name));
        writeJson(target, toDocument(dataset));
        LOG.info("Saved: {} ({} records)", target, dataset.size());
        return target;
    }

    public SummaryIndex buildSummary(Map<String, Dataset> datasets) {
        return buildSummary(datasets, Instant.now());
    }

    /**
     * One entry per dataset present in {@code datasets}, in iteration order.
     */
    public SummaryIndex buildSummary(Map<String, Dataset> datasets, Instant fetchTimestamp) {
        Map<String, SummaryIndex.Entry> entries = new LinkedHashMap<>();
        if (datasets != null) {
            for (Map.Entry<String, Dataset> entry : datasets.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                entries.put(entry.getKey(), new SummaryIndex.Entry(entry.getValue().size(), fileNameFor(entry.getKey())));
            }
        }
        return new SummaryIndex(fetchTimestamp == null ? "" : fetchTimestamp.toString(), sourceUrl, entries);
    }

    public Path writeSummary(SummaryIndex summary) throws StorageException {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("fetch_timestamp", summary.fetchTimestamp);
        doc.put("api_url", summary.sourceUrl);
        doc.put("total_files", summary.totalFiles());
        doc.put("total_records", summary.totalRecords());
        Map<String, Object> datasets = new LinkedHashMap<>();
        for (Map.Entry<String, SummaryIndex.Entry> entry : summary.datasets.entrySet()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("records", entry.getValue().recordCount);
            item.put("file", entry.getValue().fileReference);
            datasets.put(entry.getKey(), item);
        }
        doc.put("datasets", datasets);
        Path target = dir.resolve(SUMMARY_FILE);
        writeJson(target, doc);
        return target;
    }

    /**
     * Dataset files in the directory (the summary excluded), sorted by name.
     */
    public List<DatasetFile> list() throws StorageException {
        List<DatasetFile> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path path : stream) {
                String fileName = path.getFileName().toString();
                if (fileName.equals(SUMMARY_FILE) || !Files.isRegularFile(path)) {
                    continue;
                }
                out.add(new DatasetFile(
                        fileName.substring(0, fileName.length() - ".json".length()),
                        path,
                        Files.size(path),
                        Files.getLastModifiedTime(path).toInstant()
                ));
            }
        } catch (IOException e) {
            throw new StorageException("failed to list " + dir + ": " + e.getMessage(), e);
        }
        out.sort(Comparator.comparing((DatasetFile f) -> f.name));
        return out;
    }

    public Dataset load(Path path) throws StorageException {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("failed to read " + path + ": " + e.getMessage(), e);
        }
        Map<String, Object> root;
        try {
            root = OrderedJson.parseObject(stripBom(text));
        } catch (JSONException e) {
            throw new StorageException("not a dataset file " + path + ": " + e.getMessage(), e);
        }
        return fromDocument(root);
    }

    static Map<String, Object> toDocument(Dataset dataset) {
        FetchMetadata m = dataset.metadata;
        Map<String, Object> meta = new LinkedHashMap<>();
        Map<String, String> params = m == null || m.requestParams == null ? Map.of() : m.requestParams;
        if (m != null) {
            meta.put("source_endpoint", m.sourceEndpoint);
            meta.put("request_params", new LinkedHashMap<String, Object>(params));
            meta.put("scrape_timestamp", m.scrapeTimestamp);
            meta.put("total_records", m.totalRecords);
            meta.put("total_pages_scraped", m.totalPagesScraped);
            if (m.marketType != null && !m.marketType.isBlank()) {
                meta.put("market_type", m.marketType);
            }
            meta.put("source_url", m.sourceUrl);
            meta.put("total_pages", m.sourceTotalPages);
            meta.put("source_total_records", m.sourceTotalRecords);
        }

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("metadata", meta);
        doc.put("total_records", dataset.size());
        doc.put("fetched_at", dataset.fetchedAt.toString());
        doc.put("source", m == null ? "" : m.sourceEndpoint);
        doc.put("params", new LinkedHashMap<String, Object>(params));
        if (dataset.fetchError != null) {
            FetchError e = dataset.fetchError;
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("kind", e.kind.label());
            err.put("http_status", e.httpStatus);
            err.put("message", e.message);
            err.put("page", e.page);
            doc.put("fetch_error", err);
        }
        doc.put("data", RecordCodec.fromRecords(dataset.records));
        return doc;
    }

    static Dataset fromDocument(Map<String, Object> root) {
        Map<String, Object> meta = OrderedJson.asObject(root.get("metadata"));
        Map<String, String> params = new LinkedHashMap<>();
        Map<String, Object> rawParams = OrderedJson.asObject(root.containsKey("params")
                ? root.get("params")
                : meta.get("request_params"));
        for (Map.Entry<String, Object> entry : rawParams.entrySet()) {
            if (entry.getKey().equals("page") || entry.getKey().equals("per_page")) {
                continue;
            }
            params.put(entry.getKey(), String.valueOf(entry.getValue()));
        }

        List<DataRecord> records = RecordCodec.toRecords(root.get("data"));
        FetchMetadata metadata = FetchMetadata.builder()
                .sourceEndpoint(OrderedJson.optString(root, "source", OrderedJson.optString(meta, "source_endpoint", "")))
                .requestParams(params)
                .scrapeTimestamp(OrderedJson.optString(meta, "scrape_timestamp", ""))
                .totalRecords(OrderedJson.optInt(meta, "total_records", records.size()))
                .totalPagesScraped(OrderedJson.optInt(meta, "total_pages_scraped", OrderedJson.optInt(meta, "total_pages", 0)))
                .marketType(OrderedJson.optString(meta, "market_type", params.get("market")))
                .sourceUrl(OrderedJson.optString(meta, "source_url", ""))
                .sourceTotalPages(OrderedJson.optInt(meta, "total_pages", 0))
                .sourceTotalRecords(OrderedJson.optInt(meta, "source_total_records", OrderedJson.optInt(meta, "total_records", 0)))
                .build();

        FetchError error = null;
        Map<String, Object> err = OrderedJson.asObject(root.get("fetch_error"));
        if (!err.isEmpty()) {
            error = FetchError.of(
                    FetchErrorKind.fromLabel(OrderedJson.optString(err, "kind", "")),
                    OrderedJson.optInt(err, "http_status", 0),
                    OrderedJson.optString(err, "message", ""),
                    OrderedJson.optInt(err, "page", 0)
            );
        }
        return new Dataset(metadata, records, error, parseInstant(OrderedJson.optString(root, "fetched_at", "")));
    }

    private void writeJson(Path target, Object doc) throws StorageException {
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                OrderedJson.write(doc, writer);
            }
            moveIntoPlace(tmp, target);
        } catch (IOException | JSONException e) {
            deleteQuietly(tmp);
            throw new StorageException("failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }

    private static String stripBom(String text) {
        return text != null && text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException ignored) {
            // Files written by older tooling carry a local timestamp without offset.
        }
        try {
            return LocalDateTime.parse(raw.trim()).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}

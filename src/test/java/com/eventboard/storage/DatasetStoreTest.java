package com.eventboard.storage;

import com.eventboard.model.CellValue;
import com.eventboard.model.DataRecord;
import com.eventboard.model.Dataset;
import com.eventboard.model.FetchError;
import com.eventboard.model.FetchErrorKind;
import com.eventboard.model.FetchMetadata;
import com.eventboard.model.SummaryIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatasetStoreTest {

    @TempDir
    Path dir;

    @Test
    void savedDatasetShouldLoadBackWithCellsAndProvenance() throws Exception {
        DatasetStore store = new DatasetStore(dir, "https://api.example.test");
        Dataset dataset = new Dataset(
                metadata("/announcements", Map.of("market", "sme")),
                List.of(
                        DataRecord.of("SYMBOL", CellValue.rich("ABC", "link", "/q/ABC"),
                                "SUBJECT", "Dividend",
                                "ATTACHMENT", CellValue.rich("Notice", "pdf", "/n.pdf")),
                        DataRecord.of("SYMBOL", "XYZ", "SUBJECT", "Board Meeting", "ATTACHMENT", CellValue.empty())
                ),
                FetchError.http(503, "Service Unavailable", 3),
                Instant.parse("2024-01-15T10:00:00Z")
        );

        Path file = store.save(dataset, "announcements_sme");
        Dataset loaded = store.load(file);

        assertEquals("announcements_sme_all.json", file.getFileName().toString());
        assertEquals(2, loaded.size());
        assertEquals(dataset.records, loaded.records);
        CellValue.Rich attachment = assertInstanceOf(CellValue.Rich.class,
                loaded.records.get(0).get("ATTACHMENT").orElseThrow());
        assertEquals("pdf", attachment.kind());
        assertEquals("/announcements", loaded.metadata.sourceEndpoint);
        assertEquals("sme", loaded.metadata.requestParams.get("market"));
        assertEquals(2, loaded.metadata.totalPagesScraped);
        assertEquals(FetchErrorKind.HTTP, loaded.fetchError.kind);
        assertEquals(3, loaded.fetchError.page);
        assertEquals(Instant.parse("2024-01-15T10:00:00Z"), loaded.fetchedAt);
    }

    @Test
    void saveShouldRefuseEmptyDatasets() {
        DatasetStore store = new DatasetStore(dir, "");
        Dataset empty = new Dataset(metadata("/crd", Map.of()), List.of(), null, null);

        assertThrows(IllegalArgumentException.class, () -> store.save(empty, "crd"));
        assertFalse(Files.exists(dir.resolve(DatasetStore.fileNameFor("crd"))));
    }

    @Test
    void summaryShouldListSavedDatasetsInOrder() throws Exception {
        DatasetStore store = new DatasetStore(dir, "https://api.example.test");
        Map<String, Dataset> saved = new LinkedHashMap<>();
        saved.put("event_calendar", dataset(3));
        saved.put("crd", dataset(2));

        SummaryIndex summary = store.buildSummary(saved, Instant.parse("2024-01-15T10:00:00Z"));
        Path path = store.writeSummary(summary);
        String json = Files.readString(path, StandardCharsets.UTF_8);

        assertEquals(2, summary.totalFiles());
        assertEquals(5L, summary.totalRecords());
        assertTrue(json.indexOf("\"event_calendar\"") < json.indexOf("\"crd\""));
        assertTrue(json.contains("\"file\":\"crd_all.json\""));
        assertTrue(json.contains("\"api_url\":\"https://api.example.test\""));
    }

    @Test
    void listShouldSkipSummaryAndSortByName() throws Exception {
        DatasetStore store = new DatasetStore(dir, "");
        store.save(dataset(1), "crd");
        store.save(dataset(1), "announcements_equity");
        store.writeSummary(store.buildSummary(Map.of()));

        List<String> names = store.list().stream().map(f -> f.name).collect(Collectors.toList());

        assertEquals(List.of("announcements_equity_all", "crd_all"), names);
    }

    @Test
    void loadShouldAcceptBomAndLocalTimestamps() throws Exception {
        Path file = dir.resolve("latest_equity.json");
        Files.writeString(file, "\uFEFF{\"metadata\":{\"scrape_timestamp\":\"2024-01-15T09:00:00\",\"total_records\":1},"
                + "\"fetched_at\":\"2024-01-15T09:30:00\",\"data\":[{\"SYMBOL\":\"ABC\",\"PRICE\":12.5,\"FLAG\":true}]}",
                StandardCharsets.UTF_8);

        Dataset loaded = new DatasetStore(dir, "").load(file);

        assertEquals(1, loaded.size());
        CellValue price = loaded.records.get(0).get("PRICE").orElseThrow();
        assertEquals("12.5", price.text());
        assertFalse(price.textual());
    }

    @Test
    void loadShouldReportUnreadableFiles() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        assertThrows(StorageException.class, () -> new DatasetStore(dir, "").load(file));
    }

    private static Dataset dataset(int size) {
        List<DataRecord> records = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            records.add(DataRecord.of("ID", Integer.toString(i)));
        }
        return new Dataset(metadata("/crd", Map.of()), records, null, null);
    }

    private static FetchMetadata metadata(String endpoint, Map<String, String> params) {
        return FetchMetadata.builder()
                .sourceEndpoint(endpoint)
                .requestParams(params)
                .scrapeTimestamp("2024-01-15T09:00:00")
                .totalRecords(2)
                .totalPagesScraped(2)
                .marketType(params.get("market"))
                .sourceUrl("https://www.nseindia.com")
                .build();
    }
}

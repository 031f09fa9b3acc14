package com.eventboard.fetch;

import com.eventboard.core.Outcome;
import com.eventboard.data.http.HttpClientEx;
import com.eventboard.model.Dataset;
import com.eventboard.model.FetchError;
import com.eventboard.model.PageResponse;
import com.eventboard.storage.DatasetStore;
import com.eventboard.storage.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BulkFetchRunnerTest {
    private static final String READY = "{\"status\":\"ok\",\"ready\":true,\"monitors\":{\"announcements\":true}}";
    private static final String WAITING = "{\"status\":\"starting\",\"ready\":false,\"monitors\":{\"announcements\":false}}";

    @TempDir
    Path dir;

    private final List<FetchJob> jobs = List.of(
            new FetchJob("announcements_equity", "announcements", "/announcements", Map.of("market", "equity")),
            new FetchJob("crd", "crd", "/crd", Map.of()),
            new FetchJob("credit_rating_sme", "credit_rating", "/credit-rating", Map.of("market", "sme"))
    );

    @Test
    void emptyDatasetsShouldNeverReachTheStore() throws Exception {
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
                .page("/announcements", 1, "A", "B")
                .page("/crd", 1)
                .page("/credit-rating", 1, "C");
        RecordingStore store = new RecordingStore(dir);

        BulkFetchReport report = runner(READY, fetcher, store, true, () -> false).run();

        assertEquals(List.of("announcements_equity", "credit_rating_sme"), store.saved);
        assertEquals(BulkFetchReport.JobStatus.EMPTY, report.results.get(1).status);
        assertEquals(2, report.summary.totalFiles());
        assertEquals(3L, report.summary.totalRecords());
        assertTrue(Files.exists(dir.resolve(DatasetStore.SUMMARY_FILE)));
        assertFalse(Files.exists(dir.resolve(DatasetStore.fileNameFor("crd"))));
    }

    @Test
    void partialDatasetShouldBeSavedByDefault() throws Exception {
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
                .page("/announcements", 2, "A")
                .fail("/announcements", FetchError.http(500, "boom", 2))
                .page("/crd", 1, "B")
                .page("/credit-rating", 1, "C");
        RecordingStore store = new RecordingStore(dir);

        BulkFetchReport report = runner(READY, fetcher, store, true, () -> false).run();

        assertEquals(3, store.saved.size());
        assertEquals(1L, report.partialCount());
        assertEquals(BulkFetchReport.JobStatus.SAVED, report.results.get(0).status);
        Dataset reloaded = store.load(dir.resolve(DatasetStore.fileNameFor("announcements_equity")));
        assertEquals(500, reloaded.fetchError.httpStatus);
    }

    @Test
    void partialDatasetShouldBeSkippedWhenConfiguredSo() throws Exception {
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher()
                .page("/announcements", 2, "A")
                .fail("/announcements", FetchError.api("Invalid market type", 2))
                .page("/crd", 1, "B")
                .page("/credit-rating", 1, "C");
        RecordingStore store = new RecordingStore(dir);

        BulkFetchReport report = runner(READY, fetcher, store, false, () -> false).run();

        assertEquals(List.of("crd", "credit_rating_sme"), store.saved);
        assertEquals(BulkFetchReport.JobStatus.PARTIAL_NOT_SAVED, report.results.get(0).status);
    }

    @Test
    void refusedGateShouldIssueNoPageRequests() throws Exception {
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher();
        RecordingStore store = new RecordingStore(dir);

        BulkFetchReport report = runner(WAITING, fetcher, store, true, () -> false).run();

        assertTrue(report.refused());
        assertTrue(fetcher.requests.isEmpty());
        assertTrue(store.saved.isEmpty());
        assertNull(report.summary);
        assertEquals("no monitors are ready yet", report.gate.reason);
    }

    @Test
    void cancellationShouldKeepDatasetsObtainedSoFar() throws Exception {
        AtomicBoolean cancel = new AtomicBoolean(false);
        ScriptedPageFetcher fetcher = new ScriptedPageFetcher() {
            @Override
            public Outcome<PageResponse> fetch(PageRequest request) {
                if (request.endpoint().equals("/crd")) {
                    cancel.set(true);
                }
                return super.fetch(request);
            }
        }
                .page("/announcements", 1, "A")
                .page("/crd", 2, "B")
                .page("/crd", 2, "C");
        RecordingStore store = new RecordingStore(dir);

        BulkFetchReport report = runner(READY, fetcher, store, true, cancel::get).run();

        assertTrue(report.interrupted);
        assertEquals(List.of("announcements_equity", "crd"), store.saved);
        assertEquals(2, report.results.size());
        assertEquals(2, report.summary.totalFiles());
    }

    private BulkFetchRunner runner(
            String health,
            PageFetcher fetcher,
            DatasetStore store,
            boolean persistPartial,
            BooleanSupplier cancelled
    ) {
        HttpClientEx http = new HttpClientEx() {
            @Override
            public Response get(String url, int timeoutSeconds) {
                return new Response(200, health);
            }
        };
        HealthProbe probe = new HealthProbe(http, "http://localhost", 1);
        Aggregator aggregator = new Aggregator(fetcher, 1000, 0L, ms -> { }, cancelled);
        return new BulkFetchRunner(probe, aggregator, store, jobs, ProceedDecision.never(), persistPartial, cancelled);
    }

    private static final class RecordingStore extends DatasetStore {
        final List<String> saved = new ArrayList<>();

        RecordingStore(Path dir) {
            super(dir, "https://example.test");
        }

        @Override
        public Path save(Dataset dataset, String name) throws StorageException {
            if (dataset.isEmpty()) {
                throw new AssertionError("empty dataset handed to save: " + name);
            }
            saved.add(name);
            return super.save(dataset, name);
        }
    }
}

package com.eventboard.fetch;

import com.eventboard.config.Config;
import com.eventboard.core.RunTelemetry;
import com.eventboard.model.Dataset;
import com.eventboard.model.FetchErrorKind;
import com.eventboard.model.SummaryIndex;
import com.eventboard.storage.DatasetStore;
import com.eventboard.storage.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Fetches every catalog job in order, one at a time, and persists the non-empty results.
 */
public final class BulkFetchRunner {
    private static final Logger LOG = LogManager.getLogger(BulkFetchRunner.class);

    private final HealthProbe probe;
    private final Aggregator aggregator;
    private final DatasetStore store;
    private final List<FetchJob> jobs;
    private final ProceedDecision decision;
    private final boolean persistPartial;
    private final BooleanSupplier cancelled;

    public BulkFetchRunner(
            Config config,
            HealthProbe probe,
            Aggregator aggregator,
            DatasetStore store,
            ProceedDecision decision,
            BooleanSupplier cancelled
    ) {
        this(
                probe,
                aggregator,
                store,
                EndpointCatalog.selected(config),
                decision,
                config.getBoolean("fetch.persist_partial", true),
                cancelled
        );
    }

    public BulkFetchRunner(
            HealthProbe probe,
            Aggregator aggregator,
            DatasetStore store,
            List<FetchJob> jobs,
            ProceedDecision decision,
            boolean persistPartial,
            BooleanSupplier cancelled
    ) {
        this.probe = probe;
        this.aggregator = aggregator;
        this.store = store;
        this.jobs = jobs == null ? List.of() : List.copyOf(jobs);
        this.decision = decision == null ? ProceedDecision.never() : decision;
        this.persistPartial = persistPartial;
        this.cancelled = cancelled == null ? () -> false : cancelled;
    }

    public BulkFetchReport run() throws StorageException {
        RunTelemetry telemetry = new RunTelemetry("bulk_fetch", Instant.now());

        telemetry.startStep(RunTelemetry.STEP_HEALTH_PROBE);
        HealthProbe.GateResult gate = probe.gate(decision);
        telemetry.endStep(RunTelemetry.STEP_HEALTH_PROBE, 0, 0, gate.proceed ? 0 : 1, gate.reason);
        if (!gate.proceed) {
            LOG.warn("Bulk fetch refused: {}", gate.reason);
            telemetry.finish();
            return new BulkFetchReport(gate, List.of(), null, telemetry, false);
        }
        LOG.info("Health gate open: {}", gate.reason);

        Map<String, Dataset> saved = new LinkedHashMap<>();
        List<BulkFetchReport.JobResult> results = new ArrayList<>();
        boolean interrupted = false;
        for (FetchJob job : jobs) {
            if (isCancelled()) {
                interrupted = true;
                break;
            }
            telemetry.startStep(job.datasetName());
            Dataset dataset = aggregator.fetchAll(job.endpoint(), job.params());
            telemetry.endStep(
                    job.datasetName(),
                    dataset.metadata == null ? 0 : dataset.metadata.totalPagesScraped,
                    dataset.size(),
                    dataset.isPartial() ? 1 : 0,
                    dataset.isPartial() ? dataset.fetchError.describe() : ""
            );
            results.add(persist(job, dataset, saved, telemetry));

            if (dataset.isPartial() && dataset.fetchError.kind == FetchErrorKind.INTERRUPTED) {
                interrupted = true;
                break;
            }
        }
        if (interrupted) {
            telemetry.markInterrupted();
            LOG.warn("Fetch interrupted; keeping {} dataset(s) obtained so far", saved.size());
        }

        telemetry.startStep(RunTelemetry.STEP_SUMMARY_WRITE);
        SummaryIndex summary = store.buildSummary(saved);
        Path summaryPath = store.writeSummary(summary);
        telemetry.endStep(RunTelemetry.STEP_SUMMARY_WRITE, 0, summary.totalRecords(), 0, summaryPath.getFileName().toString());
        telemetry.finish();
        LOG.info("Run telemetry:\n{}", telemetry.getSummary());
        return new BulkFetchReport(gate, results, summary, telemetry, interrupted);
    }

    private BulkFetchReport.JobResult persist(
            FetchJob job,
            Dataset dataset,
            Map<String, Dataset> saved,
            RunTelemetry telemetry
    ) throws StorageException {
        if (dataset.isEmpty()) {
            LOG.warn("No data available for {}", job.datasetName());
            telemetry.markSkipped();
            return new BulkFetchReport.JobResult(job, BulkFetchReport.JobStatus.EMPTY, dataset, null);
        }
        if (dataset.isPartial() && !persistPartial) {
            LOG.warn("Partial dataset {} not saved ({} records before {})",
                    job.datasetName(), dataset.size(), dataset.fetchError.describe());
            telemetry.markSkipped();
            return new BulkFetchReport.JobResult(job, BulkFetchReport.JobStatus.PARTIAL_NOT_SAVED, dataset, null);
        }
        Path file = store.save(dataset, job.datasetName());
        saved.put(job.datasetName(), dataset);
        telemetry.markSaved();
        return new BulkFetchReport.JobResult(job, BulkFetchReport.JobStatus.SAVED, dataset, file);
    }

    private boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }
}

package com.eventboard.fetch;

import com.eventboard.core.RunTelemetry;
import com.eventboard.model.Dataset;
import com.eventboard.model.FetchError;
import com.eventboard.model.SummaryIndex;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * What a bulk run did: the gate decision, one result per attempted job and the written summary.
 */
public final class BulkFetchReport {
    public final HealthProbe.GateResult gate;
    public final List<JobResult> results;
    public final SummaryIndex summary;
    public final RunTelemetry telemetry;
    public final boolean interrupted;

    BulkFetchReport(
            HealthProbe.GateResult gate,
            List<JobResult> results,
            SummaryIndex summary,
            RunTelemetry telemetry,
            boolean interrupted
    ) {
        this.gate = gate;
        this.results = results == null ? List.of() : List.copyOf(results);
        this.summary = summary;
        this.telemetry = telemetry;
        this.interrupted = interrupted;
    }

    public boolean refused() {
        return gate != null && !gate.proceed;
    }

    public long partialCount() {
        return results.stream().filter(r -> r.error != null).count();
    }

    public enum JobStatus {
        SAVED,
        EMPTY,
        PARTIAL_NOT_SAVED
    }

    public static final class JobResult {
        public final FetchJob job;
        public final JobStatus status;
        public final int records;
        public final int pages;
        public final FetchError error;
        public final Path file;

        JobResult(FetchJob job, JobStatus status, Dataset dataset, Path file) {
            this.job = job;
            this.status = status;
            this.records = dataset == null ? 0 : dataset.size();
            this.pages = dataset == null || dataset.metadata == null ? 0 : dataset.metadata.totalPagesScraped;
            this.error = dataset == null ? null : dataset.fetchError;
            this.file = file;
        }

        public String describe() {
            StringBuilder sb = new StringBuilder(job.datasetName()).append(": ");
            switch (status) {
                case EMPTY:
                    sb.append("no data available");
                    break;
                case PARTIAL_NOT_SAVED:
                    sb.append("not saved");
                    break;
                default:
                    sb.append(String.format(Locale.US, "%,d records", records));
                    if (file != null) {
                        sb.append(" -> ").append(file.getFileName());
                    }
                    break;
            }
            if (error != null) {
                sb.append(String.format(Locale.US, " (partial: %d pages / %,d records before %s)", pages, records, error.describe()));
            }
            return sb.toString();
        }
    }
}

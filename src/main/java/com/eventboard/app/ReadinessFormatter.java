package com.eventboard.app;

import com.eventboard.fetch.BulkFetchReport;
import com.eventboard.model.ReadinessReport;
import com.eventboard.model.SummaryIndex;

import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of health reports and bulk-fetch results for the console.
 */
public final class ReadinessFormatter {
    private ReadinessFormatter() {
    }

    public static String format(ReadinessReport report) {
        StringBuilder sb = new StringBuilder();
        if (report == null || !report.available) {
            sb.append("API unavailable: ").append(report == null ? "no report" : report.reason).append('\n');
            return sb.toString();
        }
        sb.append("API status: ").append(report.status).append('\n');
        sb.append("Ready: ").append(report.ready).append('\n');
        sb.append("Timestamp: ").append(report.timestamp == null ? "-" : report.timestamp).append('\n');
        if (!report.monitors.isEmpty()) {
            sb.append("Monitors:").append('\n');
            for (Map.Entry<String, Boolean> monitor : report.monitors.entrySet()) {
                sb.append("  ")
                        .append(Boolean.TRUE.equals(monitor.getValue()) ? "[ready]   " : "[waiting] ")
                        .append(monitor.getKey())
                        .append('\n');
            }
        }
        if (!report.anyMonitorReady()) {
            sb.append("WARNING: no monitors are ready yet, data may be incomplete").append('\n');
        }
        return sb.toString();
    }

    public static String format(BulkFetchReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(60)).append('\n');
        sb.append("FETCH SUMMARY").append('\n');
        sb.append("=".repeat(60)).append('\n');
        for (BulkFetchReport.JobResult result : report.results) {
            sb.append("  ").append(result.describe()).append('\n');
        }
        SummaryIndex summary = report.summary;
        if (summary != null) {
            sb.append(String.format(Locale.US, "Files saved: %d%n", summary.totalFiles()));
            sb.append(String.format(Locale.US, "Total records: %,d%n", summary.totalRecords()));
        }
        if (report.partialCount() > 0) {
            sb.append("Partial datasets: ").append(report.partialCount()).append('\n');
        }
        if (report.telemetry != null) {
            sb.append(String.format(Locale.US, "Elapsed: %.1fs%n", report.telemetry.totalElapsedMs() / 1000.0));
        }
        if (report.interrupted) {
            sb.append("Run was interrupted; datasets above were kept").append('\n');
        }
        return sb.toString();
    }
}

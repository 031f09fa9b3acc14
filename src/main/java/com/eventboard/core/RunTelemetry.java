package com.eventboard.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single bulk-fetch run's per-dataset timings and counters.
 */
public final class RunTelemetry {
    public static final String STEP_HEALTH_PROBE = "HEALTH_PROBE";
    public static final String STEP_SUMMARY_WRITE = "SUMMARY_WRITE";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;

    private int pagesTotal;
    private long recordsTotal;
    private int datasetsSaved;
    private int datasetsSkipped;
    private int errorsTotal;
    private boolean interrupted;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String trigger, Instant startedAt) {
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
        this.finishedAt = null;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    /**
     * Closes a step. For dataset steps {@code pages} is the number of accepted pages and
     * {@code records} the number of records obtained.
     */
    public synchronized void endStep(String name, long pages, long records, long errorCount) {
        endStep(name, pages, records, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long pages,
            long records,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.pages += Math.max(0L, pages);
        stat.records += Math.max(0L, records);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        pagesTotal += (int) Math.max(0L, pages);
        recordsTotal += Math.max(0L, records);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized void markSaved() {
        datasetsSaved++;
    }

    public synchronized void markSkipped() {
        datasetsSkipped++;
    }

    public synchronized void markInterrupted() {
        interrupted = true;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.pages,
                    stat.records,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("pages_total=").append(pagesTotal).append('\n');
        sb.append("records_total=").append(recordsTotal).append('\n');
        sb.append("datasets_saved=").append(datasetsSaved).append('\n');
        sb.append("datasets_skipped=").append(datasetsSkipped).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("interrupted=").append(interrupted).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d pages=%d records=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.pages,
                    stat.records,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = optionalNote.trim();
        } else if (!stat.optionalNote.contains(optionalNote.trim())) {
            stat.optionalNote = stat.optionalNote + "; " + optionalNote.trim();
        }
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long pages;
        private long records;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long pages,
            long records,
            long errorCount,
            String optionalNote
    ) {
    }
}

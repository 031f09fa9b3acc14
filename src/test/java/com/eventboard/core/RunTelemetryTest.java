package com.eventboard.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("bulk_fetch", Instant.parse("2024-01-15T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_HEALTH_PROBE);
        telemetry.endStep(RunTelemetry.STEP_HEALTH_PROBE, 0, 0, 0, "1/1 monitors ready");
        telemetry.startStep("announcements_equity");
        telemetry.endStep("announcements_equity", 3, 2500, 1, "HTTP 503 on page 4");
        telemetry.markSaved();
        telemetry.markSkipped();
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("trigger=bulk_fetch"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("pages_total=3"));
        assertTrue(summary.contains("records_total=2500"));
        assertTrue(summary.contains("datasets_saved=1"));
        assertTrue(summary.contains("datasets_skipped=1"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains("ANNOUNCEMENTS_EQUITY"));
        assertTrue(summary.contains("note=HTTP 503 on page 4"));
        assertEquals(2, telemetry.stepRecords().size());
    }
}

package com.eventboard.fetch;

import com.eventboard.data.http.HttpClientEx;
import com.eventboard.model.ReadinessReport;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthProbeTest {

    @Test
    void parseShouldKeepMonitorOrder() {
        ReadinessReport report = HealthProbe.parse(200,
                "{\"status\":\"ok\",\"ready\":true,\"monitors\":{\"event_calendar\":true,\"announcements\":false,\"crd\":true},"
                        + "\"timestamp\":\"2024-01-15T10:00:00\"}");

        assertTrue(report.available);
        assertEquals("ok", report.status);
        assertEquals(List.of("event_calendar", "announcements", "crd"), List.copyOf(report.monitors.keySet()));
        assertEquals(2, report.readyMonitorCount());
    }

    @Test
    void unreadableBodyShouldMarkProbeUnavailable() {
        ReadinessReport report = HealthProbe.parse(502, "Bad Gateway");

        assertFalse(report.available);
        assertTrue(report.reason.contains("502"));
    }

    @Test
    void gateShouldOpenWhenAnyMonitorIsReady() {
        ReadinessReport report = ReadinessReport.reachable("ok", true, Map.of("crd", true), "");

        HealthProbe.GateResult gate = HealthProbe.evaluate(report, ProceedDecision.never());

        assertTrue(gate.proceed);
        assertEquals("1/1 monitors ready", gate.reason);
    }

    @Test
    void gateShouldConsultDecisionWhenNoMonitorIsReady() {
        ReadinessReport report = ReadinessReport.reachable("starting", false, Map.of("crd", false), "");

        assertFalse(HealthProbe.evaluate(report, ProceedDecision.never()).proceed);
        assertTrue(HealthProbe.evaluate(report, ProceedDecision.always()).proceed);
    }

    @Test
    void unavailableProbeShouldBlockUnlessOverridden() {
        ReadinessReport report = ReadinessReport.unavailable("connection refused");

        HealthProbe.GateResult refused = HealthProbe.evaluate(report, (r, situation) ->
                situation == ProceedDecision.Situation.NO_READY_MONITORS);
        HealthProbe.GateResult allowed = HealthProbe.evaluate(report, (r, situation) ->
                situation == ProceedDecision.Situation.PROBE_UNAVAILABLE);

        assertFalse(refused.proceed);
        assertTrue(refused.reason.startsWith("ProbeUnavailable"));
        assertTrue(allowed.proceed);
    }

    @Test
    void transportFailureShouldYieldUnavailableReport() {
        HttpClientEx failing = new HttpClientEx() {
            @Override
            public Response get(String url, int timeoutSeconds) throws IOException {
                throw new IOException("Connection refused");
            }
        };
        HealthProbe probe = new HealthProbe(failing, "http://localhost:1", 1);

        ReadinessReport report = probe.check();

        assertFalse(report.available);
        assertTrue(report.reason.contains("Connection refused"));
    }
}

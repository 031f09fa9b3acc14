package com.eventboard.fetch;

import com.eventboard.config.Config;
import com.eventboard.data.http.HttpClientEx;
import com.eventboard.data.json.OrderedJson;
import com.eventboard.model.ReadinessReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the source's readiness endpoint ({@code {status, ready, monitors, timestamp}}) and gates bulk fetches.
 */
public final class HealthProbe {
    private static final Logger LOG = LogManager.getLogger(HealthProbe.class);

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public HealthProbe(Config config, HttpClientEx http) {
        this(http, config.getString("api.base_url"), Math.max(1, config.getInt("api.health_timeout_sec", 10)));
    }

    public HealthProbe(HttpClientEx http, String baseUrl, int timeoutSec) {
        this.http = http;
        this.baseUrl = baseUrl == null ? "" : baseUrl.trim();
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    public ReadinessReport check() {
        String url = HttpClientEx.buildUrl(baseUrl, "/health", Map.of());
        HttpClientEx.Response resp;
        try {
            resp = http.get(url, timeoutSec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReadinessReport.unavailable("health check interrupted");
        } catch (IOException | RuntimeException e) {
            String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.warn("Health check failed: {}", reason);
            return ReadinessReport.unavailable("health endpoint unreachable: " + reason);
        }
        return parse(resp.statusCode, resp.body);
    }

    static ReadinessReport parse(int statusCode, String body) {
        Map<String, Object> root;
        try {
            root = OrderedJson.parseObject(body);
        } catch (JSONException e) {
            return ReadinessReport.unavailable("health endpoint returned HTTP " + statusCode + " without a readable body");
        }
        Map<String, Boolean> monitors = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : OrderedJson.asObject(root.get("monitors")).entrySet()) {
            monitors.put(entry.getKey(), Boolean.TRUE.equals(entry.getValue()));
        }
        return ReadinessReport.reachable(
                OrderedJson.optString(root, "status", ""),
                OrderedJson.optBoolean(root, "ready", false),
                monitors,
                OrderedJson.optString(root, "timestamp", "")
        );
    }

    /**
     * Probes the source and applies the gate policy.
     */
    public GateResult gate(ProceedDecision decision) {
        return evaluate(check(), decision);
    }

    public static GateResult evaluate(ReadinessReport report, ProceedDecision decision) {
        ProceedDecision d = decision == null ? ProceedDecision.never() : decision;
        if (!report.available) {
            boolean proceed = d.proceed(report, ProceedDecision.Situation.PROBE_UNAVAILABLE);
            return new GateResult(report, proceed, proceed
                    ? "health probe unavailable, proceeding by override"
                    : "ProbeUnavailable: " + report.reason);
        }
        if (!report.anyMonitorReady()) {
            boolean proceed = d.proceed(report, ProceedDecision.Situation.NO_READY_MONITORS);
            return new GateResult(report, proceed, proceed
                    ? "no monitors ready, proceeding by override"
                    : "no monitors are ready yet");
        }
        return new GateResult(report, true, report.readyMonitorCount() + "/" + report.monitors.size() + " monitors ready");
    }

    public static final class GateResult {
        public final ReadinessReport report;
        public final boolean proceed;
        public final String reason;

        public GateResult(ReadinessReport report, boolean proceed, String reason) {
            this.report = report;
            this.proceed = proceed;
            this.reason = reason == null ? "" : reason;
        }
    }
}

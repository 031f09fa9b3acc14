package com.eventboard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a health probe. {@code available == false} means the health endpoint could not be read at all.
 */
public final class ReadinessReport {
    public final boolean available;
    public final String status;
    public final boolean ready;
    public final Map<String, Boolean> monitors;
    public final String timestamp;
    public final String reason;

    private ReadinessReport(
            boolean available,
            String status,
            boolean ready,
            Map<String, Boolean> monitors,
            String timestamp,
            String reason
    ) {
        this.available = available;
        this.status = status == null ? "" : status;
        this.ready = ready;
        this.monitors = monitors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(monitors));
        this.timestamp = timestamp == null ? "" : timestamp;
        this.reason = reason == null ? "" : reason;
    }

    public static ReadinessReport reachable(String status, boolean ready, Map<String, Boolean> monitors, String timestamp) {
        return new ReadinessReport(true, status, ready, monitors, timestamp, "");
    }

    public static ReadinessReport unavailable(String reason) {
        return new ReadinessReport(false, "unavailable", false, Map.of(), "", reason);
    }

    public int readyMonitorCount() {
        int count = 0;
        for (Boolean value : monitors.values()) {
            if (Boolean.TRUE.equals(value)) {
                count++;
            }
        }
        return count;
    }

    public boolean anyMonitorReady() {
        return readyMonitorCount() > 0;
    }
}

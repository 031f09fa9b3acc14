package com.eventboard.fetch;

import com.eventboard.config.Config;
import com.eventboard.model.ReadinessReport;

/**
 * Decides whether a bulk fetch may go ahead when the health gate is not clearly open.
 */
@FunctionalInterface
public interface ProceedDecision {

    enum Situation {
        NO_READY_MONITORS,
        PROBE_UNAVAILABLE
    }

    boolean proceed(ReadinessReport report, Situation situation);

    static ProceedDecision never() {
        return (report, situation) -> false;
    }

    static ProceedDecision always() {
        return (report, situation) -> true;
    }

    /**
     * Uses {@code fetch.proceed_without_ready_monitors} and {@code fetch.proceed_when_probe_unavailable}.
     */
    static ProceedDecision fromConfig(Config config) {
        boolean withoutMonitors = config.getBoolean("fetch.proceed_without_ready_monitors", false);
        boolean withoutProbe = config.getBoolean("fetch.proceed_when_probe_unavailable", false);
        return (report, situation) -> situation == Situation.PROBE_UNAVAILABLE ? withoutProbe : withoutMonitors;
    }
}

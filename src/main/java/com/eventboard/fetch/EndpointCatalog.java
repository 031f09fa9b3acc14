package com.eventboard.fetch;

import com.eventboard.config.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fixed, ordered list of endpoint/market combinations fetched by a bulk run.
 */
public final class EndpointCatalog {
    public static final String EVENT_CALENDAR = "event_calendar";
    public static final String ANNOUNCEMENTS = "announcements";
    public static final String CRD = "crd";
    public static final String CREDIT_RATING = "credit_rating";

    static final List<String> ANNOUNCEMENT_MARKETS = List.of("equity", "sme", "debt", "mf");
    static final List<String> CREDIT_RATING_MARKETS = List.of("equity", "sme");

    private EndpointCatalog() {
    }

    public static List<FetchJob> all() {
        List<FetchJob> jobs = new ArrayList<>();
        jobs.add(new FetchJob(EVENT_CALENDAR, EVENT_CALENDAR, "/event-calendar", Map.of()));
        for (String market : ANNOUNCEMENT_MARKETS) {
            jobs.add(new FetchJob(ANNOUNCEMENTS + "_" + market, ANNOUNCEMENTS, "/announcements", Map.of("market", market)));
        }
        jobs.add(new FetchJob(CRD, CRD, "/crd", Map.of()));
        for (String market : CREDIT_RATING_MARKETS) {
            jobs.add(new FetchJob(CREDIT_RATING + "_" + market, CREDIT_RATING, "/credit-rating", Map.of("market", market)));
        }
        return List.copyOf(jobs);
    }

    /**
     * Jobs whose family is listed in {@code fetch.endpoints}; an empty list selects everything.
     */
    public static List<FetchJob> selected(Config config) {
        return select(config.getList("fetch.endpoints"));
    }

    public static List<FetchJob> select(List<String> families) {
        if (families == null || families.isEmpty()) {
            return all();
        }
        Set<String> wanted = families.stream()
                .map(f -> f.trim().toLowerCase(Locale.ROOT).replace('-', '_'))
                .collect(Collectors.toSet());
        List<FetchJob> out = new ArrayList<>();
        for (FetchJob job : all()) {
            if (wanted.contains(job.family()) || wanted.contains(job.datasetName())) {
                out.add(job);
            }
        }
        return out;
    }
}

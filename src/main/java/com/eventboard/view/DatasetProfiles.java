package com.eventboard.view;

import com.eventboard.model.Dataset;
import com.eventboard.model.DataRecord;

import java.util.List;
import java.util.Locale;

public final class DatasetProfiles {

    public static final DatasetProfile EVENT_CALENDAR = DatasetProfile.builder()
            .name("event_calendar")
            .title("NSE EVENT CALENDAR")
            .recordNoun("events")
            .keyField("SYMBOL")
            .companyField("COMPANY")
            .companyField("SYMBOL")
            .subjectField("PURPOSE")
            .dateField("DATE")
            .stat(new DatasetProfile.FieldStat("Top Event Purposes", "PURPOSE", 10))
            .stat(new DatasetProfile.FieldStat("Events by Date", "DATE", 10))
            .build();

    public static final DatasetProfile ANNOUNCEMENTS = DatasetProfile.builder()
            .name("announcements")
            .title("NSE ANNOUNCEMENTS")
            .recordNoun("announcements")
            .keyField("SYMBOL")
            .companyField("COMPANY NAME")
            .companyField("SYMBOL")
            .subjectField("SUBJECT")
            .dateField("BROADCAST DATE/TIME")
            .stat(new DatasetProfile.FieldStat("Top Announcement Subjects", "SUBJECT", 15))
            .kindCounter(new DatasetProfile.KindCounter("With PDF", "ATTACHMENT", "pdf"))
            .kindCounter(new DatasetProfile.KindCounter("With XBRL", "XBRL", "xbrl"))
            .preset(new DatasetProfile.Preset("Financial Results", "SUBJECT", "result"))
            .preset(new DatasetProfile.Preset("Dividend", "SUBJECT", "dividend"))
            .build();

    public static final DatasetProfile CRD = DatasetProfile.builder()
            .name("crd")
            .title("NSE CRD (CREDIT RATING DATABASE)")
            .recordNoun("records")
            .companyField("COMPANY NAME")
            .subjectField("CREDIT RATING")
            .searchField("NAME OF CREDIT RATING AGENCY")
            .stat(new DatasetProfile.FieldStat("Top Rating Agencies", "NAME OF CREDIT RATING AGENCY", 10))
            .stat(new DatasetProfile.FieldStat("Top Credit Ratings", "CREDIT RATING", 10))
            .stat(new DatasetProfile.FieldStat("Rating Actions", "RATING ACTION", 0))
            .preset(new DatasetProfile.Preset("Upgrades", "RATING ACTION", "upgrade"))
            .preset(new DatasetProfile.Preset("Downgrades", "RATING ACTION", "downgrade"))
            .build();

    public static final DatasetProfile CREDIT_RATING = DatasetProfile.builder()
            .name("credit_rating")
            .title("NSE CREDIT RATING (REG. 30)")
            .recordNoun("records")
            .keyField("SYMBOL")
            .companyField("COMPANY NAME")
            .companyField("SYMBOL")
            .subjectField("CURRENT ACTION")
            .searchField("CREDIT RATING")
            .stat(new DatasetProfile.FieldStat("Top Credit Ratings", "CREDIT RATING", 10))
            .stat(new DatasetProfile.FieldStat("Current Actions", "CURRENT ACTION", 10))
            .stat(new DatasetProfile.FieldStat("Credit Types", "CREDIT TYPE", 10))
            .build();

    private DatasetProfiles() {
    }

    /**
     * Profile with no role fields; the explorer falls back to asking for field names.
     */
    public static DatasetProfile generic(String name, List<DataRecord> records) {
        DatasetProfile.DatasetProfileBuilder builder = DatasetProfile.builder()
                .name(name == null ? "dataset" : name)
                .title(name == null ? "DATASET" : name.toUpperCase(Locale.ROOT))
                .recordNoun("records");
        if (records != null && !records.isEmpty() && records.get(0).size() > 0) {
            String first = records.get(0).fieldNames().get(0);
            builder.stat(new DatasetProfile.FieldStat("Top " + first, first, 10));
        }
        return builder.build();
    }

    /**
     * Picks a profile from the dataset name, then the source endpoint, then the source URL.
     */
    public static DatasetProfile forDataset(String name, Dataset dataset) {
        String endpoint = dataset == null || dataset.metadata == null ? null : dataset.metadata.sourceEndpoint;
        String url = dataset == null || dataset.metadata == null ? null : dataset.metadata.sourceUrl;
        for (String hint : new String[]{name, endpoint, url}) {
            DatasetProfile profile = match(hint);
            if (profile != null) {
                return profile;
            }
        }
        return generic(name, dataset == null ? List.of() : dataset.records);
    }

    static DatasetProfile match(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String h = hint.toLowerCase(Locale.ROOT).replace('-', '_');
        if (h.contains("event_calendar")) {
            return EVENT_CALENDAR;
        }
        if (h.contains("announcement")) {
            return ANNOUNCEMENTS;
        }
        if (h.contains("credit_rating")) {
            return CREDIT_RATING;
        }
        if (h.contains("crd")) {
            return CRD;
        }
        return null;
    }
}

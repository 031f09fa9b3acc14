package com.eventboard.view;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Which fields of a dataset play which role in the explorer.
 */
@Value
@Builder(toBuilder = true)
public class DatasetProfile {
    String name;
    String title;
    String recordNoun;
    String keyField;
    @Singular("companyField")
    List<String> companyFields;
    String subjectField;
    String dateField;
    @Singular("searchField")
    List<String> searchFields;
    @Singular("stat")
    List<FieldStat> stats;
    @Singular("kindCounter")
    List<KindCounter> kindCounters;
    @Singular("preset")
    List<Preset> presets;

    public boolean hasSubject() {
        return subjectField != null && !subjectField.isBlank();
    }

    /**
     * Subject field first, then any extra searchable fields.
     */
    public List<String> searchableFields() {
        List<String> out = new ArrayList<>();
        if (hasSubject()) {
            out.add(subjectField);
        }
        for (String field : searchFields) {
            if (field != null && !field.isBlank() && !out.contains(field)) {
                out.add(field);
            }
        }
        return out;
    }

    public boolean hasDate() {
        return dateField != null && !dateField.isBlank();
    }

    /**
     * Frequency table over {@code field}; {@code topN <= 0} lists every value.
     */
    public record FieldStat(String label, String field, int topN) {
    }

    /**
     * Counts records whose {@code field} is a rich cell of the given kind.
     */
    public record KindCounter(String label, String field, String kind) {
    }

    /**
     * Canned keyword filter, e.g. dividend announcements.
     */
    public record Preset(String label, String field, String keyword) {
    }
}

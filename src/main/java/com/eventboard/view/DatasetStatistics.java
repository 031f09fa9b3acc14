package com.eventboard.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary numbers for one dataset or filtered subset.
 */
public final class DatasetStatistics {
    public final int totalRecords;
    /** Null when the profile has no company field. */
    public final Integer uniqueCompanies;
    public final Map<String, Integer> kindCounts;
    public final Map<String, List<Map.Entry<String, Integer>>> frequencyTables;

    public DatasetStatistics(int totalRecords,
                             Integer uniqueCompanies,
                             Map<String, Integer> kindCounts,
                             Map<String, List<Map.Entry<String, Integer>>> frequencyTables) {
        this.totalRecords = totalRecords;
        this.uniqueCompanies = uniqueCompanies;
        this.kindCounts = kindCounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kindCounts));
        this.frequencyTables = frequencyTables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frequencyTables));
    }

    public String format(String noun) {
        StringBuilder sb = new StringBuilder();
        sb.append("Total ").append(noun == null ? "records" : noun).append(": ").append(totalRecords).append('\n');
        if (uniqueCompanies != null) {
            sb.append("Unique companies: ").append(uniqueCompanies).append('\n');
        }
        for (Map.Entry<String, Integer> kind : kindCounts.entrySet()) {
            sb.append(kind.getKey()).append(": ").append(kind.getValue()).append('\n');
        }
        for (Map.Entry<String, List<Map.Entry<String, Integer>>> table : frequencyTables.entrySet()) {
            sb.append('\n').append(table.getKey()).append(':').append('\n');
            for (Map.Entry<String, Integer> row : table.getValue()) {
                sb.append("  ").append(row.getKey()).append(": ").append(row.getValue()).append('\n');
            }
        }
        return sb.toString();
    }
}

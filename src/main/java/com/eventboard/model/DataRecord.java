package com.eventboard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of a dataset: field name to cell, in the order the source sent them.
 * Different records of the same dataset may carry different field sets.
 */
public final class DataRecord {
    private final Map<String, CellValue> fields;

    public DataRecord(Map<String, CellValue> fields) {
        Map<String, CellValue> copy = new LinkedHashMap<>();
        if (fields != null) {
            for (Map.Entry<String, CellValue> entry : fields.entrySet()) {
                if (entry.getKey() == null) {
                    continue;
                }
                copy.put(entry.getKey(), entry.getValue() == null ? CellValue.empty() : entry.getValue());
            }
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    public static DataRecord of(Object... keyValues) {
        Map<String, CellValue> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            CellValue cell = value instanceof CellValue ? (CellValue) value : CellValue.string(String.valueOf(value));
            map.put(String.valueOf(keyValues[i]), cell);
        }
        return new DataRecord(map);
    }

    public Optional<CellValue> get(String field) {
        if (field == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fields.get(field));
    }

    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    public Map<String, CellValue> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataRecord)) {
            return false;
        }
        return fields.equals(((DataRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "DataRecord" + fields;
    }
}

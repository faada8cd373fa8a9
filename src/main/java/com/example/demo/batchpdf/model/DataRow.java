package com.example.demo.batchpdf.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One data record: an ordered, immutable mapping from column name to value.
 * Column names and values are whitespace-trimmed; missing values become "".
 */
@ToString
@EqualsAndHashCode
public final class DataRow {
    private final Map<String, String> values;

    private DataRow(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static DataRow of(Map<String, ?> raw) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> {
                if (key != null) {
                    normalized.put(key.trim(), value == null ? "" : value.toString().trim());
                }
            });
        }
        return new DataRow(normalized);
    }

    /**
     * Value of a column, or "" when the row has no such column.
     */
    public String get(String column) {
        return values.getOrDefault(column, "");
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public boolean hasColumnIgnoreCase(String column) {
        return values.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(column));
    }

    /**
     * Case-insensitive lookup used for the reserved TEMPLATE/SKIP/OUTPUT columns.
     */
    public String getIgnoreCase(String column) {
        if (values.containsKey(column)) {
            return values.get(column);
        }
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return "";
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    /**
     * Copy of this row with one column replaced; column order is kept.
     */
    public DataRow withValue(String column, String value) {
        Map<String, String> copy = new LinkedHashMap<>(values);
        copy.put(column, value == null ? "" : value);
        return new DataRow(copy);
    }
}

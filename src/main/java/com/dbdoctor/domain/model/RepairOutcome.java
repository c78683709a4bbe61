package com.dbdoctor.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Number of rows deleted or updated per table by one repair pass.
 */
public record RepairOutcome(Map<String, Integer> affectedRows) {

    public RepairOutcome {
        affectedRows = Collections.unmodifiableMap(new LinkedHashMap<>(affectedRows));
    }

    public static RepairOutcome none() {
        return new RepairOutcome(Map.of());
    }

    public static RepairOutcome of(String table, int rows) {
        return new RepairOutcome(Map.of(table, rows));
    }

    public RepairOutcome merge(RepairOutcome other) {
        Map<String, Integer> merged = new LinkedHashMap<>(affectedRows);
        other.affectedRows.forEach((table, rows) -> merged.merge(table, rows, Integer::sum));
        return new RepairOutcome(merged);
    }

    public int total() {
        return affectedRows.values().stream().mapToInt(Integer::intValue).sum();
    }
}

package com.dbdoctor.domain.model;

import org.springframework.util.LinkedCaseInsensitiveMap;

import java.util.Collections;
import java.util.Map;

/**
 * A single row that violates a structural rule, as captured by one detection pass.
 * Column lookup in {@code fields} is case-insensitive since drivers differ in identifier case folding.
 */
public record InconsistentRecord(
    String table,
    int uid,
    int pid,
    Map<String, Object> fields
) {

    public static final String UID = "uid";
    public static final String PID = "pid";

    public InconsistentRecord {
        Map<String, Object> copy = new LinkedCaseInsensitiveMap<>();
        copy.putAll(fields);
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a record from a raw row that contains at least the "uid" and "pid" columns.
     */
    public static InconsistentRecord fromRow(String table, Map<String, Object> row) {
        Map<String, Object> columns = new LinkedCaseInsensitiveMap<>();
        columns.putAll(row);
        return new InconsistentRecord(table, toInt(columns.get(UID)), toInt(columns.get(PID)), columns);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    public int intField(String name) {
        return toInt(fields.get(name));
    }

    static int toInt(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }
}

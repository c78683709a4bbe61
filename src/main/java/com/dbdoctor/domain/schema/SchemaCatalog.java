package com.dbdoctor.domain.schema;

import com.dbdoctor.domain.model.TableSchema;
import com.dbdoctor.infrastructure.exception.SchemaIncompleteException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Read-only description of every table the content system knows about, keyed by table name
 * in declaration order. Each table carries a "ctrl" map whose entries name the fields that
 * play a structural role (soft-delete flag, language id, translation parent and so on).
 *
 * <p>Built once at startup and handed to every component that needs it.
 */
public final class SchemaCatalog {

    /**
     * Column holding the workspace id in every table with a truthy "versioningWS" flag.
     */
    public static final String WORKSPACE_ID_FIELD = "t3ver_wsid";

    private final Map<String, Map<String, Object>> tables;

    public SchemaCatalog(Map<String, Map<String, Object>> tables) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        tables.forEach((name, ctrl) -> copy.put(name,
            Collections.unmodifiableMap(new LinkedHashMap<>(ctrl == null ? Map.of() : ctrl))));
        this.tables = Collections.unmodifiableMap(copy);
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    public boolean contains(String table) {
        return tables.containsKey(table);
    }

    /**
     * Tables whose "versioningWS" flag is truthy, in declaration order.
     * Every call walks the catalog again.
     */
    public Stream<String> workspaceEnabledTables() {
        return tables.entrySet().stream()
            .filter(entry -> isTruthy(entry.getValue().get(CtrlRole.WORKSPACE.ctrlKey())))
            .map(Map.Entry::getKey);
    }

    /**
     * Tables that declare both a language field and a translation parent field, in declaration order.
     */
    public Stream<String> languageAwareTables() {
        return tables.keySet().stream()
            .filter(table -> roleField(table, CtrlRole.LANGUAGE).isPresent()
                && roleField(table, CtrlRole.TRANSLATION_PARENT).isPresent());
    }

    /**
     * Returns the field playing the given role in a table, or empty when the table does not declare it.
     */
    public Optional<String> roleField(String table, CtrlRole role) {
        Object value = ctrl(table).get(role.ctrlKey());
        if (role == CtrlRole.WORKSPACE) {
            return isTruthy(value) ? Optional.of(WORKSPACE_ID_FIELD) : Optional.empty();
        }
        if (!isTruthy(value)) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    /**
     * Like {@link #roleField(String, CtrlRole)} but for checks that cannot be evaluated without the field.
     *
     * @throws SchemaIncompleteException if the table does not declare the role
     */
    public String requireField(String table, CtrlRole role) {
        return roleField(table, role).orElseThrow(() -> new SchemaIncompleteException(table, role));
    }

    /**
     * Label field followed by the comma separated alternative label fields. Empty when neither
     * "label" nor "label_alt" is configured, which is different from a configured but empty list.
     */
    public Optional<List<String>> labelFields(String table) {
        Map<String, Object> ctrl = ctrl(table);
        Object label = ctrl.get(CtrlRole.LABEL.ctrlKey());
        Object labelAlt = ctrl.get(CtrlRole.LABEL_ALT.ctrlKey());
        if (label == null && labelAlt == null) {
            return Optional.empty();
        }
        List<String> fields = new ArrayList<>();
        if (isTruthy(label)) {
            fields.add(label.toString());
        }
        if (isTruthy(labelAlt)) {
            for (String alternative : labelAlt.toString().split(",")) {
                String trimmed = alternative.trim();
                if (!trimmed.isEmpty()) {
                    fields.add(trimmed);
                }
            }
        }
        return Optional.of(List.copyOf(fields));
    }

    public TableSchema tableSchema(String table) {
        return new TableSchema(
            table,
            roleField(table, CtrlRole.SOFT_DELETE),
            roleField(table, CtrlRole.TIMESTAMP),
            roleField(table, CtrlRole.CREATOR),
            roleField(table, CtrlRole.TYPE),
            labelFields(table),
            roleField(table, CtrlRole.LANGUAGE),
            roleField(table, CtrlRole.TRANSLATION_PARENT),
            roleField(table, CtrlRole.TRANSLATION_SOURCE),
            roleField(table, CtrlRole.WORKSPACE)
        );
    }

    private Map<String, Object> ctrl(String table) {
        return tables.getOrDefault(table, Map.of());
    }

    // false, 0, "", "0" and null count as "not set"
    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        String text = value.toString();
        return !text.isEmpty() && !"0".equals(text);
    }
}

package com.dbdoctor.application.render;

import com.dbdoctor.application.port.out.RecordRepository;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.domain.model.TableSchema;
import com.dbdoctor.domain.schema.SchemaCatalog;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders one table per affected database table, listing the structural fields of every
 * offending record: uid, pid, delete flag, workspace, language fields, type, labels,
 * timestamp and creator. Rows are read fresh so the view reflects the current database.
 */
@Component
public class RecordDetailsRenderer {

    static final int MAX_VALUE_LENGTH = 40;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final RecordRepository recordRepository;
    private final SchemaCatalog catalog;

    public RecordDetailsRenderer(RecordRepository recordRepository, SchemaCatalog catalog) {
        this.recordRepository = recordRepository;
        this.catalog = catalog;
    }

    public List<RenderedTable> render(FindingSet findings) {
        List<RenderedTable> tables = new ArrayList<>();
        for (String table : findings.tables()) {
            TableSchema schema = catalog.tableSchema(table);
            List<String> fields = detailFields(schema);
            List<List<String>> rows = new ArrayList<>();
            for (Map<String, Object> row : recordRepository.findByUids(table, fields, findings.uids(table))) {
                List<String> cells = new ArrayList<>();
                for (String field : fields) {
                    boolean isTimestamp = schema.timestampField().map(field::equals).orElse(false);
                    cells.add(format(row.get(field), isTimestamp));
                }
                rows.add(cells);
            }
            tables.add(new RenderedTable("Table \"" + table + "\"", fields, rows));
        }
        return tables;
    }

    static List<String> detailFields(TableSchema schema) {
        Set<String> fields = new LinkedHashSet<>();
        fields.add(InconsistentRecord.UID);
        fields.add(InconsistentRecord.PID);
        add(fields, schema.softDeleteField());
        add(fields, schema.workspaceField());
        add(fields, schema.languageField());
        add(fields, schema.translationParentField());
        add(fields, schema.translationSourceField());
        add(fields, schema.typeField());
        schema.labelFields().ifPresent(fields::addAll);
        add(fields, schema.timestampField());
        add(fields, schema.creatorField());
        return List.copyOf(fields);
    }

    private static void add(Set<String> fields, Optional<String> field) {
        field.ifPresent(fields::add);
    }

    static String format(Object value, boolean isTimestamp) {
        if (value == null) {
            return "NULL";
        }
        if (isTimestamp && value instanceof Number number && number.longValue() > 0) {
            return TIMESTAMP_FORMAT.format(Instant.ofEpochSecond(number.longValue())) + " (" + value + ")";
        }
        String text = value.toString().replace('\r', ' ').replace('\n', ' ');
        if (text.length() > MAX_VALUE_LENGTH) {
            return text.substring(0, MAX_VALUE_LENGTH - 3) + "...";
        }
        return text;
    }
}

package com.dbdoctor.application.render;

import com.dbdoctor.application.port.out.RecordRepository;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.domain.schema.SchemaCatalog;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a finding set as one row per page: page uid, page title and the number of
 * affected records per table.
 */
@Component
public class AffectedPagesRenderer {

    static final String ROOT_LEVEL = "[root level]";
    static final String MISSING_PAGE = "[missing page]";

    private final RecordRepository recordRepository;
    private final SchemaCatalog catalog;
    private final String pagesTable;

    public AffectedPagesRenderer(RecordRepository recordRepository, SchemaCatalog catalog, DbDoctorProperties properties) {
        this.recordRepository = recordRepository;
        this.catalog = catalog;
        this.pagesTable = properties.getTables().getPages();
    }

    public RenderedTable render(FindingSet findings) {
        List<String> tables = new ArrayList<>(findings.tables());
        List<String> header = new ArrayList<>(List.of("Page", "Title"));
        tables.forEach(table -> header.add("\"" + table + "\""));

        Map<Integer, List<InconsistentRecord>> byPage = findings.recordsByPage();
        Map<Integer, String> titles = pageTitles(byPage.keySet());

        List<List<String>> rows = new ArrayList<>();
        byPage.forEach((pid, records) -> {
            List<String> row = new ArrayList<>();
            row.add(String.valueOf(pid));
            row.add(pid == 0 ? ROOT_LEVEL : titles.getOrDefault(pid, MISSING_PAGE));
            for (String table : tables) {
                long count = records.stream().filter(record -> record.table().equals(table)).count();
                row.add(count == 0 ? "" : String.valueOf(count));
            }
            rows.add(row);
        });
        return new RenderedTable("Affected records per page", header, rows);
    }

    private Map<Integer, String> pageTitles(Set<Integer> pids) {
        List<Integer> uids = pids.stream().filter(pid -> pid > 0).toList();
        if (uids.isEmpty()) {
            return Map.of();
        }
        List<String> fields = new ArrayList<>(List.of(InconsistentRecord.UID));
        String titleField = catalog.labelFields(pagesTable)
            .filter(labels -> !labels.isEmpty())
            .map(labels -> labels.get(0))
            .orElse(null);
        if (titleField != null) {
            fields.add(titleField);
        }
        Map<Integer, String> titles = new HashMap<>();
        for (Map<String, Object> row : recordRepository.findByUids(pagesTable, fields, uids)) {
            Object title = titleField == null ? null : row.get(titleField);
            titles.put(((Number) row.get(InconsistentRecord.UID)).intValue(), title == null ? "" : title.toString());
        }
        return titles;
    }
}

package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.RecordQuery;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.domain.schema.CtrlRole;
import com.dbdoctor.domain.schema.SchemaCatalog;

import java.util.Map;

/**
 * Base for checks that reset a translation pointer on records in the default language (0) or
 * in "all languages" (-1). Such records are not translations, so the pointer must be 0.
 */
public abstract class AbstractDefaultLanguageFieldCheck extends AbstractHealthCheck {

    protected final SchemaCatalog catalog;
    private final CtrlRole pointerRole;

    protected AbstractDefaultLanguageFieldCheck(HealthCheckSupport support, SchemaCatalog catalog, CtrlRole pointerRole) {
        super(support);
        this.catalog = catalog;
        this.pointerRole = pointerRole;
    }

    @Override
    protected RepairKind repairKind() {
        return RepairKind.UPDATE;
    }

    @Override
    protected Map<String, Object> updateValues(String table) {
        return Map.of(catalog.requireField(table, pointerRole), 0);
    }

    @Override
    public FindingSet detect() {
        FindingSet.Builder findings = FindingSet.builder();
        for (String table : catalog.tableNames()) {
            if (catalog.roleField(table, CtrlRole.LANGUAGE).isEmpty()
                || catalog.roleField(table, pointerRole).isEmpty()
                || !presentInDatabase(table)) {
                continue;
            }
            String languageField = catalog.requireField(table, CtrlRole.LANGUAGE);
            String pointerField = catalog.requireField(table, pointerRole);
            RecordQuery query = RecordQuery.from(table)
                .select(InconsistentRecord.UID, InconsistentRecord.PID, languageField, pointerField)
                .lt(languageField, 1)
                .neq(pointerField, 0)
                .build();
            recordRepository.stream(query, collectInto(findings, table));
        }
        return findings.build();
    }
}

package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.RecordQuery;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.domain.schema.CtrlRole;
import com.dbdoctor.domain.schema.SchemaCatalog;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds translated records (language above 0) whose translation parent uid does not exist
 * in the same table. Such translations can not be reached through their parent anymore.
 */
@Component
public class TcaTablesTranslatedLanguageParentMissing extends AbstractHealthCheck {

    private final SchemaCatalog catalog;

    public TcaTablesTranslatedLanguageParentMissing(HealthCheckSupport support, SchemaCatalog catalog) {
        super(support);
        this.catalog = catalog;
    }

    @Override
    protected String title() {
        return "Check translated records with missing translation parent";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "Translated records point to their default language record (translation parent).",
            "When the parent has been removed from the database, the translation is orphaned.",
            "This health check finds those translations and allows removal."
        );
    }

    @Override
    protected String findingsLabel() {
        return "translated records with a missing translation parent";
    }

    @Override
    protected RepairKind repairKind() {
        return RepairKind.DELETE;
    }

    @Override
    public FindingSet detect() {
        FindingSet.Builder findings = FindingSet.builder();
        catalog.languageAwareTables().filter(this::presentInDatabase).forEach(table -> {
            String languageField = catalog.requireField(table, CtrlRole.LANGUAGE);
            String parentField = catalog.requireField(table, CtrlRole.TRANSLATION_PARENT);
            RecordQuery query = RecordQuery.from(table)
                .select(InconsistentRecord.UID, InconsistentRecord.PID, languageField, parentField)
                .gt(languageField, 0)
                .gt(parentField, 0)
                .build();
            List<InconsistentRecord> translations = new ArrayList<>();
            recordRepository.stream(query, row -> translations.add(InconsistentRecord.fromRow(table, row)));
            if (translations.isEmpty()) {
                return;
            }
            Set<Integer> parents = new LinkedHashSet<>();
            translations.forEach(translation -> parents.add(translation.intField(parentField)));
            Set<Integer> existing = recordRepository.findExistingUids(table, parents);
            translations.stream()
                .filter(translation -> !existing.contains(translation.intField(parentField)))
                .forEach(findings::add);
        });
        return findings.build();
    }
}

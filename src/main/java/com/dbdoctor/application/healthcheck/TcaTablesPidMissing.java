package com.dbdoctor.application.healthcheck;

import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.schema.SchemaCatalog;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Every record lives on a page. Finds records of all catalog tables, except pages and file
 * references which have their own checks, whose pid points to a page that does not exist.
 */
@Component
public class TcaTablesPidMissing extends AbstractPidMissingCheck {

    private final SchemaCatalog catalog;
    private final String fileReferenceTable;

    public TcaTablesPidMissing(HealthCheckSupport support, SchemaCatalog catalog, DbDoctorProperties properties) {
        super(support, properties.getTables().getPages());
        this.catalog = catalog;
        this.fileReferenceTable = properties.getTables().getFileReference();
    }

    @Override
    protected String title() {
        return "Check records on missing pages";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "Records are stored on pages (field \"pid\"). When a page is removed from the database",
            "without its records, the records stay with a pid that points nowhere. They can not be",
            "reached in the backend anymore. This health check finds and removes them."
        );
    }

    @Override
    protected String findingsLabel() {
        return "records on missing pages";
    }

    @Override
    public FindingSet detect() {
        Set<Integer> pageUids = existingPageUids();
        FindingSet.Builder findings = FindingSet.builder();
        for (String table : catalog.tableNames()) {
            if (table.equals(pagesTable) || table.equals(fileReferenceTable)) {
                continue;
            }
            if (presentInDatabase(table)) {
                collectInvalidPids(table, pageUids, findings);
            }
        }
        return findings.build();
    }
}

package com.dbdoctor.application.healthcheck;

import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.schema.SchemaCatalog;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SysFileReferenceInvalidPid extends AbstractPidMissingCheck {

    private static final Logger log = LoggerFactory.getLogger(SysFileReferenceInvalidPid.class);

    private final SchemaCatalog catalog;
    private final String fileReferenceTable;

    public SysFileReferenceInvalidPid(HealthCheckSupport support, SchemaCatalog catalog, DbDoctorProperties properties) {
        super(support, properties.getTables().getPages());
        this.catalog = catalog;
        this.fileReferenceTable = properties.getTables().getFileReference();
    }

    @Override
    protected String title() {
        return "Check file references pointing to missing pages";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "File references (table \"" + fileReferenceTable + "\") live on the page of the record",
            "they are attached to. References whose pid points to a page that does not exist",
            "are orphans and are never shown. This health check finds and removes them."
        );
    }

    @Override
    protected String findingsLabel() {
        return "file references on missing pages";
    }

    @Override
    public FindingSet detect() {
        if (!catalog.contains(fileReferenceTable)) {
            log.debug("{} is not in the schema catalog, nothing to check", fileReferenceTable);
            return FindingSet.empty();
        }
        if (!presentInDatabase(fileReferenceTable)) {
            return FindingSet.empty();
        }
        FindingSet.Builder findings = FindingSet.builder();
        collectInvalidPids(fileReferenceTable, existingPageUids(), findings);
        return findings.build();
    }
}

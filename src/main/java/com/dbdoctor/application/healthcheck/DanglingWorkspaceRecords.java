package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.RecordQuery;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.domain.schema.CtrlRole;
import com.dbdoctor.domain.schema.SchemaCatalog;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Removing a workspace discards every overlay record of that workspace in all tables. When this
 * goes wrong, or the workspace feature was uninstalled, overlay records of workspaces that no
 * longer exist are left behind. This check finds and removes them.
 */
@Component
public class DanglingWorkspaceRecords extends AbstractHealthCheck {

    private static final Logger log = LoggerFactory.getLogger(DanglingWorkspaceRecords.class);

    private final SchemaCatalog catalog;
    private final String workspaceTable;

    public DanglingWorkspaceRecords(HealthCheckSupport support, SchemaCatalog catalog, DbDoctorProperties properties) {
        super(support);
        this.catalog = catalog;
        this.workspaceTable = properties.getTables().getWorkspace();
    }

    @Override
    protected String title() {
        return "Scan for workspace records of deleted workspaces";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "When a workspace (table \"" + workspaceTable + "\") is deleted, all existing workspace overlays",
            "in all tables of this workspace are discarded (= removed from DB). When this goes wrong,",
            "or if the workspace feature is removed, the system ends up with \"dangling\" workspace",
            "records in tables. This health check finds those records and allows removal."
        );
    }

    @Override
    protected String findingsLabel() {
        return "workspace records from deleted workspaces";
    }

    @Override
    protected RepairKind repairKind() {
        return RepairKind.DELETE;
    }

    @Override
    public FindingSet detect() {
        List<Integer> allowedWorkspaces = allowedWorkspaces();
        FindingSet.Builder findings = FindingSet.builder();
        catalog.workspaceEnabledTables().filter(this::presentInDatabase).forEach(table -> {
            String workspaceField = catalog.requireField(table, CtrlRole.WORKSPACE);
            // No delete restriction: once a workspace is gone, none of its rows may survive, deleted or not
            RecordQuery query = RecordQuery.from(table)
                .select(InconsistentRecord.UID, InconsistentRecord.PID, workspaceField)
                .notIn(workspaceField, allowedWorkspaces)
                .build();
            recordRepository.stream(query, collectInto(findings, table));
        });
        return findings.build();
    }

    /**
     * Workspace 0 (live) plus every workspace that exists and is not deleted. Overlays of a deleted
     * workspace should have been discarded with it, so they count as dangling.
     */
    List<Integer> allowedWorkspaces() {
        List<Integer> allowed = new ArrayList<>();
        allowed.add(0);
        if (!tableProbe.exists(workspaceTable)) {
            log.debug("Workspace table {} does not exist, only live records are valid", workspaceTable);
            return allowed;
        }
        String deletedField = catalog.requireField(workspaceTable, CtrlRole.SOFT_DELETE);
        RecordQuery query = RecordQuery.from(workspaceTable)
            .select(InconsistentRecord.UID)
            .withoutDeleted(deletedField)
            .build();
        for (Map<String, Object> row : recordRepository.find(query)) {
            allowed.add(((Number) row.get(InconsistentRecord.UID)).intValue());
        }
        return allowed;
    }
}

package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.RecordQuery;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;

import java.util.HashSet;
import java.util.Set;

/**
 * Base for checks that look for records whose pid points to a page that does not exist.
 */
public abstract class AbstractPidMissingCheck extends AbstractHealthCheck {

    protected final String pagesTable;

    protected AbstractPidMissingCheck(HealthCheckSupport support, String pagesTable) {
        super(support);
        this.pagesTable = pagesTable;
    }

    @Override
    protected RepairKind repairKind() {
        return RepairKind.DELETE;
    }

    /**
     * Uids of all page rows, deleted and workspace rows included.
     */
    protected Set<Integer> existingPageUids() {
        Set<Integer> uids = new HashSet<>();
        RecordQuery query = RecordQuery.from(pagesTable).select(InconsistentRecord.UID).build();
        recordRepository.stream(query, row -> uids.add(((Number) row.get(InconsistentRecord.UID)).intValue()));
        return uids;
    }

    /**
     * Adds every row of the table whose pid is neither 0 nor an existing page.
     */
    protected void collectInvalidPids(String table, Set<Integer> pageUids, FindingSet.Builder findings) {
        RecordQuery query = RecordQuery.from(table)
            .select(InconsistentRecord.UID, InconsistentRecord.PID)
            .neq(InconsistentRecord.PID, 0)
            .build();
        recordRepository.stream(query, row -> {
            InconsistentRecord record = InconsistentRecord.fromRow(table, row);
            if (!pageUids.contains(record.pid())) {
                findings.add(record);
            }
        });
    }
}

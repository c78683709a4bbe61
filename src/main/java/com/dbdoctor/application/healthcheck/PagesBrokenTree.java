package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.RecordQuery;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds pages that are not connected to the tree: following their pid upwards never reaches
 * the root because some ancestor does not exist or the chain runs in a circle.
 */
@Component
public class PagesBrokenTree extends AbstractHealthCheck {

    private final String pagesTable;

    public PagesBrokenTree(HealthCheckSupport support, DbDoctorProperties properties) {
        super(support);
        this.pagesTable = properties.getTables().getPages();
    }

    @Override
    protected String title() {
        return "Check page tree integrity";
    }

    @Override
    protected List<String> description() {
        return List.of(
            "Each page must have a parent page (pid) that exists, up to the root level (pid 0).",
            "Pages whose rootline is broken are invisible in the page tree and can not be edited.",
            "This health check finds those pages and allows removal, including deleted and",
            "workspace rows."
        );
    }

    @Override
    protected String findingsLabel() {
        return "pages not connected to the page tree";
    }

    @Override
    protected RepairKind repairKind() {
        return RepairKind.DELETE;
    }

    @Override
    public FindingSet detect() {
        Map<Integer, InconsistentRecord> pages = new LinkedHashMap<>();
        RecordQuery query = RecordQuery.from(pagesTable)
            .select(InconsistentRecord.UID, InconsistentRecord.PID)
            .build();
        recordRepository.stream(query, row -> {
            InconsistentRecord page = InconsistentRecord.fromRow(pagesTable, row);
            pages.put(page.uid(), page);
        });

        Map<Integer, Boolean> connected = new HashMap<>();
        FindingSet.Builder findings = FindingSet.builder();
        for (InconsistentRecord page : pages.values()) {
            if (!isConnected(page.uid(), pages, connected)) {
                findings.add(page);
            }
        }
        return findings.build();
    }

    private static boolean isConnected(int uid, Map<Integer, InconsistentRecord> pages, Map<Integer, Boolean> connected) {
        Set<Integer> rootline = new HashSet<>();
        int current = uid;
        boolean result;
        while (true) {
            if (current == 0) {
                result = true;
                break;
            }
            Boolean known = connected.get(current);
            if (known != null) {
                result = known;
                break;
            }
            InconsistentRecord page = pages.get(current);
            if (page == null || !rootline.add(current)) {
                result = false;
                break;
            }
            current = page.pid();
        }
        for (Integer visited : rootline) {
            connected.put(visited, result);
        }
        return result;
    }
}

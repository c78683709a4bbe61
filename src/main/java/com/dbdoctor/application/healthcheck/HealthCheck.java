package com.dbdoctor.application.healthcheck;

import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.RepairOutcome;

/**
 * One class of structural inconsistency: knows how to find offending records and how to repair them.
 */
public interface HealthCheck {

    /**
     * Stable name used on the command line and in reports.
     */
    String name();

    /**
     * Prints the title and a description of what is checked and how it is repaired.
     */
    void header();

    /**
     * Reads the database and returns every record currently violating the rule.
     */
    FindingSet detect();

    /**
     * Repairs the given records table by table. Not atomic across tables.
     */
    RepairOutcome repair(FindingSet findings);

    /**
     * Detects, reports and, depending on the mode, repairs.
     *
     * @param resumeToken name of the check a resumed run started from, empty for a full run
     */
    CheckResult handle(CheckMode mode, String resumeToken);
}

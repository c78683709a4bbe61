package com.dbdoctor.application.port.out;

import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.RepairOutcome;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from the health checks.
 */
public interface MetricsPort {

    void recordRepair(String check, RepairOutcome outcome);

    void recordFindings(String check, int records);

    void recordCheckResult(String check, CheckResult result);

    double repairedRecords(String check);
}

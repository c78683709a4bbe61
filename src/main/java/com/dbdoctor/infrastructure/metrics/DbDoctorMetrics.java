package com.dbdoctor.infrastructure.metrics;

import com.dbdoctor.application.port.out.MetricsPort;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.RepairOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DbDoctorMetrics implements MetricsPort {

    private static final Logger log = LoggerFactory.getLogger(DbDoctorMetrics.class);

    static final String RECORDS_REPAIRED = "dbdoctor_records_repaired_total";
    static final String FINDINGS = "dbdoctor_findings_total";
    static final String CHECKS = "dbdoctor_checks_total";

    private final MeterRegistry registry;

    public DbDoctorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRepair(String check, RepairOutcome outcome) {
        outcome.affectedRows().forEach((table, rows) -> Counter.builder(RECORDS_REPAIRED)
            .description("Number of records deleted or updated by repairs")
            .tag("check", check)
            .tag("table", table)
            .register(registry)
            .increment(rows));
        log.debug("{} repaired {} records", check, outcome.total());
    }

    @Override
    public void recordFindings(String check, int records) {
        Counter.builder(FINDINGS)
            .description("Number of inconsistent records found by detection passes")
            .tag("check", check)
            .register(registry)
            .increment(records);
    }

    @Override
    public void recordCheckResult(String check, CheckResult result) {
        Counter.builder(CHECKS)
            .description("Number of finished health checks by result")
            .tag("check", check)
            .tag("result", result.name())
            .register(registry)
            .increment();
    }

    @Override
    public double repairedRecords(String check) {
        return registry.find(RECORDS_REPAIRED).tag("check", check).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }
}

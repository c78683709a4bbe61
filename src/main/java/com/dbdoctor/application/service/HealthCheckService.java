package com.dbdoctor.application.service;

import com.dbdoctor.application.healthcheck.HealthCheck;
import com.dbdoctor.application.healthcheck.HealthCheckRegistry;
import com.dbdoctor.application.port.in.RunHealthChecksUseCase;
import com.dbdoctor.application.port.out.ConsolePort;
import com.dbdoctor.application.port.out.MetricsPort;
import com.dbdoctor.domain.error.CheckError;
import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.Result;
import com.dbdoctor.infrastructure.exception.SchemaIncompleteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered check in order. An aborted check does not stop the run; a check that
 * can not be evaluated against the schema catalog is reported and skipped. Storage failures
 * are not handled here and end the run.
 */
@Service
public class HealthCheckService implements RunHealthChecksUseCase {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final HealthCheckRegistry registry;
    private final ConsolePort console;
    private final MetricsPort metrics;

    public HealthCheckService(HealthCheckRegistry registry, ConsolePort console, MetricsPort metrics) {
        this.registry = registry;
        this.console = console;
        this.metrics = metrics;
    }

    @Override
    public RunReport run(CheckMode mode, String resumeToken) {
        String token = resumeToken == null ? "" : resumeToken.trim();
        List<HealthCheck> checks = registry.startingFrom(token);
        log.info("Running {} health checks in {} mode{}", checks.size(), mode,
            token.isEmpty() ? "" : ", resuming from " + token);

        List<CheckOutcome> outcomes = new ArrayList<>();
        for (HealthCheck check : checks) {
            check.header();
            double repairedBefore = metrics.repairedRecords(check.name());
            Result<CheckResult, CheckError> result;
            try {
                result = Result.success(check.handle(mode, token));
            } catch (SchemaIncompleteException e) {
                log.warn("{} can not be evaluated: {}", check.name(), e.getMessage());
                console.error(check.name() + " skipped: " + e.getMessage());
                metrics.recordCheckResult(check.name(), CheckResult.ABORTED);
                result = Result.failure(e.getError());
            }
            // Counters span the process lifetime
            long repaired = (long) (metrics.repairedRecords(check.name()) - repairedBefore);
            outcomes.add(new CheckOutcome(check.name(), result, repaired));
        }

        RunReport report = new RunReport(mode, outcomes);
        outputReport(report);
        log.info("Health check run finished, all ok: {}", report.allOk());
        return report;
    }

    private void outputReport(RunReport report) {
        console.section("Summary");
        List<List<String>> rows = new ArrayList<>();
        for (CheckOutcome outcome : report.outcomes()) {
            rows.add(List.of(
                outcome.check(),
                outcome.describe(),
                String.valueOf(outcome.repairedRecords())
            ));
        }
        console.table(List.of("Check", "Result", "Repaired records"), rows);
        if (report.allOk()) {
            console.success("All checks passed");
        } else {
            console.warning(List.of("Some checks did not complete, the database is not fully consistent"));
        }
    }
}

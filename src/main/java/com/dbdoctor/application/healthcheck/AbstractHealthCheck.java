package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.ConsolePort;
import com.dbdoctor.application.port.out.MetricsPort;
import com.dbdoctor.application.port.out.RecordRepository;
import com.dbdoctor.application.port.out.TableProbe;
import com.dbdoctor.application.render.RenderedTable;
import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.domain.model.CheckResult;
import com.dbdoctor.domain.model.FindingSet;
import com.dbdoctor.domain.model.InconsistentRecord;
import com.dbdoctor.domain.model.RepairOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Shared detect, summarize, decide, repair and re-verify cycle. Subclasses supply the
 * description, the detection queries and, for update repairs, the values to write.
 */
public abstract class AbstractHealthCheck implements HealthCheck {

    private static final Logger log = LoggerFactory.getLogger(AbstractHealthCheck.class);

    protected final RecordRepository recordRepository;
    protected final ConsolePort console;
    protected final TableProbe tableProbe;
    private final HealthCheckSupport support;
    private final MetricsPort metrics;

    protected AbstractHealthCheck(HealthCheckSupport support) {
        this.support = support;
        this.recordRepository = support.recordRepository();
        this.console = support.console();
        this.tableProbe = support.tableProbe();
        this.metrics = support.metrics();
    }

    protected abstract String title();

    protected abstract List<String> description();

    /**
     * Short plural noun phrase for what this check finds, e.g. "workspace records of deleted workspaces".
     */
    protected abstract String findingsLabel();

    protected abstract RepairKind repairKind();

    /**
     * Column values written by an {@link RepairKind#UPDATE} repair.
     */
    protected Map<String, Object> updateValues(String table) {
        throw new UnsupportedOperationException(name() + " does not update records");
    }

    @Override
    public String name() {
        return ClassUtils.getUserClass(getClass()).getSimpleName();
    }

    @Override
    public void header() {
        console.section(title());
        console.text(description());
    }

    @Override
    public CheckResult handle(CheckMode mode, String resumeToken) {
        log.debug("Running {} in {} mode, resume token '{}'", name(), mode, resumeToken);
        FindingSet findings = detect();
        metrics.recordFindings(name(), findings.recordCount());
        outputSummary(findings);

        CheckResult result;
        if (findings.isEmpty()) {
            result = CheckResult.OK;
        } else {
            result = switch (mode) {
                case EXECUTE -> executeRepair(findings);
                case CHECK -> CheckResult.ABORTED;
                case INTERACTIVE -> new InteractiveSession(this, console, findings).run();
            };
        }
        metrics.recordCheckResult(name(), result);
        log.info("{} finished with {}", name(), result);
        return result;
    }

    @Override
    public RepairOutcome repair(FindingSet findings) {
        RepairOutcome outcome = RepairOutcome.none();
        for (String table : findings.tables()) {
            List<Integer> uids = findings.uids(table);
            int affected = switch (repairKind()) {
                case DELETE -> recordRepository.deleteByUids(table, uids);
                case UPDATE -> recordRepository.updateByUids(table, updateValues(table), uids);
            };
            log.info("{}: {} {} of {} records in {}", name(), repairKind().pastTense().toLowerCase(Locale.ROOT), affected, uids.size(), table);
            outcome = outcome.merge(RepairOutcome.of(table, affected));
        }
        return outcome;
    }

    /**
     * One repair pass followed by one verification pass. Records that still violate the rule
     * afterwards are reported and leave the check {@link CheckResult#ABORTED}.
     */
    private CheckResult executeRepair(FindingSet findings) {
        repairAndReport(findings);
        FindingSet remaining = detect();
        outputSummary(remaining);
        if (remaining.isEmpty()) {
            return CheckResult.OK;
        }
        log.warn("{}: {} records still inconsistent after repair", name(), remaining.recordCount());
        return CheckResult.ABORTED;
    }

    void repairAndReport(FindingSet findings) {
        RepairOutcome outcome = repair(findings);
        metrics.recordRepair(name(), outcome);
        List<String> lines = new ArrayList<>();
        outcome.affectedRows().forEach((table, rows) ->
            lines.add(repairKind().pastTense() + " " + rows + " records in \"" + table + "\""));
        console.text(lines);
    }

    void outputSummary(FindingSet findings) {
        if (findings.isEmpty()) {
            console.success("No " + findingsLabel());
            return;
        }
        List<String> lines = new ArrayList<>();
        lines.add("Found " + findingsLabel() + " in " + findings.tableCount() + " tables:");
        for (String table : findings.tables()) {
            lines.add("\"" + table + "\": " + findings.records(table).size() + " records");
        }
        console.warning(lines);
    }

    void outputAffectedPages(FindingSet findings) {
        console.note("Found records per page:");
        RenderedTable table = support.affectedPagesRenderer().render(findings);
        console.table(table.header(), table.rows());
    }

    void outputRecordDetails(FindingSet findings) {
        for (RenderedTable table : support.recordDetailsRenderer().render(findings)) {
            console.note(table.title() + ":");
            console.table(table.header(), table.rows());
        }
    }

    List<String> helpLines() {
        return List.of(
            "    y - " + repairKind().help(),
            "    a - abort now",
            "    r - reload possibly changed data",
            "    p - show records per page",
            "    d - show record details",
            "    ? - print help"
        );
    }

    /**
     * False for catalog tables that are not installed in the database. Those are skipped with a warning.
     */
    protected boolean presentInDatabase(String table) {
        if (tableProbe.exists(table)) {
            return true;
        }
        log.warn("{}: table {} is in the schema catalog but not in the database, skipped", name(), table);
        return false;
    }

    /**
     * Adds every row to the builder as an {@link InconsistentRecord} of the given table.
     */
    protected static Consumer<Map<String, Object>> collectInto(FindingSet.Builder builder, String table) {
        return row -> builder.add(InconsistentRecord.fromRow(table, row));
    }
}

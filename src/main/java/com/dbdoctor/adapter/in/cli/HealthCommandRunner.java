package com.dbdoctor.adapter.in.cli;

import com.dbdoctor.application.healthcheck.HealthCheckRegistry;
import com.dbdoctor.application.port.in.RunHealthChecksUseCase;
import com.dbdoctor.application.port.in.RunHealthChecksUseCase.RunReport;
import com.dbdoctor.application.port.out.ConsolePort;
import com.dbdoctor.domain.model.CheckMode;
import com.dbdoctor.infrastructure.config.DbDoctorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command line entry point.
 * <pre>
 *   --mode=interactive|execute|check   defaults to dbdoctor.mode
 *   --from=CheckName                   resume with the named check
 *   --list                             print the check names and exit
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "dbdoctor.runner.enabled", havingValue = "true", matchIfMissing = true)
public class HealthCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HealthCommandRunner.class);

    static final String MODE = "mode";
    static final String FROM = "from";
    static final String LIST = "list";

    private final RunHealthChecksUseCase runHealthChecks;
    private final HealthCheckRegistry registry;
    private final ConsolePort console;
    private final DbDoctorProperties properties;

    private int exitCode;

    public HealthCommandRunner(RunHealthChecksUseCase runHealthChecks,
                               HealthCheckRegistry registry,
                               ConsolePort console,
                               DbDoctorProperties properties) {
        this.runHealthChecks = runHealthChecks;
        this.registry = registry;
        this.console = console;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(LIST)) {
            console.section("Registered health checks");
            console.text(registry.names());
            exitCode = 0;
            return;
        }

        CheckMode mode = CheckMode.parse(lastValue(args, MODE, properties.getMode()));
        String from = lastValue(args, FROM, "");
        log.info("Starting health checks, mode={}, from={}", mode, from.isBlank() ? "<first>" : from);

        RunReport report = runHealthChecks.run(mode, from);
        exitCode = report.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static String lastValue(ApplicationArguments args, String option, String fallback) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }
}

package com.dbdoctor.application.healthcheck;

import com.dbdoctor.application.port.out.ConsolePort;
import com.dbdoctor.application.port.out.MetricsPort;
import com.dbdoctor.application.port.out.RecordRepository;
import com.dbdoctor.application.port.out.TableProbe;
import com.dbdoctor.application.render.AffectedPagesRenderer;
import com.dbdoctor.application.render.RecordDetailsRenderer;
import org.springframework.stereotype.Component;

/**
 * Collaborators every check shares.
 */
@Component
public class HealthCheckSupport {

    private final RecordRepository recordRepository;
    private final TableProbe tableProbe;
    private final ConsolePort console;
    private final AffectedPagesRenderer affectedPagesRenderer;
    private final RecordDetailsRenderer recordDetailsRenderer;
    private final MetricsPort metrics;

    public HealthCheckSupport(
            RecordRepository recordRepository,
            TableProbe tableProbe,
            ConsolePort console,
            AffectedPagesRenderer affectedPagesRenderer,
            RecordDetailsRenderer recordDetailsRenderer,
            MetricsPort metrics) {
        this.recordRepository = recordRepository;
        this.tableProbe = tableProbe;
        this.console = console;
        this.affectedPagesRenderer = affectedPagesRenderer;
        this.recordDetailsRenderer = recordDetailsRenderer;
        this.metrics = metrics;
    }

    public RecordRepository recordRepository() {
        return recordRepository;
    }

    public TableProbe tableProbe() {
        return tableProbe;
    }

    public ConsolePort console() {
        return console;
    }

    public AffectedPagesRenderer affectedPagesRenderer() {
        return affectedPagesRenderer;
    }

    public RecordDetailsRenderer recordDetailsRenderer() {
        return recordDetailsRenderer;
    }

    public MetricsPort metrics() {
        return metrics;
    }
}

package com.dbdoctor.application.healthcheck;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The checks of one process in the order they run. Order matters: an earlier repair can
 * change what a later check sees.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks;

    public HealthCheckRegistry(List<HealthCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public List<HealthCheck> checks() {
        return checks;
    }

    public List<String> names() {
        return checks.stream().map(HealthCheck::name).toList();
    }

    /**
     * All checks starting with the one with the given name, or all checks for a blank name.
     *
     * @throws IllegalArgumentException if no check has that name
     */
    public List<HealthCheck> startingFrom(String name) {
        if (name == null || name.isBlank()) {
            return checks;
        }
        for (int i = 0; i < checks.size(); i++) {
            if (checks.get(i).name().equals(name.trim())) {
                return checks.subList(i, checks.size());
            }
        }
        throw new IllegalArgumentException("Unknown health check \"" + name + "\", known checks: "
            + checks.stream().map(HealthCheck::name).collect(Collectors.joining(", ")));
    }
}

package com.sectune.dispatch.cli;

import com.sectune.core.health.HealthCheckService;
import com.sectune.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: sectune health
 * <p>
 * Runs the store, database and provider checks. Exits with 1 when any
 * component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        var overall = HealthStatus.overall(checks);

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.info("(degraded) " + label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (overall == HealthStatus.Status.DOWN) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        if (overall == HealthStatus.Status.DEGRADED) {
            ConsoleOutput.info("Overall: running with degraded components");
        } else {
            ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}

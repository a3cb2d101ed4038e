package com.aura.dispatch.cli;

import com.aura.core.health.HealthCheckService;
import com.aura.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: aura health
 * <p>
 * Runs the store, sandbox and generator checks and prints one line per component.
 * Exits with 0 when everything is up, 1 when a component is degraded, 2 when one is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check runtime health")
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
            return HealthStatus.Status.DOWN.exitCode();
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warning(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        HealthStatus.Status overall = HealthStatus.overall(checks);
        System.out.println("──────────────────────────────────");
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all components operational");
            case DEGRADED -> ConsoleOutput.warning("Overall: one or more components degraded");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return overall.exitCode();
    }
}

package com.sreagent.dispatch.cli;

import com.sreagent.core.health.HealthCheckService;
import com.sreagent.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: sre-agent health
 * <p>
 * Runs the dependency checks with this process's own configuration (tool server URL,
 * LLM key) rather than asking a running server. Exits 1 when a component is DOWN.
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

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.info(label + " (degraded)");
            }
        }

        boolean anyDown = checks.stream().anyMatch(HealthStatus::isDown);
        boolean allUp = checks.stream().allMatch(check -> check.status() == HealthStatus.Status.UP);
        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
        } else {
            ConsoleOutput.info("Overall: operational, one or more components degraded");
        }
        return anyDown ? 1 : 0;
    }
}

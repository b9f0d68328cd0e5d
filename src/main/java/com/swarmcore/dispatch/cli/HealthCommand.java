package com.swarmcore.dispatch.cli;

import com.swarmcore.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: swarmcore health
 * <p>
 * Runs every component health check and prints the results. Exits non-zero when any
 * component is degraded or down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check coordinator health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        ConsoleOutput.rule();
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}

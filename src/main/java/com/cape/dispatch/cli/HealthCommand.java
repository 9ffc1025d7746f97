package com.cape.dispatch.cli;

import com.cape.core.health.HealthCheckService;
import com.cape.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: cape health
 * <p>
 * Checks the sandbox configuration, registry, model adapters, Docker daemon
 * and local Python interpreter. Exits with 1 when a component the default
 * backend needs is down; degraded components only warn.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Show check metadata")
    private boolean verbose;

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

        ConsoleOutput.sandbox("Default backend: " + healthCheckService.defaultBackend());
        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            if (verbose) {
                check.metadata().forEach((key, value) -> System.out.println("    " + key + " = " + value));
            }
        }

        System.out.println("──────────────────────────────────");
        return switch (HealthStatus.overall(checks)) {
            case UP -> {
                ConsoleOutput.success("Overall: all systems operational");
                yield 0;
            }
            case DEGRADED -> {
                ConsoleOutput.info("Overall: degraded, some capabilities or backends are unavailable");
                yield 0;
            }
            case DOWN -> {
                ConsoleOutput.error("Overall: the default backend cannot run capabilities");
                yield 1;
            }
        };
    }
}

package com.brigade.vacuum.dispatch.cli;

import com.brigade.vacuum.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: brigade-vacuum health
 * <p>
 * Checks that the namespace can be listed and that the configured
 * settings are valid, displaying results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check cluster access and settings")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--namespace", "-n"}, description = "Namespace to check")
    private String namespace;

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = namespace != null
                ? healthCheckService.checkAll(namespace)
                : healthCheckService.checkAll();
        boolean anyDown = false;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more checks failed");
            return 1;
        }
        ConsoleOutput.success("Overall: ready to vacuum");
        return 0;
    }
}

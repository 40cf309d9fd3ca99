package com.brigade.vacuum.dispatch.cli;

import com.brigade.vacuum.cluster.ClusterAccessException;
import com.brigade.vacuum.cluster.ClusterAccessorFactory;
import com.brigade.vacuum.config.VacuumProperties;
import com.brigade.vacuum.config.VacuumSettings;
import com.brigade.vacuum.core.engine.VacuumEngine;
import com.brigade.vacuum.core.metrics.VacuumMetrics;
import com.brigade.vacuum.core.model.VacuumReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: brigade-vacuum run
 * <p>
 * Runs a single vacuum pass. Options override the {@code vacuum.*} properties.
 * Deletion failures are reported but still exit 0; only a failed listing aborts the pass.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one vacuum pass")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_ABORTED = 1;
    static final int EXIT_INVALID = 2;

    @Option(names = "--age",
            description = "Delete builds older than this, e.g. 720h or 30d. 0 disables age-based eviction")
    private String age;

    @Option(names = "--max-builds",
            description = "Keep only the N newest builds. -1 keeps all")
    private Integer maxBuilds;

    @Option(names = "--skip-running-builds", negatable = true,
            description = "Leave running and pending workers in place")
    private Boolean skipRunningBuilds;

    @Option(names = {"--namespace", "-n"}, description = "Namespace to vacuum")
    private String namespace;

    @Option(names = "--json", description = "Print the pass report as JSON")
    private boolean json;

    private final VacuumProperties properties;
    private final ClusterAccessorFactory clusterAccessorFactory;
    private final VacuumMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public RunCommand(VacuumProperties properties,
                      ClusterAccessorFactory clusterAccessorFactory,
                      @Autowired(required = false) VacuumMetrics metrics,
                      Clock clock,
                      ObjectMapper objectMapper) {
        this.properties = properties;
        this.clusterAccessorFactory = clusterAccessorFactory;
        this.metrics = metrics;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        VacuumSettings settings;
        try {
            settings = resolveSettings();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid option: " + e.getMessage());
            return EXIT_INVALID;
        }

        if (!json) {
            ConsoleOutput.info(String.format("Namespace: %s | Age: %s | Count: %s | Skip running: %s",
                    settings.namespace(), settings.age(), settings.count(), settings.skipRunningBuilds()));
        }

        VacuumReport report;
        try {
            var engine = new VacuumEngine(clusterAccessorFactory.forNamespace(settings.namespace()),
                    settings, metrics);
            report = engine.run();
        } catch (ClusterAccessException e) {
            ConsoleOutput.error("Vacuum pass aborted: " + e.getMessage());
            return EXIT_ABORTED;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Failed to render report: " + e.getOriginalMessage());
                return EXIT_ABORTED;
            }
        } else {
            ConsoleOutput.report(report);
        }
        return 0;
    }

    private VacuumSettings resolveSettings() {
        Duration maxAge = age != null ? DurationStyle.detectAndParse(age) : properties.getAge();
        return VacuumSettings.resolve(
                maxAge,
                maxBuilds != null ? maxBuilds : properties.getMaxBuilds(),
                skipRunningBuilds != null ? skipRunningBuilds : properties.isSkipRunningBuilds(),
                namespace != null ? namespace : properties.getNamespace(),
                clock);
    }
}

package com.brigade.vacuum.core.health;

import com.brigade.vacuum.cluster.ClusterAccessorFactory;
import com.brigade.vacuum.cluster.LabelSelector;
import com.brigade.vacuum.config.VacuumProperties;
import com.brigade.vacuum.config.VacuumSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ClusterAccessorFactory clusterAccessorFactory;
    private final VacuumProperties properties;
    private final Clock clock;

    public HealthCheckService(ClusterAccessorFactory clusterAccessorFactory,
                              VacuumProperties properties, Clock clock) {
        this.clusterAccessorFactory = clusterAccessorFactory;
        this.properties = properties;
        this.clock = clock;
    }

    public List<HealthStatus> checkAll() {
        return checkAll(properties.getNamespace());
    }

    public List<HealthStatus> checkAll(String namespace) {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCluster(namespace));
        results.add(checkSettings(namespace));
        return results;
    }

    private HealthStatus checkCluster(String namespace) {
        try {
            var records = clusterAccessorFactory.forNamespace(namespace)
                    .listRecords(LabelSelector.BUILD_RECORDS);
            return new HealthStatus("cluster", HealthStatus.Status.UP,
                    records.size() + " build records in namespace " + namespace,
                    Map.of("namespace", namespace));
        } catch (Exception e) {
            log.warn("Cluster health check failed: {}", e.getMessage());
            return new HealthStatus("cluster", HealthStatus.Status.DOWN,
                    "Cluster error: " + e.getMessage(), Map.of("namespace", namespace));
        }
    }

    private HealthStatus checkSettings(String namespace) {
        VacuumSettings settings;
        try {
            settings = VacuumSettings.resolve(properties.getAge(), properties.getMaxBuilds(),
                    properties.isSkipRunningBuilds(), namespace, clock);
        } catch (IllegalArgumentException e) {
            return new HealthStatus("settings", HealthStatus.Status.DOWN,
                    "Invalid settings: " + e.getMessage(), Map.of());
        }
        var metadata = Map.of(
                "age", settings.age().toString(),
                "count", settings.count().toString(),
                "skipRunningBuilds", String.valueOf(settings.skipRunningBuilds()));
        if (settings.isNoop()) {
            return new HealthStatus("settings", HealthStatus.Status.DEGRADED,
                    "Both policies disabled; a pass would delete nothing", metadata);
        }
        return new HealthStatus("settings", HealthStatus.Status.UP,
                "age " + settings.age() + ", count " + settings.count(), metadata);
    }
}

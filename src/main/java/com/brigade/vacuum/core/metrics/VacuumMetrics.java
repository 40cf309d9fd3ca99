package com.brigade.vacuum.core.metrics;

import com.brigade.vacuum.core.model.BuildDeletion;
import com.brigade.vacuum.core.model.ResourceOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for vacuum passes.
 */
@Service
public class VacuumMetrics {

    private final MeterRegistry registry;

    public VacuumMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPassDuration(long ms) {
        Timer.builder("vacuum.pass.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param result "completed" or "aborted"
     */
    public void recordPassResult(String result) {
        Counter.builder("vacuum.passes.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    /**
     * Counts one evicted build and each of its resource outcomes.
     *
     * @param policy   policy that selected the build, e.g. "age"
     * @param deletion outcomes of deleting the build
     */
    public void recordEviction(String policy, BuildDeletion deletion) {
        Counter.builder("vacuum.builds.evicted")
                .description("Builds selected for eviction")
                .tag("policy", policy)
                .register(registry)
                .increment();

        for (ResourceOutcome outcome : deletion.outcomes()) {
            Counter.builder("vacuum.resources.total")
                    .description("Resource deletions by kind and outcome")
                    .tag("kind", outcome.kind().name().toLowerCase(Locale.ROOT))
                    .tag("outcome", outcome.status().name().toLowerCase(Locale.ROOT))
                    .register(registry)
                    .increment();
        }
    }
}

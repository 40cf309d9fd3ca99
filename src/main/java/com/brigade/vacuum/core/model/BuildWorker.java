package com.brigade.vacuum.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A transient execution unit belonging to a build. On Kubernetes this is a Pod.
 */
public record BuildWorker(
    String name,
    Map<String, String> labels,
    WorkerPhase phase
) {
    public BuildWorker {
        Objects.requireNonNull(name, "name");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        phase = phase == null ? WorkerPhase.UNKNOWN : phase;
    }

    public Optional<String> buildId() {
        return BuildLabels.buildId(labels);
    }
}

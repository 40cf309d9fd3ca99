package com.brigade.vacuum.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The resource that marks a build's existence and carries its creation timestamp.
 * On Kubernetes this is the build Secret.
 */
public record BuildRecord(
    String name,
    Instant createdAt,
    Map<String, String> labels
) {
    public BuildRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /** The {@code build} label value; empty for orphaned records. */
    public Optional<String> buildId() {
        return BuildLabels.buildId(labels);
    }
}

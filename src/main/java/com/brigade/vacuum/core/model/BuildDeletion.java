package com.brigade.vacuum.core.model;

import java.util.List;

/**
 * Per-resource outcomes of deleting one build.
 */
public record BuildDeletion(
    String buildId,
    List<ResourceOutcome> outcomes
) {
    public BuildDeletion {
        outcomes = List.copyOf(outcomes);
    }

    public long count(ResourceOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public long count(ResourceKind kind, ResourceOutcome.Status status) {
        return outcomes.stream()
                .filter(o -> o.kind() == kind && o.status() == status)
                .count();
    }

    /** True when no resource of this build failed to delete. */
    public boolean isClean() {
        return count(ResourceOutcome.Status.FAILED) == 0;
    }
}

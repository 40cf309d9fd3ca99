package com.brigade.vacuum.core.model;

import java.util.List;
import java.util.stream.Stream;

/**
 * Result of one vacuum pass: the builds removed by each policy.
 * An empty list means the policy was disabled or found nothing to evict.
 */
public record VacuumReport(
    String passId,
    List<BuildDeletion> ageEvictions,
    List<BuildDeletion> countEvictions
) {
    public VacuumReport {
        ageEvictions = List.copyOf(ageEvictions);
        countEvictions = List.copyOf(countEvictions);
    }

    public List<BuildDeletion> allEvictions() {
        return Stream.concat(ageEvictions.stream(), countEvictions.stream()).toList();
    }

    public long total(ResourceOutcome.Status status) {
        return allEvictions().stream().mapToLong(d -> d.count(status)).sum();
    }

    public long total(ResourceKind kind, ResourceOutcome.Status status) {
        return allEvictions().stream().mapToLong(d -> d.count(kind, status)).sum();
    }

    public boolean hasFailures() {
        return total(ResourceOutcome.Status.FAILED) > 0;
    }
}

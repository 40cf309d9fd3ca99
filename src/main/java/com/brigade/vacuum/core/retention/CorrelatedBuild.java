package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;

import java.util.List;

/**
 * All workers and records carrying one build ID.
 */
public record CorrelatedBuild(
    String buildId,
    List<BuildWorker> workers,
    List<BuildRecord> records
) {
    public CorrelatedBuild {
        workers = List.copyOf(workers);
        records = List.copyOf(records);
    }
}

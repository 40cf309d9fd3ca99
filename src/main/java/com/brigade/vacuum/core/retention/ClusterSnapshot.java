package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.cluster.ClusterAccessor;
import com.brigade.vacuum.cluster.LabelSelector;
import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;

import java.util.List;

/**
 * Point-in-time listing a policy evaluates against.
 *
 * <p>Each policy captures its own snapshot: an earlier policy may already have deleted
 * resources, so sharing one would evaluate stale data.
 *
 * @param candidates records matching {@link LabelSelector#BUILD_RECORDS}
 * @param records    every record in the namespace
 * @param workers    every worker in the namespace
 */
public record ClusterSnapshot(
    List<BuildRecord> candidates,
    List<BuildRecord> records,
    List<BuildWorker> workers
) {
    public ClusterSnapshot {
        candidates = List.copyOf(candidates);
        records = List.copyOf(records);
        workers = List.copyOf(workers);
    }

    /**
     * Lists the namespace. Any listing failure propagates and aborts the pass.
     */
    public static ClusterSnapshot capture(ClusterAccessor cluster) {
        var candidates = cluster.listRecords(LabelSelector.BUILD_RECORDS);
        var records = cluster.listRecords(LabelSelector.EVERYTHING);
        var workers = cluster.listWorkers(LabelSelector.EVERYTHING);
        return new ClusterSnapshot(candidates, records, workers);
    }

    public BuildCorrelator correlator() {
        return new BuildCorrelator(workers, records);
    }
}

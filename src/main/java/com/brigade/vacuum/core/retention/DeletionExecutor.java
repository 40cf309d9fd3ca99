package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.cluster.ClusterAccessor;
import com.brigade.vacuum.core.model.BuildDeletion;
import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;
import com.brigade.vacuum.core.model.ResourceKind;
import com.brigade.vacuum.core.model.ResourceOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Deletes the workers and records of a build, one resource at a time.
 *
 * <p>With {@code skipRunningBuilds} set, workers that are still running or pending are left
 * in place. The build's records and its other workers are deleted regardless.
 *
 * <p>A failed deletion is logged and recorded as {@link ResourceOutcome.Status#FAILED};
 * it never stops the remaining deletions and is never thrown to the caller.
 */
public class DeletionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DeletionExecutor.class);

    private final ClusterAccessor cluster;
    private final boolean skipRunningBuilds;

    public DeletionExecutor(ClusterAccessor cluster, boolean skipRunningBuilds) {
        this.cluster = cluster;
        this.skipRunningBuilds = skipRunningBuilds;
    }

    public BuildDeletion delete(CorrelatedBuild build) {
        var outcomes = new ArrayList<ResourceOutcome>();
        var workersToDelete = new ArrayList<BuildWorker>();

        for (BuildWorker worker : build.workers()) {
            if (skipRunningBuilds && worker.phase().isInFlight()) {
                log.info("Skipping worker {} for build {} because its phase is {}",
                        worker.name(), build.buildId(), worker.phase());
                outcomes.add(ResourceOutcome.skipped(ResourceKind.WORKER, worker.name(),
                        "phase " + worker.phase()));
            } else {
                workersToDelete.add(worker);
            }
        }

        log.info("Deleting build {}: workers {}, records {}", build.buildId(),
                workersToDelete.stream().map(BuildWorker::name).toList(),
                build.records().stream().map(BuildRecord::name).toList());

        for (BuildWorker worker : workersToDelete) {
            outcomes.add(attempt(ResourceKind.WORKER, worker.name(), build.buildId()));
        }
        for (BuildRecord record : build.records()) {
            outcomes.add(attempt(ResourceKind.RECORD, record.name(), build.buildId()));
        }
        return new BuildDeletion(build.buildId(), outcomes);
    }

    private ResourceOutcome attempt(ResourceKind kind, String name, String buildId) {
        try {
            if (kind == ResourceKind.WORKER) {
                cluster.deleteWorker(name);
            } else {
                cluster.deleteRecord(name);
            }
            log.debug("Deleted {} {} of build {}", kind, name, buildId);
            return ResourceOutcome.deleted(kind, name);
        } catch (RuntimeException e) {
            log.warn("Failed to delete {} {} of build {} (continuing): {}",
                    kind, name, buildId, e.getMessage());
            return ResourceOutcome.failed(kind, name, String.valueOf(e.getMessage()));
        }
    }
}

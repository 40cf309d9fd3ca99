package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins workers and records on the {@code build} label.
 *
 * <p>The index is built once from unfiltered listings; the filtered record listing
 * never covers workers, so correlation must not use it.
 */
public class BuildCorrelator {

    private final Map<String, List<BuildWorker>> workersByBuild;
    private final Map<String, List<BuildRecord>> recordsByBuild;

    public BuildCorrelator(List<BuildWorker> allWorkers, List<BuildRecord> allRecords) {
        this.workersByBuild = new HashMap<>();
        this.recordsByBuild = new HashMap<>();
        for (BuildWorker worker : allWorkers) {
            worker.buildId().ifPresent(id ->
                    workersByBuild.computeIfAbsent(id, k -> new ArrayList<>()).add(worker));
        }
        for (BuildRecord record : allRecords) {
            record.buildId().ifPresent(id ->
                    recordsByBuild.computeIfAbsent(id, k -> new ArrayList<>()).add(record));
        }
    }

    /**
     * Resolves the resources belonging to a build. Unknown IDs yield empty lists.
     */
    public CorrelatedBuild correlate(String buildId) {
        return new CorrelatedBuild(
                buildId,
                workersByBuild.getOrDefault(buildId, List.of()),
                recordsByBuild.getOrDefault(buildId, List.of()));
    }
}

package com.brigade.vacuum.core.engine;

import com.brigade.vacuum.cluster.ClusterAccessException;
import com.brigade.vacuum.cluster.ClusterAccessor;
import com.brigade.vacuum.config.VacuumSettings;
import com.brigade.vacuum.core.logging.MdcContext;
import com.brigade.vacuum.core.metrics.VacuumMetrics;
import com.brigade.vacuum.core.model.BuildDeletion;
import com.brigade.vacuum.core.model.ResourceOutcome;
import com.brigade.vacuum.core.model.VacuumReport;
import com.brigade.vacuum.core.retention.AgeEvictionPolicy;
import com.brigade.vacuum.core.retention.BuildCorrelator;
import com.brigade.vacuum.core.retention.ClusterSnapshot;
import com.brigade.vacuum.core.retention.CountEvictionPolicy;
import com.brigade.vacuum.core.retention.DeletionExecutor;
import com.brigade.vacuum.core.retention.EvictionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one vacuum pass: the age policy, then the count policy.
 *
 * <p>Each policy lists the namespace afresh, so the count policy sees the
 * deletions the age policy made. The engine never loops or schedules itself;
 * callers decide when to run another pass.
 */
public class VacuumEngine {

    private static final Logger log = LoggerFactory.getLogger(VacuumEngine.class);

    private final ClusterAccessor cluster;
    private final EvictionPolicy agePolicy;
    private final EvictionPolicy countPolicy;
    private final DeletionExecutor executor;
    private final VacuumMetrics metrics;

    public VacuumEngine(ClusterAccessor cluster, VacuumSettings settings, VacuumMetrics metrics) {
        this(cluster,
                new AgeEvictionPolicy(settings.age()),
                new CountEvictionPolicy(settings.count()),
                new DeletionExecutor(cluster, settings.skipRunningBuilds()),
                metrics);
    }

    VacuumEngine(ClusterAccessor cluster, EvictionPolicy agePolicy, EvictionPolicy countPolicy,
                 DeletionExecutor executor, VacuumMetrics metrics) {
        this.cluster = cluster;
        this.agePolicy = agePolicy;
        this.countPolicy = countPolicy;
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Executes a single pass.
     *
     * @return the builds each policy evicted, with per-resource outcomes
     * @throws ClusterAccessException if listing the namespace fails; deletions
     *         already issued stay applied
     */
    public VacuumReport run() {
        String passId = "VAC-" + UUID.randomUUID().toString().substring(0, 8);
        long start = System.currentTimeMillis();
        MdcContext.setPass(passId);
        log.info("Starting vacuum pass {} in namespace {}", passId, cluster.namespace());
        try {
            List<BuildDeletion> byAge = apply(passId, agePolicy);
            List<BuildDeletion> byCount = apply(passId, countPolicy);
            var report = new VacuumReport(passId, byAge, byCount);
            log.info("Vacuum pass {} complete: {} builds evicted, {} resources deleted, {} skipped, {} failed",
                    passId, report.allEvictions().size(),
                    report.total(ResourceOutcome.Status.DELETED),
                    report.total(ResourceOutcome.Status.SKIPPED),
                    report.total(ResourceOutcome.Status.FAILED));
            recordPass("completed", start);
            return report;
        } catch (ClusterAccessException e) {
            log.error("Vacuum pass {} aborted: {}", passId, e.getMessage());
            recordPass("aborted", start);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private List<BuildDeletion> apply(String passId, EvictionPolicy policy) {
        if (!policy.isEnabled()) {
            log.debug("Policy {} disabled, skipping", policy.name());
            return List.of();
        }
        MdcContext.setPolicy(passId, policy.name());

        ClusterSnapshot snapshot = ClusterSnapshot.capture(cluster);
        List<String> victims = policy.selectVictims(snapshot);
        if (victims.isEmpty()) {
            return List.of();
        }

        BuildCorrelator correlator = snapshot.correlator();
        var deletions = new ArrayList<BuildDeletion>();
        for (String buildId : victims) {
            MdcContext.setBuild(buildId);
            try {
                BuildDeletion deletion = executor.delete(correlator.correlate(buildId));
                if (!deletion.isClean()) {
                    log.warn("Build {} only partially deleted ({})", buildId, policy.name());
                }
                deletions.add(deletion);
                if (metrics != null) {
                    metrics.recordEviction(policy.name(), deletion);
                }
            } finally {
                MdcContext.clearBuild();
            }
        }
        return deletions;
    }

    private void recordPass(String result, long start) {
        if (metrics != null) {
            metrics.recordPassResult(result);
            metrics.recordPassDuration(System.currentTimeMillis() - start);
        }
    }
}

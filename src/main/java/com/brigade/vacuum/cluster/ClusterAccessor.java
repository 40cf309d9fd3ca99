package com.brigade.vacuum.cluster;

import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;

import java.util.List;

/**
 * Access to build resources in a single namespace.
 * Implementations: KubernetesClusterAccessor (Secrets as records, Pods as workers).
 *
 * <p>All calls block until the cluster answers. Failures are reported as
 * {@link ClusterAccessException}.
 */
public interface ClusterAccessor {

    /**
     * Lists build records matching the selector.
     */
    List<BuildRecord> listRecords(LabelSelector selector);

    /**
     * Lists workers matching the selector.
     */
    List<BuildWorker> listWorkers(LabelSelector selector);

    /**
     * Deletes a record immediately, without a grace period.
     * Deleting a record that no longer exists is not an error.
     */
    void deleteRecord(String name);

    /**
     * Deletes a worker immediately, without a grace period.
     * Deleting a worker that no longer exists is not an error.
     */
    void deleteWorker(String name);

    /** Namespace every call is scoped to. */
    String namespace();
}

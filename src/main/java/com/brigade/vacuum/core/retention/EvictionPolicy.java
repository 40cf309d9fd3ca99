package com.brigade.vacuum.core.retention;

import java.util.List;

/**
 * Chooses which builds to remove from a snapshot.
 */
public interface EvictionPolicy {

    /** Short name used in logs, metrics and reports, e.g. "age". */
    String name();

    /**
     * A disabled policy is skipped entirely: no listing and no deletion.
     */
    boolean isEnabled();

    /**
     * Returns the IDs of the builds to evict, without duplicates, in evaluation order.
     * Candidate records without a {@code build} label are logged and never selected.
     */
    List<String> selectVictims(ClusterSnapshot snapshot);
}

package com.brigade.vacuum.core.model;

import java.util.Locale;

/**
 * Lifecycle phase of a worker resource, as reported by the cluster.
 */
public enum WorkerPhase {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    UNKNOWN;

    /**
     * Maps a cluster phase string ("Running", "Pending", ...) to a phase.
     * Null or unrecognised values map to {@link #UNKNOWN}.
     */
    public static WorkerPhase fromString(String phase) {
        if (phase == null || phase.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(phase.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /** True while the worker is still executing or waiting to be scheduled. */
    public boolean isInFlight() {
        return this == RUNNING || this == PENDING;
    }
}

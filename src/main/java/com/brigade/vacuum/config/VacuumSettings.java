package com.brigade.vacuum.config;

import com.brigade.vacuum.core.model.AgeLimit;
import com.brigade.vacuum.core.model.CountLimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Effective, validated settings for one pass.
 */
public record VacuumSettings(
    AgeLimit age,
    CountLimit count,
    boolean skipRunningBuilds,
    String namespace
) {
    public VacuumSettings {
        Objects.requireNonNull(age, "age");
        Objects.requireNonNull(count, "count");
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
    }

    public static VacuumSettings resolve(Duration maxAge, int maxBuilds, boolean skipRunningBuilds,
                                         String namespace, Clock clock) {
        return new VacuumSettings(
                AgeLimit.fromMaxAge(maxAge, clock),
                CountLimit.fromMaxBuilds(maxBuilds),
                skipRunningBuilds,
                namespace);
    }

    /** True when neither policy can evict anything. */
    public boolean isNoop() {
        return age instanceof AgeLimit.Disabled && count instanceof CountLimit.Unlimited;
    }
}

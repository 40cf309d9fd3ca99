package com.brigade.vacuum.core.model;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cutoff for age-based eviction: either disabled, or evict builds created before an instant.
 */
public sealed interface AgeLimit permits AgeLimit.Disabled, AgeLimit.Before {

    AgeLimit DISABLED = new Disabled();

    record Disabled() implements AgeLimit {
        @Override
        public String toString() {
            return "disabled";
        }
    }

    record Before(Instant cutoff) implements AgeLimit {
        public Before {
            Objects.requireNonNull(cutoff, "cutoff");
        }

        /** True when the cutoff is strictly after {@code createdAt}. */
        public boolean isExpired(Instant createdAt) {
            return cutoff.isAfter(createdAt);
        }

        @Override
        public String toString() {
            return "before " + cutoff;
        }
    }

    /**
     * Builds a limit from a maximum age relative to the clock's current instant.
     * A null or zero age disables the policy.
     *
     * @throws IllegalArgumentException if the age is negative, or so large the
     *         cutoff falls outside the supported instant range
     */
    static AgeLimit fromMaxAge(Duration maxAge, Clock clock) {
        if (maxAge == null || maxAge.isZero()) {
            return DISABLED;
        }
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("age must not be negative: " + maxAge);
        }
        try {
            return new Before(clock.instant().minus(maxAge));
        } catch (DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException("age is out of range: " + maxAge, e);
        }
    }
}

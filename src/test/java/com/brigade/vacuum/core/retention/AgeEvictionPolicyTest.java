package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.core.model.AgeLimit;
import com.brigade.vacuum.core.model.BuildRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgeEvictionPolicyTest {

    private static final Instant NOW = Instant.parse("2026-05-10T10:00:00Z");
    private static final AgeLimit ONE_HOUR = new AgeLimit.Before(NOW.minus(Duration.ofHours(1)));

    private static BuildRecord record(String buildId, Duration age) {
        return new BuildRecord("brigade-" + buildId, NOW.minus(age), Map.of("build", buildId));
    }

    private static ClusterSnapshot snapshot(BuildRecord... candidates) {
        return new ClusterSnapshot(List.of(candidates), List.of(candidates), List.of());
    }

    @Test
    @DisplayName("disabled policy selects nothing")
    void disabled() {
        var policy = new AgeEvictionPolicy(AgeLimit.DISABLED);

        assertFalse(policy.isEnabled());
        assertEquals(List.of(), policy.selectVictims(snapshot(record("old", Duration.ofDays(30)))));
    }

    @Test
    @DisplayName("selects only builds created before the cutoff")
    void selectsOlderThanCutoff() {
        var policy = new AgeEvictionPolicy(ONE_HOUR);

        var victims = policy.selectVictims(snapshot(
                record("abc", Duration.ofHours(2)),
                record("fresh", Duration.ofMinutes(10)),
                record("xyz", Duration.ofDays(3))));

        assertTrue(policy.isEnabled());
        assertEquals(List.of("abc", "xyz"), victims);
    }

    @Test
    @DisplayName("record created exactly at the cutoff survives")
    void cutoffIsExclusive() {
        var policy = new AgeEvictionPolicy(ONE_HOUR);

        assertEquals(List.of(), policy.selectVictims(snapshot(record("edge", Duration.ofHours(1)))));
    }

    @Test
    @DisplayName("records without a build label are skipped")
    void skipsUnlabeled() {
        var orphan = new BuildRecord("orphan", NOW.minus(Duration.ofDays(9)), Map.of("component", "build"));
        var policy = new AgeEvictionPolicy(ONE_HOUR);

        assertEquals(List.of("abc"), policy.selectVictims(snapshot(orphan, record("abc", Duration.ofDays(2)))));
    }

    @Test
    @DisplayName("a build listed twice is selected once")
    void deduplicates() {
        var first = new BuildRecord("brigade-abc", NOW.minus(Duration.ofDays(2)), Map.of("build", "abc"));
        var second = new BuildRecord("brigade-abc-copy", NOW.minus(Duration.ofDays(2)), Map.of("build", "abc"));

        var victims = new AgeEvictionPolicy(ONE_HOUR).selectVictims(snapshot(first, second));

        assertEquals(List.of("abc"), victims);
    }
}

package com.brigade.vacuum.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LimitsTest {

    @Test
    @DisplayName("age cutoff is strictly exclusive")
    void ageCutoff() {
        var now = Instant.parse("2026-10-18T00:00:00Z");
        var limit = AgeLimit.fromMaxAge(Duration.ofHours(1), Clock.fixed(now, ZoneOffset.UTC));

        var before = assertInstanceOf(AgeLimit.Before.class, limit);
        assertTrue(before.isExpired(now.minus(Duration.ofHours(2))));
        assertFalse(before.isExpired(now.minus(Duration.ofHours(1))));
        assertFalse(before.isExpired(now));
    }

    @Test
    @DisplayName("max builds sentinel maps to unlimited")
    void countSentinel() {
        assertEquals(CountLimit.UNLIMITED, CountLimit.fromMaxBuilds(CountLimit.NO_MAX_BUILDS));
        assertEquals(new CountLimit.AtMost(0), CountLimit.fromMaxBuilds(0));
        assertThrows(IllegalArgumentException.class, () -> new CountLimit.AtMost(-1));
    }

    @Test
    @DisplayName("worker phases parse case-insensitively, unknown strings map to UNKNOWN")
    void workerPhase() {
        assertEquals(WorkerPhase.RUNNING, WorkerPhase.fromString("Running"));
        assertEquals(WorkerPhase.FAILED, WorkerPhase.fromString("FAILED"));
        assertEquals(WorkerPhase.UNKNOWN, WorkerPhase.fromString("Terminating"));
        assertEquals(WorkerPhase.UNKNOWN, WorkerPhase.fromString(null));
        assertTrue(WorkerPhase.PENDING.isInFlight());
        assertFalse(WorkerPhase.SUCCEEDED.isInFlight());
    }

    @Test
    @DisplayName("an age reaching past the earliest instant is rejected")
    void ageOutOfRange() {
        var clock = Clock.fixed(Instant.parse("2026-10-18T00:00:00Z"), ZoneOffset.UTC);

        var e = assertThrows(IllegalArgumentException.class,
                () -> AgeLimit.fromMaxAge(Duration.ofDays(999_999_999_999L), clock));
        assertTrue(e.getMessage().contains("out of range"));
    }

    @Test
    @DisplayName("worker phases parse the same under a Turkish default locale")
    void workerPhaseTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(WorkerPhase.RUNNING, WorkerPhase.fromString("Running"));
            assertEquals(WorkerPhase.PENDING, WorkerPhase.fromString("Pending"));
            assertTrue(WorkerPhase.fromString("Running").isInFlight());
        } finally {
            Locale.setDefault(original);
        }
    }
}

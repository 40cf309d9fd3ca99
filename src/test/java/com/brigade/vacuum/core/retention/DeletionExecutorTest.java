package com.brigade.vacuum.core.retention;

import com.brigade.vacuum.cluster.ClusterAccessException;
import com.brigade.vacuum.cluster.ClusterAccessor;
import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;
import com.brigade.vacuum.core.model.ResourceKind;
import com.brigade.vacuum.core.model.ResourceOutcome;
import com.brigade.vacuum.core.model.WorkerPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DeletionExecutorTest {

    private ClusterAccessor cluster;

    private static final Instant CREATED = Instant.parse("2026-02-01T08:00:00Z");

    @BeforeEach
    void setUp() {
        cluster = mock(ClusterAccessor.class);
    }

    private static BuildWorker worker(String name, WorkerPhase phase) {
        return new BuildWorker(name, Map.of("build", "abc"), phase);
    }

    private static CorrelatedBuild build(List<BuildWorker> workers) {
        return new CorrelatedBuild("abc", workers,
                List.of(new BuildRecord("brigade-abc", CREATED, Map.of("build", "abc"))));
    }

    @Test
    @DisplayName("deletes workers before records")
    void deletesWorkersThenRecords() {
        var executor = new DeletionExecutor(cluster, false);

        var result = executor.delete(build(List.of(worker("abc-job", WorkerPhase.SUCCEEDED))));

        InOrder order = inOrder(cluster);
        order.verify(cluster).deleteWorker("abc-job");
        order.verify(cluster).deleteRecord("brigade-abc");
        assertEquals("abc", result.buildId());
        assertEquals(2, result.count(ResourceOutcome.Status.DELETED));
        assertTrue(result.isClean());
    }

    @Test
    @DisplayName("build with no workers still deletes its records")
    void recordsOnly() {
        var result = new DeletionExecutor(cluster, true).delete(build(List.of()));

        verify(cluster).deleteRecord("brigade-abc");
        verify(cluster, never()).deleteWorker(anyString());
        assertEquals(1, result.count(ResourceKind.RECORD, ResourceOutcome.Status.DELETED));
    }

    @Nested
    @DisplayName("skipRunningBuilds")
    class SkipRunning {

        @Test
        @DisplayName("running and pending workers survive, record and finished workers are deleted")
        void protectsOnlyInFlightWorkers() {
            var executor = new DeletionExecutor(cluster, true);

            var result = executor.delete(build(List.of(
                    worker("abc-running", WorkerPhase.RUNNING),
                    worker("abc-pending", WorkerPhase.PENDING),
                    worker("abc-done", WorkerPhase.SUCCEEDED))));

            verify(cluster, never()).deleteWorker("abc-running");
            verify(cluster, never()).deleteWorker("abc-pending");
            verify(cluster).deleteWorker("abc-done");
            verify(cluster).deleteRecord("brigade-abc");

            assertEquals(2, result.count(ResourceKind.WORKER, ResourceOutcome.Status.SKIPPED));
            assertEquals(1, result.count(ResourceKind.WORKER, ResourceOutcome.Status.DELETED));
            assertEquals(1, result.count(ResourceKind.RECORD, ResourceOutcome.Status.DELETED));
        }

        @Test
        @DisplayName("disabled: running workers are deleted too")
        void deletesRunningWhenDisabled() {
            var executor = new DeletionExecutor(cluster, false);

            var result = executor.delete(build(List.of(worker("abc-running", WorkerPhase.RUNNING))));

            verify(cluster).deleteWorker("abc-running");
            assertEquals(0, result.count(ResourceOutcome.Status.SKIPPED));
        }

        @Test
        @DisplayName("skipped outcome names the worker phase")
        void skippedOutcomeDetail() {
            var result = new DeletionExecutor(cluster, true)
                    .delete(build(List.of(worker("abc-running", WorkerPhase.RUNNING))));

            var skipped = result.outcomes().stream()
                    .filter(o -> o.status() == ResourceOutcome.Status.SKIPPED)
                    .findFirst()
                    .orElseThrow();
            assertEquals("abc-running", skipped.name());
            assertEquals("phase RUNNING", skipped.detail());
        }
    }

    @Nested
    @DisplayName("Failure tolerance")
    class Failures {

        @Test
        @DisplayName("failed worker deletion does not stop the remaining deletions")
        void continuesAfterWorkerFailure() {
            doThrow(new ClusterAccessException("connection refused"))
                    .when(cluster).deleteWorker("abc-job-1");
            var executor = new DeletionExecutor(cluster, false);

            var result = assertDoesNotThrow(() -> executor.delete(build(List.of(
                    worker("abc-job-1", WorkerPhase.FAILED),
                    worker("abc-job-2", WorkerPhase.SUCCEEDED)))));

            verify(cluster).deleteWorker("abc-job-2");
            verify(cluster).deleteRecord("brigade-abc");
            assertEquals(1, result.count(ResourceKind.WORKER, ResourceOutcome.Status.FAILED));
            assertEquals(1, result.count(ResourceKind.WORKER, ResourceOutcome.Status.DELETED));
            assertEquals(1, result.count(ResourceKind.RECORD, ResourceOutcome.Status.DELETED));
            assertFalse(result.isClean());
        }

        @Test
        @DisplayName("failed record deletion is recorded with the error")
        void recordFailureCaptured() {
            doThrow(new ClusterAccessException("forbidden"))
                    .when(cluster).deleteRecord("brigade-abc");

            var result = new DeletionExecutor(cluster, false).delete(build(List.of()));

            var failed = result.outcomes().get(0);
            assertEquals(ResourceKind.RECORD, failed.kind());
            assertEquals(ResourceOutcome.Status.FAILED, failed.status());
            assertEquals("forbidden", failed.detail());
        }
    }
}

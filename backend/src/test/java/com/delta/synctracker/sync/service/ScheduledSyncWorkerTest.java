package com.delta.synctracker.sync.service;

import com.delta.synctracker.sync.jobs.JobDispatcher;
import com.delta.synctracker.sync.model.EnqueueOptions;
import com.delta.synctracker.sync.model.SyncCycleResult;
import com.delta.synctracker.sync.model.SyncOutcome;
import com.delta.synctracker.sync.model.SyncSchedule;
import com.delta.synctracker.sync.provider.SyncTrigger;
import com.delta.synctracker.support.MutableClock;
import com.delta.synctracker.support.ScriptedSyncRoutine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledSyncWorkerTest {

    @Mock
    private IntegrationHealthService healthService;

    @Mock
    private QuotaGuard quotaGuard;

    @Mock
    private JobDispatcher jobDispatcher;

    private MutableClock clock;
    private ScriptedSyncRoutine routine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-16T10:00:00Z"));
        routine = new ScriptedSyncRoutine("alpha");
        lenient().when(healthService.isOperational("alpha")).thenReturn(true);
        lenient().when(quotaGuard.hasBudget("alpha")).thenReturn(true);
    }

    private ScheduledSyncWorker worker(List<String> followOnJobTypes) {
        return new ScheduledSyncWorker(
            "alpha",
            SyncSchedule.daily(3),
            routine,
            healthService,
            quotaGuard,
            jobDispatcher,
            followOnJobTypes,
            clock
        );
    }

    @Test
    void successfulCycleRecordsSuccessAndEnqueuesFollowOnJobs() {
        UUID jobId = UUID.randomUUID();
        when(jobDispatcher.enqueue(eq("recalculate-aggregates"), any(), any(EnqueueOptions.class))).thenReturn(jobId);

        SyncCycleResult result = worker(List.of("recalculate-aggregates")).runCycle(SyncTrigger.SCHEDULED);

        assertThat(result.outcome()).isEqualTo(SyncOutcome.SUCCEEDED);
        assertThat(result.followOnJobIds()).containsExactly(jobId);
        verify(healthService).recordSuccess(eq("alpha"), any(Duration.class));
        verify(jobDispatcher).enqueue(
            eq("recalculate-aggregates"),
            eq(Map.of("provider", "alpha", "syncedAt", "2026-02-16T10:00:00Z")),
            eq(EnqueueOptions.correlated("sync:alpha"))
        );
    }

    @Test
    void failingRoutineIsRecordedNotPropagated() {
        routine.failWith(new IllegalStateException("upstream 503"));

        SyncCycleResult result = worker(List.of("recalculate-aggregates")).runCycle(SyncTrigger.SCHEDULED);

        assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
        assertThat(result.error()).isEqualTo("upstream 503");
        verify(healthService).recordFailure(eq("alpha"), eq("upstream 503"), anyString());
        verify(jobDispatcher, never()).enqueue(anyString(), any(), any(EnqueueOptions.class));
    }

    @Test
    void errorFromRoutineIsRecordedAsFailure() {
        routine.failWithError(new NoClassDefFoundError("com/vendor/FeedClient"));

        SyncCycleResult result = worker(List.of("recalculate-aggregates")).runCycle(SyncTrigger.SCHEDULED);

        assertThat(result.outcome()).isEqualTo(SyncOutcome.FAILED);
        assertThat(result.error()).isEqualTo("com/vendor/FeedClient");
        verify(healthService).recordFailure(eq("alpha"), eq("com/vendor/FeedClient"), anyString());
        verify(jobDispatcher, never()).enqueue(anyString(), any(), any(EnqueueOptions.class));
    }

    @Test
    void disabledProviderIsSkipped() {
        when(healthService.isOperational("alpha")).thenReturn(false);

        SyncCycleResult result = worker(List.of()).runCycle(SyncTrigger.SCHEDULED);

        assertThat(result.outcome()).isEqualTo(SyncOutcome.SKIPPED_DISABLED);
        assertThat(routine.invocations()).isZero();
    }

    @Test
    void exhaustedQuotaSkipsTheCycle() {
        when(quotaGuard.hasBudget("alpha")).thenReturn(false);

        SyncCycleResult result = worker(List.of()).runCycle(SyncTrigger.SCHEDULED);

        assertThat(result.outcome()).isEqualTo(SyncOutcome.SKIPPED_QUOTA_EXHAUSTED);
        assertThat(routine.invocations()).isZero();
        verify(healthService, never()).recordFailure(anyString(), anyString(), any());
    }

    @Test
    void failuresNeverTerminateTheLoop() throws Exception {
        routine.failWith(new IllegalStateException("boom"));
        ScheduledSyncWorker worker = worker(List.of());
        worker.prepareStart();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> loop = executor.submit(worker);
            waitFor(() -> routine.invocations() >= 1);
            waitFor(() -> worker.getStatus().nextRunAtUtc() != null);

            assertThat(loop.isDone()).isFalse();
            assertThat(worker.getStatus().lastOutcome()).isEqualTo(SyncOutcome.FAILED);
            assertThat(worker.getStatus().nextRunAtUtc()).isEqualTo(Instant.parse("2026-02-17T03:00:00Z"));
        } finally {
            worker.stop();
            executor.shutdown();
            assertThat(executor.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void errorsNeverTerminateTheLoop() throws Exception {
        routine.failWithError(new AssertionError("vendor invariant broken"));
        ScheduledSyncWorker worker = worker(List.of());
        worker.prepareStart();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> loop = executor.submit(worker);
            waitFor(() -> worker.getStatus().nextRunAtUtc() != null);

            assertThat(loop.isDone()).isFalse();
            assertThat(routine.invocations()).isEqualTo(1);
            assertThat(worker.getStatus().lastOutcome()).isEqualTo(SyncOutcome.FAILED);
            assertThat(worker.getStatus().lastError()).isEqualTo("vendor invariant broken");
            verify(healthService).recordFailure(eq("alpha"), eq("vendor invariant broken"), anyString());
        } finally {
            worker.stop();
            executor.shutdown();
            assertThat(executor.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void sleepUntilTheSlotKeepsSubMillisecondPrecision() {
        Instant slot = Instant.parse("2026-02-17T03:00:00Z");

        assertThat(ScheduledSyncWorker.nanosUntil(slot.minusNanos(900_000), slot)).isEqualTo(900_000L);
        assertThat(ScheduledSyncWorker.nanosUntil(slot.minusMillis(5).minusNanos(1), slot)).isEqualTo(5_000_001L);
        assertThat(ScheduledSyncWorker.nanosUntil(slot.plusSeconds(1), slot)).isZero();
    }

    @Test
    void stopCancelsTheSleepPromptly() throws Exception {
        ScheduledSyncWorker worker = worker(List.of());
        worker.prepareStart();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> loop = executor.submit(worker);
            waitFor(() -> worker.getStatus().nextRunAtUtc() != null);

            long stopRequested = System.nanoTime();
            worker.stop();
            loop.get(2, TimeUnit.SECONDS);
            assertThat(Duration.ofNanos(System.nanoTime() - stopRequested)).isLessThan(Duration.ofSeconds(2));
            assertThat(routine.invocations()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void manualTriggerIsRefusedWhileACycleIsInFlight() throws Exception {
        ScheduledSyncWorker worker = worker(List.of());
        CountDownLatch entered = routine.blockUntilReleased();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SyncCycleResult> first = executor.submit(() -> worker.runCycle(SyncTrigger.SCHEDULED));
            assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(worker.getStatus().cycleInFlight()).isTrue();

            assertThatThrownBy(worker::triggerNow).isInstanceOf(SyncAlreadyRunningException.class);

            routine.release();
            assertThat(first.get(2, TimeUnit.SECONDS).outcome()).isEqualTo(SyncOutcome.SUCCEEDED);
            assertThat(worker.triggerNow().outcome()).isEqualTo(SyncOutcome.SUCCEEDED);
        } finally {
            routine.release();
            executor.shutdownNow();
        }
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 2s");
            }
            Thread.sleep(10);
        }
    }
}

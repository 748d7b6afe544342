package com.delta.synctracker.sync.service;

import com.delta.synctracker.sync.jobs.JobDispatcher;
import com.delta.synctracker.sync.model.EnqueueOptions;
import com.delta.synctracker.sync.model.SyncCycleResult;
import com.delta.synctracker.sync.model.SyncOutcome;
import com.delta.synctracker.sync.model.SyncSchedule;
import com.delta.synctracker.sync.model.SyncWorkerStatus;
import com.delta.synctracker.sync.provider.ProviderSyncRoutine;
import com.delta.synctracker.sync.provider.SyncContext;
import com.delta.synctracker.sync.provider.SyncTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one provider's routine on its schedule: once at start, then at every computed slot.
 * A failing cycle, including one that ends in an {@link Error}, is recorded and the loop carries
 * on; only {@link #stop()} or an interrupt ends it. Cycles of the same provider never overlap,
 * whether scheduled or triggered by hand.
 */
public class ScheduledSyncWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ScheduledSyncWorker.class);

    private final String provider;
    private final SyncSchedule schedule;
    private final ProviderSyncRoutine routine;
    private final IntegrationHealthService healthService;
    private final QuotaGuard quotaGuard;
    private final JobDispatcher jobDispatcher;
    private final List<String> followOnJobTypes;
    private final Clock clock;
    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile Instant nextRunAtUtc;
    private volatile Instant lastCycleStartedAt;
    private volatile SyncOutcome lastOutcome;
    private volatile String lastError;

    public ScheduledSyncWorker(
        String provider,
        SyncSchedule schedule,
        ProviderSyncRoutine routine,
        IntegrationHealthService healthService,
        QuotaGuard quotaGuard,
        JobDispatcher jobDispatcher,
        List<String> followOnJobTypes,
        Clock clock
    ) {
        this.provider = provider;
        this.schedule = schedule;
        this.routine = routine;
        this.healthService = healthService;
        this.quotaGuard = quotaGuard;
        this.jobDispatcher = jobDispatcher;
        this.followOnJobTypes = followOnJobTypes == null ? List.of() : List.copyOf(followOnJobTypes);
        this.clock = clock;
    }

    public String getProvider() {
        return provider;
    }

    public SyncSchedule getSchedule() {
        return schedule;
    }

    /** Arms a fresh stop signal; call before handing the worker to a thread. */
    void prepareStart() {
        stopSignal = new CountDownLatch(1);
    }

    public void stop() {
        stopSignal.countDown();
    }

    @Override
    public void run() {
        log.info("Sync worker for {} started ({})", provider, schedule.describe());
        try {
            runCycleSafely(SyncTrigger.STARTUP);
            while (!Thread.currentThread().isInterrupted()) {
                Instant now = clock.instant();
                Instant next = schedule.nextRunAfter(now);
                nextRunAtUtc = next;
                log.debug("Next sync for {} at {}", provider, next);
                if (awaitStop(nanosUntil(now, next))) {
                    break;
                }
                runCycleSafely(SyncTrigger.SCHEDULED);
            }
        } finally {
            nextRunAtUtc = null;
            log.info("Sync worker for {} stopped", provider);
        }
    }

    /** Runs a cycle on the caller's thread, refusing if one is already in flight. */
    public SyncCycleResult triggerNow() {
        if (!cycleLock.tryLock()) {
            throw new SyncAlreadyRunningException(provider);
        }
        try {
            return executeCycle(SyncTrigger.MANUAL);
        } finally {
            cycleLock.unlock();
        }
    }

    public SyncWorkerStatus getStatus() {
        return new SyncWorkerStatus(
            provider,
            schedule.describe(),
            nextRunAtUtc,
            lastCycleStartedAt,
            lastOutcome,
            lastError,
            cycleLock.isLocked()
        );
    }

    SyncCycleResult runCycle(SyncTrigger trigger) {
        cycleLock.lock();
        try {
            return executeCycle(trigger);
        } finally {
            cycleLock.unlock();
        }
    }

    private void runCycleSafely(SyncTrigger trigger) {
        try {
            runCycle(trigger);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Sync cycle bookkeeping failed for {}", provider, e);
        }
    }

    private SyncCycleResult executeCycle(SyncTrigger trigger) {
        Instant startedAt = clock.instant();
        lastCycleStartedAt = startedAt;

        if (!healthService.isOperational(provider)) {
            log.info("Skipping {} sync for {}: integration is disabled", trigger, provider);
            return remember(SyncCycleResult.skipped(provider, SyncOutcome.SKIPPED_DISABLED, startedAt));
        }
        if (!quotaGuard.hasBudget(provider)) {
            log.warn("Skipping {} sync for {}: daily quota exhausted", trigger, provider);
            return remember(SyncCycleResult.skipped(provider, SyncOutcome.SKIPPED_QUOTA_EXHAUSTED, startedAt));
        }

        long startNanos = System.nanoTime();
        try {
            routine.sync(new SyncContext(provider, trigger, startedAt, quotaGuard));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("Sync for {} failed after {} ms", provider, duration.toMillis(), e);
            healthService.recordFailure(provider, message, stackTraceOf(e));
            return remember(new SyncCycleResult(
                provider,
                SyncOutcome.FAILED,
                startedAt,
                clock.instant(),
                duration,
                message,
                List.of()
            ));
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        healthService.recordSuccess(provider, duration);
        Instant finishedAt = clock.instant();
        List<UUID> followOnJobIds = enqueueFollowOnJobs(finishedAt);
        log.info("Sync for {} succeeded in {} ms", provider, duration.toMillis());
        return remember(new SyncCycleResult(
            provider,
            SyncOutcome.SUCCEEDED,
            startedAt,
            finishedAt,
            duration,
            null,
            followOnJobIds
        ));
    }

    private List<UUID> enqueueFollowOnJobs(Instant syncedAt) {
        List<UUID> ids = new ArrayList<>();
        for (String jobType : followOnJobTypes) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("provider", provider);
            payload.put("syncedAt", syncedAt.toString());
            try {
                ids.add(jobDispatcher.enqueue(jobType, payload, EnqueueOptions.correlated("sync:" + provider)));
            } catch (Exception e) {
                log.warn("Failed to enqueue follow-on job {} after {} sync", jobType, provider, e);
            }
        }
        return ids;
    }

    private SyncCycleResult remember(SyncCycleResult result) {
        lastOutcome = result.outcome();
        lastError = result.error();
        return result;
    }

    static long nanosUntil(Instant now, Instant next) {
        return Math.max(0, Duration.between(now, next).toNanos());
    }

    private boolean awaitStop(long nanos) {
        try {
            return stopSignal.await(nanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}

package com.delta.synctracker.sync.service;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.jobs.JobDispatcher;
import com.delta.synctracker.sync.model.SyncCycleResult;
import com.delta.synctracker.sync.model.SyncSchedule;
import com.delta.synctracker.sync.model.SyncWorkerStatus;
import com.delta.synctracker.sync.provider.ProviderSyncRoutine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one {@link ScheduledSyncWorker} per enabled provider that has a routine, and starts and
 * stops them as a group. Stopping cancels every pending sleep at once and then waits up to the
 * configured timeout for in-flight cycles before interrupting them.
 */
@Service
public class SyncWorkerService {
    private static final Logger log = LoggerFactory.getLogger(SyncWorkerService.class);

    private final SyncTrackerProperties properties;
    private final Map<String, ScheduledSyncWorker> workers = new LinkedHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;

    public SyncWorkerService(
        SyncTrackerProperties properties,
        ObjectProvider<ProviderSyncRoutine> routines,
        IntegrationHealthService healthService,
        QuotaGuard quotaGuard,
        JobDispatcher jobDispatcher,
        Clock clock
    ) {
        this.properties = properties;
        Map<String, SyncSchedule> schedules = new LinkedHashMap<>();
        properties.getProviders().forEach((name, provider) -> schedules.put(name, scheduleFor(name, provider)));

        Map<String, ProviderSyncRoutine> routinesByProvider = new LinkedHashMap<>();
        routines.orderedStream().forEach(routine -> {
            if (!properties.isKnownProvider(routine.providerName())) {
                log.warn("Sync routine {} has no provider configuration and will not be scheduled", routine.providerName());
                return;
            }
            if (routinesByProvider.putIfAbsent(routine.providerName(), routine) != null) {
                throw new IllegalStateException("Duplicate sync routine for provider " + routine.providerName());
            }
        });

        properties.getProviders().forEach((name, provider) -> {
            if (!provider.isEnabled()) {
                log.info("Provider {} is disabled in configuration", name);
                return;
            }
            ProviderSyncRoutine routine = routinesByProvider.get(name);
            if (routine == null) {
                log.warn("Provider {} is configured but no sync routine is registered", name);
                return;
            }
            workers.put(name, new ScheduledSyncWorker(
                name,
                schedules.get(name),
                routine,
                healthService,
                quotaGuard,
                jobDispatcher,
                provider.getFollowOnJobTypes(),
                clock
            ));
        });
    }

    private static SyncSchedule scheduleFor(String name, SyncTrackerProperties.Provider provider) {
        try {
            return provider.toSchedule();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid sync schedule for provider " + name + ": " + e.getMessage(), e);
        }
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorkers().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get() || workers.isEmpty()) {
                return;
            }
            executor = Executors.newFixedThreadPool(workers.size(), runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("sync-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (ScheduledSyncWorker worker : workers.values()) {
                worker.prepareStart();
                executor.execute(() -> {
                    Thread.currentThread().setName("sync-worker-" + worker.getProvider());
                    try {
                        worker.run();
                    } catch (Throwable e) {
                        log.error("Sync worker for {} exited abnormally", worker.getProvider(), e);
                        throw e;
                    }
                });
            }
            log.info("Started {} sync workers: {}", workers.size(), workers.keySet());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            workers.values().forEach(ScheduledSyncWorker::stop);
            if (executor != null) {
                executor.shutdown();
                try {
                    int timeoutSeconds = properties.getWorkers().getShutdownTimeoutSeconds();
                    if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                        log.warn("Sync workers still busy after {}s, interrupting", timeoutSeconds);
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Sync workers stopped");
        }
    }

    public SyncCycleResult triggerSync(String provider) {
        ScheduledSyncWorker worker = workers.get(provider);
        if (worker == null) {
            if (!properties.isKnownProvider(provider)) {
                throw new IntegrationNotFoundException(provider);
            }
            throw new IllegalArgumentException("No active sync worker for provider " + provider);
        }
        return worker.triggerNow();
    }

    public List<SyncWorkerStatus> getWorkerStatuses() {
        List<SyncWorkerStatus> statuses = new ArrayList<>();
        for (ScheduledSyncWorker worker : workers.values()) {
            statuses.add(worker.getStatus());
        }
        return statuses;
    }
}

package com.delta.synctracker.sync.jobs;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.JobWorkerStatus;
import com.delta.synctracker.sync.persistence.BackgroundJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-threaded consumer of pending jobs. Claims the oldest due job with a compare-and-set,
 * routes it to the {@link JobHandler} registered for its type and records the outcome.
 */
@Service
public class JobWorkerService {
    private static final Logger log = LoggerFactory.getLogger(JobWorkerService.class);
    static final String NO_HANDLER_ERROR = "no_handler_for_job_type";
    private static final int CLAIM_CANDIDATES = 5;

    private final BackgroundJobRepository repository;
    private final SyncTrackerProperties properties;
    private final Clock clock;
    private final Map<String, JobHandler> handlers = new LinkedHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final Semaphore wakeUp = new Semaphore(0);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;

    public JobWorkerService(
        BackgroundJobRepository repository,
        ObjectProvider<JobHandler> jobHandlers,
        SyncTrackerProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        jobHandlers.orderedStream().forEach(handler -> {
            JobHandler previous = handlers.putIfAbsent(handler.jobType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate job handler for type " + handler.jobType());
            }
        });
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getJobs().getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int pollIntervalMs = properties.getJobs().getWorker().getPollIntervalMs();
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("job-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.execute(() -> {
                try {
                    workerLoop(pollIntervalMs);
                } catch (Throwable e) {
                    log.error("Job worker exited abnormally", e);
                    running.set(false);
                    throw e;
                }
            });
            log.info("Job worker started with handlers for {}", handlers.keySet());
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Job worker stopped");
        }
    }

    public JobWorkerStatus getStatus() {
        return new JobWorkerStatus(
            running.get(),
            new ArrayList<>(handlers.keySet()),
            completedCount.get(),
            failedCount.get()
        );
    }

    @EventListener
    public void onJobDispatched(JobDispatchedEvent event) {
        if (running.get()) {
            wakeUp.release();
        }
    }

    /**
     * Claims and runs at most one due job on the calling thread.
     *
     * @return true when a job was claimed
     */
    public boolean processNext() {
        BackgroundJob job = claimNext();
        if (job == null) {
            return false;
        }
        runJob(job);
        return true;
    }

    private void workerLoop(int pollIntervalMs) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            boolean processed;
            try {
                processed = processNext();
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                log.warn("Job worker failed to process the next job", e);
                processed = false;
            }
            if (!processed) {
                try {
                    wakeUp.tryAcquire(pollIntervalMs, TimeUnit.MILLISECONDS);
                    wakeUp.drainPermits();
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    private BackgroundJob claimNext() {
        List<UUID> candidates = repository.findDuePendingIds(clock.instant(), CLAIM_CANDIDATES);
        for (UUID candidate : candidates) {
            if (repository.markProcessing(candidate, clock.instant())) {
                return repository.findById(candidate);
            }
        }
        return null;
    }

    private void runJob(BackgroundJob job) {
        JobHandler handler = handlers.get(job.jobType());
        if (handler == null) {
            log.warn("No handler registered for job {} of type {}", job.id(), job.jobType());
            recordFailure(job, NO_HANDLER_ERROR);
            return;
        }
        String result;
        try {
            result = handler.handle(job);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("Job {} of type {} failed", job.id(), job.jobType(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            recordFailure(job, message);
            return;
        }
        if (repository.markCompleted(job.id(), result, clock.instant())) {
            completedCount.incrementAndGet();
        } else {
            log.info("Job {} left PROCESSING before it completed; result discarded", job.id());
        }
    }

    private void recordFailure(BackgroundJob job, String error) {
        if (repository.markFailed(job.id(), truncate(error), clock.instant())) {
            failedCount.incrementAndGet();
        } else {
            log.info("Job {} left PROCESSING before its failure was recorded", job.id());
        }
    }

    private String truncate(String error) {
        int maxLength = properties.getJobs().getMaxErrorLength();
        if (error == null || error.length() <= maxLength) {
            return error;
        }
        return error.substring(0, maxLength);
    }
}

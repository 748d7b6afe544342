package com.delta.synctracker.sync.service;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.JobPage;
import com.delta.synctracker.sync.model.JobStats;
import com.delta.synctracker.sync.model.JobStatus;
import com.delta.synctracker.sync.model.JobSummary;
import com.delta.synctracker.sync.persistence.BackgroundJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Reads and state transitions over background jobs.
 *
 * <p>Retry is allowed from FAILED and CANCELLED only: cancelling is an administrative pause and
 * may be undone, a COMPLETED job is never re-run. Each transition is a single conditional update,
 * so of two concurrent retries on the same job exactly one succeeds and the other gets an
 * {@link InvalidJobTransitionException}.
 */
@Service
public class AdminJobService {
    private static final Logger log = LoggerFactory.getLogger(AdminJobService.class);

    private final BackgroundJobRepository repository;
    private final SyncTrackerProperties properties;
    private final Clock clock;

    public AdminJobService(BackgroundJobRepository repository, SyncTrackerProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public BackgroundJob getById(UUID jobId) {
        BackgroundJob job = repository.findById(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    public JobPage list(JobStatus status, String jobType, Integer page, Integer pageSize) {
        int safePage = page == null ? 1 : Math.max(1, page);
        int maxPageSize = properties.getJobs().getMaxPageSize();
        int safePageSize = pageSize == null
            ? properties.getJobs().getDefaultPageSize()
            : Math.max(1, Math.min(pageSize, maxPageSize));
        long offset = (long) (safePage - 1) * safePageSize;
        int safeOffset = (int) Math.min(offset, Integer.MAX_VALUE);

        long total = repository.countJobs(status, jobType);
        List<JobSummary> items = repository.findPage(status, jobType, safePageSize, safeOffset);
        return JobPage.of(items, total, safePage, safePageSize);
    }

    public JobStats getStats() {
        return JobStats.fromCounts(repository.countByStatus());
    }

    public BackgroundJob retry(UUID jobId) {
        BackgroundJob job = getById(jobId);
        if (!job.status().isRetryable()) {
            throw new InvalidJobTransitionException(jobId, job.status(), "retry");
        }
        if (!repository.retry(jobId, clock.instant())) {
            throw new InvalidJobTransitionException(jobId, getById(jobId).status(), "retry");
        }
        BackgroundJob updated = getById(jobId);
        log.info("Job {} re-queued (retry {})", jobId, updated.retryCount());
        return updated;
    }

    public BackgroundJob cancel(UUID jobId) {
        BackgroundJob job = getById(jobId);
        if (!job.status().isCancellable()) {
            throw new InvalidJobTransitionException(jobId, job.status(), "cancel");
        }
        if (!repository.cancel(jobId, clock.instant())) {
            throw new InvalidJobTransitionException(jobId, getById(jobId).status(), "cancel");
        }
        log.info("Job {} cancelled from {}", jobId, job.status());
        return getById(jobId);
    }

    public BackgroundJob markProcessing(UUID jobId) {
        BackgroundJob job = getById(jobId);
        if (!repository.markProcessing(jobId, clock.instant())) {
            throw new InvalidJobTransitionException(jobId, getById(jobId).status(), "start");
        }
        log.debug("Job {} of type {} is processing", jobId, job.jobType());
        return getById(jobId);
    }

    public BackgroundJob markCompleted(UUID jobId, String result) {
        getById(jobId);
        if (!repository.markCompleted(jobId, result, clock.instant())) {
            throw new InvalidJobTransitionException(jobId, getById(jobId).status(), "complete");
        }
        return getById(jobId);
    }

    public BackgroundJob markFailed(UUID jobId, String error) {
        getById(jobId);
        if (!repository.markFailed(jobId, truncateError(error), clock.instant())) {
            throw new InvalidJobTransitionException(jobId, getById(jobId).status(), "fail");
        }
        log.warn("Job {} failed: {}", jobId, error);
        return getById(jobId);
    }

    private String truncateError(String error) {
        int maxLength = properties.getJobs().getMaxErrorLength();
        if (error == null || error.length() <= maxLength) {
            return error;
        }
        return error.substring(0, maxLength);
    }
}

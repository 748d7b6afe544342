package com.delta.synctracker.sync.jobs;

import com.delta.synctracker.sync.model.BackgroundJob;

/**
 * Consumes jobs of a single type. Implementations must be idempotent: a job can run more than
 * once after a retry.
 */
public interface JobHandler {

    String jobType();

    /**
     * @return an opaque result stored on the completed job, or {@code null}
     */
    String handle(BackgroundJob job) throws Exception;
}

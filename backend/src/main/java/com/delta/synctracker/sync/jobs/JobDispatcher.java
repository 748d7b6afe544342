package com.delta.synctracker.sync.jobs;

import com.delta.synctracker.sync.model.BackgroundJob;
import com.delta.synctracker.sync.model.EnqueueOptions;

import java.util.UUID;

/**
 * Entry point for creating background work. Callers get the job id back as soon as the record
 * is stored; execution happens later in whatever consumes pending jobs.
 */
public interface JobDispatcher {

    default UUID enqueue(String jobType, Object payload) {
        return enqueue(jobType, payload, EnqueueOptions.none());
    }

    UUID enqueue(String jobType, Object payload, EnqueueOptions options);

    /** Hand-off notification only; never runs the job on the caller's thread. */
    void dispatch(BackgroundJob job);
}

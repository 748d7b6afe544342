package com.delta.synctracker.sync.service;

import com.delta.synctracker.sync.model.JobStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidJobTransitionException extends RuntimeException {
    private final UUID jobId;
    private final JobStatus currentStatus;
    private final String action;

    public InvalidJobTransitionException(UUID jobId, JobStatus currentStatus, String action) {
        super("Cannot " + action + " job " + jobId + " in status " + currentStatus);
        this.jobId = jobId;
        this.currentStatus = currentStatus;
        this.action = action;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobStatus getCurrentStatus() {
        return currentStatus;
    }

    public String getAction() {
        return action;
    }
}

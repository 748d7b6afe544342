package com.delta.synctracker.sync.model;

import java.time.Instant;
import java.util.UUID;

public record BackgroundJob(
    UUID id,
    String jobType,
    String payload,
    JobStatus status,
    String result,
    String lastError,
    int retryCount,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant scheduledAt,
    String createdBy,
    String correlationId
) {
    public static BackgroundJob pending(
        UUID id,
        String jobType,
        String payload,
        Instant createdAt,
        EnqueueOptions options
    ) {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType must not be blank");
        }
        EnqueueOptions safeOptions = options == null ? EnqueueOptions.none() : options;
        return new BackgroundJob(
            id,
            jobType.trim(),
            payload,
            JobStatus.PENDING,
            null,
            null,
            0,
            createdAt,
            null,
            null,
            safeOptions.scheduledAt(),
            safeOptions.createdBy(),
            safeOptions.correlationId()
        );
    }
}

package com.delta.synctracker.sync.model;

import java.time.Instant;
import java.util.UUID;

public record JobSummary(
    UUID id,
    String jobType,
    JobStatus status,
    int retryCount,
    Instant createdAt,
    Instant completedAt,
    String lastError
) {
}

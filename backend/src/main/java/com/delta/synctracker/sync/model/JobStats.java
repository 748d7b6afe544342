package com.delta.synctracker.sync.model;

import java.util.Map;

public record JobStats(
    long total,
    long pending,
    long processing,
    long completed,
    long failed,
    long cancelled
) {
    public static JobStats fromCounts(Map<JobStatus, Long> counts) {
        long pending = counts.getOrDefault(JobStatus.PENDING, 0L);
        long processing = counts.getOrDefault(JobStatus.PROCESSING, 0L);
        long completed = counts.getOrDefault(JobStatus.COMPLETED, 0L);
        long failed = counts.getOrDefault(JobStatus.FAILED, 0L);
        long cancelled = counts.getOrDefault(JobStatus.CANCELLED, 0L);
        return new JobStats(
            pending + processing + completed + failed + cancelled,
            pending,
            processing,
            completed,
            failed,
            cancelled
        );
    }
}

package com.delta.synctracker.sync.model;

import java.util.Locale;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** Failed and cancelled jobs may be re-queued; completed work is never re-run. */
    public boolean isRetryable() {
        return this == FAILED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == PROCESSING;
    }

    public static JobStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

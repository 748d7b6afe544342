package com.delta.synctracker.sync.model;

public enum SyncOutcome {
    SUCCEEDED,
    FAILED,
    SKIPPED_DISABLED,
    SKIPPED_QUOTA_EXHAUSTED
}

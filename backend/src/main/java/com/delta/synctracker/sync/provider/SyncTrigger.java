package com.delta.synctracker.sync.provider;

public enum SyncTrigger {
    STARTUP,
    SCHEDULED,
    MANUAL
}

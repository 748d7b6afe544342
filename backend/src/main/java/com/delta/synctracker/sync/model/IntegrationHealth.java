package com.delta.synctracker.sync.model;

public enum IntegrationHealth {
    UNKNOWN,
    HEALTHY,
    DEGRADED,
    DISABLED
}

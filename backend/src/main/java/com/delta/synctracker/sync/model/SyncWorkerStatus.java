package com.delta.synctracker.sync.model;

import java.time.Instant;

public record SyncWorkerStatus(
    String provider,
    String schedule,
    Instant nextRunAtUtc,
    Instant lastCycleStartedAt,
    SyncOutcome lastOutcome,
    String lastError,
    boolean cycleInFlight
) {
}

package com.delta.synctracker.sync.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SyncCycleResult(
    String provider,
    SyncOutcome outcome,
    Instant startedAt,
    Instant finishedAt,
    Duration duration,
    String error,
    List<UUID> followOnJobIds
) {
    public static SyncCycleResult skipped(String provider, SyncOutcome outcome, Instant at) {
        return new SyncCycleResult(provider, outcome, at, at, Duration.ZERO, null, List.of());
    }
}

package com.delta.synctracker.sync.model;

import java.time.Instant;

public record EnqueueOptions(
    Instant scheduledAt,
    String createdBy,
    String correlationId
) {
    private static final EnqueueOptions NONE = new EnqueueOptions(null, null, null);

    public static EnqueueOptions none() {
        return NONE;
    }

    public static EnqueueOptions correlated(String correlationId) {
        return new EnqueueOptions(null, null, correlationId);
    }
}

package com.delta.synctracker.sync.model;

import java.time.Instant;
import java.util.Map;

public record DataAvailability(
    Map<String, Boolean> features,
    Instant evaluatedAt
) {
    public boolean isAvailable(String feature) {
        return Boolean.TRUE.equals(features.get(feature));
    }

    public long availableCount() {
        return features.values().stream().filter(Boolean::booleanValue).count();
    }
}

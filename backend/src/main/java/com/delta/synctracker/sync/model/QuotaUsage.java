package com.delta.synctracker.sync.model;

import java.time.Instant;
import java.util.Map;

public record QuotaUsage(
    String category,
    Instant windowStart,
    int used,
    int remaining,
    int operationalCap,
    int safetyReserve,
    int hardDailyLimit,
    Map<String, Integer> subFeatureUsed
) {
}

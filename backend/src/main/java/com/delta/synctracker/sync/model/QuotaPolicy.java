package com.delta.synctracker.sync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Daily outbound call budget for one provider category.
 *
 * <p>{@code operationalCap} is the ceiling ordinary callers respect; {@code safetyReserve} is held
 * back for priority callers. {@code operationalCap + safetyReserve} never exceeds
 * {@code hardDailyLimit}. Sub-feature carve-outs share the same pool and are clamped to the
 * operational cap.
 */
public record QuotaPolicy(
    String category,
    int hardDailyLimit,
    int operationalCap,
    int safetyReserve,
    int resetHourUtc,
    Map<String, Integer> subFeatureLimits
) {
    public QuotaPolicy {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Quota category must not be blank");
        }
        if (hardDailyLimit < 0 || operationalCap < 0 || safetyReserve < 0) {
            throw new IllegalArgumentException("Quota limits must not be negative for " + category);
        }
        if (operationalCap > hardDailyLimit) {
            throw new IllegalArgumentException(
                "operationalCap " + operationalCap + " exceeds hardDailyLimit " + hardDailyLimit + " for " + category
            );
        }
        if ((long) operationalCap + safetyReserve > hardDailyLimit) {
            throw new IllegalArgumentException(
                "operationalCap + safetyReserve exceeds hardDailyLimit for " + category
            );
        }
        if (resetHourUtc < 0 || resetHourUtc > 23) {
            throw new IllegalArgumentException("resetHourUtc must be between 0 and 23 for " + category);
        }
        Map<String, Integer> clamped = new LinkedHashMap<>();
        if (subFeatureLimits != null) {
            for (Map.Entry<String, Integer> entry : subFeatureLimits.entrySet()) {
                int limit = entry.getValue() == null ? 0 : entry.getValue();
                if (limit < 0) {
                    throw new IllegalArgumentException(
                        "Sub-feature limit must not be negative: " + category + "/" + entry.getKey()
                    );
                }
                clamped.put(entry.getKey(), Math.min(limit, operationalCap));
            }
        }
        subFeatureLimits = Collections.unmodifiableMap(clamped);
    }

    public boolean hasSubFeature(String subFeature) {
        return subFeature != null && subFeatureLimits.containsKey(subFeature);
    }

    public int subFeatureLimit(String subFeature) {
        Integer limit = subFeatureLimits.get(subFeature);
        return limit == null ? 0 : limit;
    }
}

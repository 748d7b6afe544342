package com.delta.synctracker.sync.provider;

import com.delta.synctracker.sync.service.QuotaGuard;

import java.time.Instant;

/**
 * What a routine gets for one cycle. Quota checks go through here so routines can degrade before
 * they make a call rather than fail after it.
 */
public record SyncContext(
    String provider,
    SyncTrigger trigger,
    Instant startedAt,
    QuotaGuard quotaGuard
) {
    public boolean tryReserve(int cost) {
        return quotaGuard.tryReserve(provider, cost);
    }

    public boolean tryReserve(String subFeature, int cost) {
        return quotaGuard.tryReserve(provider, subFeature, cost);
    }

    public boolean tryReservePriority(int cost) {
        return quotaGuard.tryReservePriority(provider, cost);
    }

    public void reserveOrThrow(String subFeature, int cost) {
        quotaGuard.reserveOrThrow(provider, subFeature, cost);
    }
}

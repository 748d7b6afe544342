package com.delta.synctracker.sync.service;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.QuotaPolicy;
import com.delta.synctracker.sync.model.QuotaUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Daily outbound call budgets, one window per quota category.
 *
 * <p>Ordinary reservations stop at the operational cap and never eat into the safety reserve;
 * priority reservations may go up to the hard daily limit. A sub-feature carve-out is a nested
 * counter inside the same window and is checked in addition to the category budget. Providers
 * whose category has no configured policy are not budgeted.
 */
@Service
public class QuotaGuard {
    private static final Logger log = LoggerFactory.getLogger(QuotaGuard.class);

    private final SyncTrackerProperties properties;
    private final Clock clock;
    private final Map<String, QuotaPolicy> policies = new LinkedHashMap<>();
    private final Map<String, QuotaWindow> windows = new LinkedHashMap<>();

    public QuotaGuard(SyncTrackerProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        properties.getQuotas().forEach((category, quota) -> {
            QuotaPolicy policy = quota.toPolicy(category);
            policies.put(category, policy);
            windows.put(category, new QuotaWindow(policy));
        });
    }

    public boolean tryReserve(String provider, int cost) {
        return tryReserve(provider, null, cost);
    }

    public boolean tryReserve(String provider, String subFeature, int cost) {
        requirePositive(cost);
        QuotaWindow window = windowFor(provider);
        if (window == null) {
            return true;
        }
        boolean reserved = window.reserve(subFeature, cost, false, clock.instant());
        if (!reserved) {
            log.warn("Quota exhausted for {} (category {}, sub-feature {})", provider, window.policy.category(), subFeature);
        }
        return reserved;
    }

    /** Reservation that may draw on the safety reserve, up to the hard daily limit. */
    public boolean tryReservePriority(String provider, int cost) {
        requirePositive(cost);
        QuotaWindow window = windowFor(provider);
        if (window == null) {
            return true;
        }
        boolean reserved = window.reserve(null, cost, true, clock.instant());
        if (!reserved) {
            log.warn("Hard daily limit reached for {} (category {})", provider, window.policy.category());
        }
        return reserved;
    }

    public void reserveOrThrow(String provider, String subFeature, int cost) {
        if (!tryReserve(provider, subFeature, cost)) {
            String category = properties.quotaCategoryFor(provider);
            throw new QuotaExhaustedException(category, "Daily quota exhausted for " + category);
        }
    }

    /** Whether an ordinary caller could reserve one more call right now; consumes nothing. */
    public boolean hasBudget(String provider) {
        QuotaWindow window = windowFor(provider);
        return window == null || window.canReserve(null, 1, false, clock.instant());
    }

    public List<QuotaUsage> getAllUsage() {
        Instant now = clock.instant();
        List<QuotaUsage> usage = new ArrayList<>();
        for (QuotaWindow window : windows.values()) {
            usage.add(window.snapshot(now));
        }
        return usage;
    }

    public QuotaUsage getUsage(String category) {
        QuotaWindow window = windows.get(category);
        return window == null ? null : window.snapshot(clock.instant());
    }

    static Instant windowStartFor(Instant now, int resetHourUtc) {
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        ZonedDateTime todayReset = today.atStartOfDay(ZoneOffset.UTC).plusHours(resetHourUtc);
        return now.isBefore(todayReset.toInstant())
            ? todayReset.minusDays(1).toInstant()
            : todayReset.toInstant();
    }

    private QuotaWindow windowFor(String provider) {
        return windows.get(properties.quotaCategoryFor(provider));
    }

    private void requirePositive(int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("Quota cost must be positive, got " + cost);
        }
    }

    private static final class QuotaWindow {
        private final QuotaPolicy policy;
        private final Map<String, Integer> subFeatureUsed = new LinkedHashMap<>();
        private Instant windowStart;
        private int used;

        private QuotaWindow(QuotaPolicy policy) {
            this.policy = policy;
        }

        synchronized boolean reserve(String subFeature, int cost, boolean priority, Instant now) {
            if (!canReserve(subFeature, cost, priority, now)) {
                return false;
            }
            used += cost;
            if (policy.hasSubFeature(subFeature)) {
                subFeatureUsed.merge(subFeature, cost, Integer::sum);
            }
            return true;
        }

        synchronized boolean canReserve(String subFeature, int cost, boolean priority, Instant now) {
            rollIfNeeded(now);
            int after = used + cost;
            if (priority) {
                return after <= policy.hardDailyLimit();
            }
            if (after > policy.operationalCap() || policy.hardDailyLimit() - after < policy.safetyReserve()) {
                return false;
            }
            if (policy.hasSubFeature(subFeature)) {
                int subUsed = subFeatureUsed.getOrDefault(subFeature, 0);
                return subUsed + cost <= policy.subFeatureLimit(subFeature);
            }
            return true;
        }

        synchronized QuotaUsage snapshot(Instant now) {
            rollIfNeeded(now);
            Map<String, Integer> subUsage = new LinkedHashMap<>();
            for (String feature : policy.subFeatureLimits().keySet()) {
                subUsage.put(feature, subFeatureUsed.getOrDefault(feature, 0));
            }
            return new QuotaUsage(
                policy.category(),
                windowStart,
                used,
                Math.max(0, policy.operationalCap() - used),
                policy.operationalCap(),
                policy.safetyReserve(),
                policy.hardDailyLimit(),
                subUsage
            );
        }

        private void rollIfNeeded(Instant now) {
            Instant start = windowStartFor(now, policy.resetHourUtc());
            if (!start.equals(windowStart)) {
                if (windowStart != null) {
                    log.info("Quota window for {} reset after {} calls", policy.category(), used);
                }
                windowStart = start;
                used = 0;
                subFeatureUsed.clear();
            }
        }
    }
}

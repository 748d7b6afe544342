package com.delta.synctracker.sync.service;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.QuotaUsage;
import com.delta.synctracker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaGuardTest {
    private MutableClock clock;
    private QuotaGuard guard;

    @BeforeEach
    void setUp() {
        SyncTrackerProperties properties = new SyncTrackerProperties();
        SyncTrackerProperties.Provider odds = new SyncTrackerProperties.Provider();
        odds.setQuotaCategory("shared-api");
        SyncTrackerProperties.Provider injuries = new SyncTrackerProperties.Provider();
        injuries.setQuotaCategory("shared-api");
        properties.getProviders().put("odds", odds);
        properties.getProviders().put("injuries", injuries);
        properties.getProviders().put("unbudgeted", new SyncTrackerProperties.Provider());

        SyncTrackerProperties.Quota quota = new SyncTrackerProperties.Quota();
        quota.setHardDailyLimit(20);
        quota.setOperationalCap(15);
        quota.setSafetyReserve(5);
        quota.setResetHourUtc(6);
        quota.setSubFeatures(Map.of("injury-reports", 4));
        properties.getQuotas().put("shared-api", quota);

        clock = new MutableClock(Instant.parse("2026-02-16T10:00:00Z"));
        guard = new QuotaGuard(properties, clock);
    }

    @Test
    void ordinaryCallersStopAtOperationalCap() {
        int granted = 0;
        for (int i = 0; i < 50; i++) {
            if (guard.tryReserve("odds", 1)) {
                granted++;
            }
        }
        assertThat(granted).isEqualTo(15);
        assertThat(guard.hasBudget("odds")).isFalse();
    }

    @Test
    void providersSharingACategoryShareTheBudget() {
        assertThat(guard.tryReserve("odds", 10)).isTrue();
        assertThat(guard.tryReserve("injuries", 6)).isFalse();
        assertThat(guard.tryReserve("injuries", 5)).isTrue();
    }

    @Test
    void priorityCallersMayUseTheSafetyReserveUpToHardLimit() {
        assertThat(guard.tryReserve("odds", 15)).isTrue();
        assertThat(guard.tryReserve("odds", 1)).isFalse();
        assertThat(guard.tryReservePriority("odds", 5)).isTrue();
        assertThat(guard.tryReservePriority("odds", 1)).isFalse();

        QuotaUsage usage = guard.getUsage("shared-api");
        assertThat(usage.used()).isEqualTo(20);
        assertThat(usage.remaining()).isZero();
    }

    @Test
    void subFeatureCarveOutHoldsEvenWhenPoolHasRoom() {
        for (int i = 0; i < 4; i++) {
            assertThat(guard.tryReserve("injuries", "injury-reports", 1)).isTrue();
        }
        assertThat(guard.tryReserve("injuries", "injury-reports", 1)).isFalse();
        assertThat(guard.tryReserve("injuries", 1)).isTrue();

        QuotaUsage usage = guard.getUsage("shared-api");
        assertThat(usage.used()).isEqualTo(5);
        assertThat(usage.subFeatureUsed()).containsEntry("injury-reports", 4);
    }

    @Test
    void windowResetsAtConfiguredHour() {
        assertThat(guard.tryReserve("odds", 15)).isTrue();
        assertThat(guard.hasBudget("odds")).isFalse();

        clock.set(Instant.parse("2026-02-17T05:59:59Z"));
        assertThat(guard.hasBudget("odds")).isFalse();

        clock.set(Instant.parse("2026-02-17T06:00:00Z"));
        assertThat(guard.hasBudget("odds")).isTrue();
        assertThat(guard.getUsage("shared-api").windowStart()).isEqualTo(Instant.parse("2026-02-17T06:00:00Z"));
    }

    @Test
    void cumulativeReservationsNeverBreachCapOrReserve() {
        int[] costs = {3, 7, 1, 4, 2, 9, 1, 1, 5, 2};
        int total = 0;
        for (int cost : costs) {
            if (guard.tryReserve("odds", cost)) {
                total += cost;
            }
            assertThat(total).isLessThanOrEqualTo(15);
            assertThat(20 - total).isGreaterThanOrEqualTo(5);
        }
        clock.advance(Duration.ofMinutes(1));
        assertThat(guard.getUsage("shared-api").used()).isEqualTo(total);
    }

    @Test
    void unbudgetedProviderIsAlwaysAllowed() {
        for (int i = 0; i < 100; i++) {
            assertThat(guard.tryReserve("unbudgeted", 1)).isTrue();
        }
    }

    @Test
    void reserveOrThrowSignalsExhaustion() {
        guard.tryReserve("odds", 15);
        assertThatThrownBy(() -> guard.reserveOrThrow("odds", null, 1))
            .isInstanceOf(QuotaExhaustedException.class)
            .hasMessageContaining("shared-api");
    }

    @Test
    void nonPositiveCostIsRejected() {
        assertThatThrownBy(() -> guard.tryReserve("odds", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}

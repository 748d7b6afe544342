package com.delta.synctracker.sync.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Health row for one external provider.
 *
 * <p>Computed health and the manual override are kept in separate fields: a successful sync
 * clears a computed {@link IntegrationHealth#DEGRADED} state but never lifts a manual disable.
 * Transition methods return a new value and leave persistence to the caller.
 */
public record IntegrationStatus(
    String integrationName,
    IntegrationHealth health,
    int consecutiveFailures,
    long totalSuccesses,
    long totalFailures,
    Instant lastSuccessAt,
    Instant lastFailureAt,
    Instant lastAttemptAt,
    String lastErrorMessage,
    String lastErrorDetails,
    Duration averageSyncDuration,
    Duration staleThreshold,
    boolean manuallyDisabled,
    String disabledReason,
    String disabledBy,
    Instant disabledAt,
    Instant createdAt,
    Instant updatedAt
) {
    public static IntegrationStatus initial(String integrationName, Duration staleThreshold, Instant now) {
        return new IntegrationStatus(
            integrationName,
            IntegrationHealth.UNKNOWN,
            0,
            0,
            0,
            null,
            null,
            null,
            null,
            null,
            null,
            staleThreshold,
            false,
            null,
            null,
            null,
            now,
            now
        );
    }

    public boolean isOperational() {
        return !manuallyDisabled && health != IntegrationHealth.DISABLED;
    }

    /** A provider that has never synced successfully is stale. */
    public boolean isDataStale(Instant now) {
        if (lastSuccessAt == null) {
            return true;
        }
        return Duration.between(lastSuccessAt, now).compareTo(staleThreshold) > 0;
    }

    public boolean hasFreshData(Instant now) {
        return isOperational() && !isDataStale(now);
    }

    public IntegrationStatus recordSuccess(Duration duration, Instant now) {
        Duration safeDuration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        Duration average = averageSyncDuration == null
            ? safeDuration
            : averageSyncDuration.plus(safeDuration).dividedBy(2);
        return new IntegrationStatus(
            integrationName,
            manuallyDisabled ? IntegrationHealth.DISABLED : IntegrationHealth.HEALTHY,
            0,
            totalSuccesses + 1,
            totalFailures,
            now,
            lastFailureAt,
            now,
            null,
            null,
            average,
            staleThreshold,
            manuallyDisabled,
            disabledReason,
            disabledBy,
            disabledAt,
            createdAt,
            now
        );
    }

    public IntegrationStatus recordFailure(String message, String details, Instant now, int degradedAfterFailures) {
        int failures = consecutiveFailures + 1;
        IntegrationHealth next;
        if (manuallyDisabled) {
            next = IntegrationHealth.DISABLED;
        } else if (failures >= Math.max(1, degradedAfterFailures)) {
            next = IntegrationHealth.DEGRADED;
        } else {
            next = health;
        }
        return new IntegrationStatus(
            integrationName,
            next,
            failures,
            totalSuccesses,
            totalFailures + 1,
            lastSuccessAt,
            now,
            now,
            message,
            details,
            averageSyncDuration,
            staleThreshold,
            manuallyDisabled,
            disabledReason,
            disabledBy,
            disabledAt,
            createdAt,
            now
        );
    }

    public IntegrationStatus disable(String reason, String actor, Instant now) {
        return new IntegrationStatus(
            integrationName,
            IntegrationHealth.DISABLED,
            consecutiveFailures,
            totalSuccesses,
            totalFailures,
            lastSuccessAt,
            lastFailureAt,
            lastAttemptAt,
            lastErrorMessage,
            lastErrorDetails,
            averageSyncDuration,
            staleThreshold,
            true,
            reason,
            actor,
            now,
            createdAt,
            now
        );
    }

    /** Re-enabling forces re-evaluation: health goes back to UNKNOWN, failure history is kept. */
    public IntegrationStatus enable(Instant now) {
        return new IntegrationStatus(
            integrationName,
            IntegrationHealth.UNKNOWN,
            consecutiveFailures,
            totalSuccesses,
            totalFailures,
            lastSuccessAt,
            lastFailureAt,
            lastAttemptAt,
            lastErrorMessage,
            lastErrorDetails,
            averageSyncDuration,
            staleThreshold,
            false,
            null,
            null,
            null,
            createdAt,
            now
        );
    }

    public IntegrationStatus withStaleThreshold(Duration threshold) {
        return new IntegrationStatus(
            integrationName,
            health,
            consecutiveFailures,
            totalSuccesses,
            totalFailures,
            lastSuccessAt,
            lastFailureAt,
            lastAttemptAt,
            lastErrorMessage,
            lastErrorDetails,
            averageSyncDuration,
            threshold,
            manuallyDisabled,
            disabledReason,
            disabledBy,
            disabledAt,
            createdAt,
            updatedAt
        );
    }
}

package com.delta.synctracker.sync.service;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.DataAvailability;
import com.delta.synctracker.sync.model.IntegrationStatus;
import com.delta.synctracker.sync.persistence.IntegrationStatusRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Per-provider health tracking. Rows are created lazily with UNKNOWN health; every
 * read-modify-write locks the provider's row for the duration of the transaction so a sync
 * outcome cannot overwrite a concurrent manual disable or enable.
 */
@Service
public class IntegrationHealthService {
    private static final Logger log = LoggerFactory.getLogger(IntegrationHealthService.class);

    private final IntegrationStatusRepository repository;
    private final SyncTrackerProperties properties;
    private final Clock clock;

    public IntegrationHealthService(
        IntegrationStatusRepository repository,
        SyncTrackerProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void validateAvailabilityRules() {
        properties.getAvailability().forEach((feature, rule) -> {
            List<String> referenced = new ArrayList<>(rule.getFresh());
            referenced.addAll(rule.getOperational());
            for (String provider : referenced) {
                if (!properties.isKnownProvider(provider)) {
                    throw new IllegalArgumentException(
                        "Availability feature " + feature + " references unknown provider " + provider
                    );
                }
            }
        });
    }

    @Transactional
    public IntegrationStatus getStatus(String integrationName) {
        requireKnown(integrationName);
        ensureRow(integrationName);
        return withConfiguredThreshold(repository.findByName(integrationName));
    }

    /** Every configured provider, ordered by name, created on first access. */
    @Transactional
    public List<IntegrationStatus> getAllStatuses() {
        for (String provider : properties.getProviders().keySet()) {
            ensureRow(provider);
        }
        List<IntegrationStatus> statuses = new ArrayList<>();
        for (IntegrationStatus status : repository.findAll()) {
            if (properties.isKnownProvider(status.integrationName())) {
                statuses.add(withConfiguredThreshold(status));
            }
        }
        return statuses;
    }

    @Transactional
    public IntegrationStatus recordSuccess(String integrationName, Duration duration) {
        IntegrationStatus updated = mutate(integrationName, status -> status.recordSuccess(duration, clock.instant()));
        log.debug("Integration {} synced successfully in {} ms", integrationName, duration == null ? 0 : duration.toMillis());
        return updated;
    }

    @Transactional
    public IntegrationStatus recordFailure(String integrationName, String message, String details) {
        int degradedAfter = properties.getHealth().getDegradedAfterFailures();
        IntegrationStatus updated = mutate(
            integrationName,
            status -> status.recordFailure(message, details, clock.instant(), degradedAfter)
        );
        log.warn(
            "Integration {} sync failed ({} consecutive, health {}): {}",
            integrationName,
            updated.consecutiveFailures(),
            updated.health(),
            message
        );
        return updated;
    }

    @Transactional
    public IntegrationStatus disable(String integrationName, String reason, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A reason is required to disable " + integrationName);
        }
        String safeActor = actor == null || actor.isBlank() ? "admin" : actor.trim();
        IntegrationStatus updated = mutate(
            integrationName,
            status -> status.disable(reason.trim(), safeActor, clock.instant())
        );
        log.warn("Integration {} disabled by {}: {}", integrationName, safeActor, reason.trim());
        return updated;
    }

    @Transactional
    public IntegrationStatus enable(String integrationName) {
        IntegrationStatus updated = mutate(integrationName, status -> status.enable(clock.instant()));
        log.info("Integration {} re-enabled", integrationName);
        return updated;
    }

    @Transactional
    public boolean isOperational(String integrationName) {
        return getStatus(integrationName).isOperational();
    }

    @Transactional
    public boolean hasFreshData(String integrationName) {
        return getStatus(integrationName).hasFreshData(clock.instant());
    }

    @Transactional
    public DataAvailability getDataAvailability() {
        Instant now = clock.instant();
        Map<String, IntegrationStatus> byName = new LinkedHashMap<>();
        for (IntegrationStatus status : getAllStatuses()) {
            byName.put(status.integrationName(), status);
        }
        Map<String, Boolean> features = new LinkedHashMap<>();
        properties.getAvailability().forEach((feature, rule) -> {
            boolean available = rule.getFresh().stream()
                .allMatch(provider -> byName.containsKey(provider) && byName.get(provider).hasFreshData(now))
                && rule.getOperational().stream()
                .allMatch(provider -> byName.containsKey(provider) && byName.get(provider).isOperational());
            features.put(feature, available);
        });
        return new DataAvailability(features, now);
    }

    private IntegrationStatus mutate(String integrationName, UnaryOperator<IntegrationStatus> change) {
        requireKnown(integrationName);
        ensureRow(integrationName);
        IntegrationStatus current = repository.findForUpdate(integrationName);
        IntegrationStatus updated = change.apply(withConfiguredThreshold(current));
        repository.update(updated);
        return updated;
    }

    private void ensureRow(String integrationName) {
        IntegrationStatus initial = IntegrationStatus.initial(
            integrationName,
            properties.staleThresholdFor(integrationName),
            clock.instant()
        );
        if (repository.insertIfMissing(initial)) {
            log.info("Created health row for integration {}", integrationName);
        }
    }

    private IntegrationStatus withConfiguredThreshold(IntegrationStatus status) {
        Duration configured = properties.staleThresholdFor(status.integrationName());
        return configured.equals(status.staleThreshold()) ? status : status.withStaleThreshold(configured);
    }

    private void requireKnown(String integrationName) {
        if (!properties.isKnownProvider(integrationName)) {
            throw new IntegrationNotFoundException(integrationName);
        }
    }
}

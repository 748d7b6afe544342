package com.delta.synctracker.sync.ratelimit;

import com.delta.synctracker.config.SyncTrackerProperties;
import com.delta.synctracker.sync.model.RateLimitDecision;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Admission control for API callers, one token bucket per partition key. Idle partitions are
 * evicted by the cache; a returning caller starts with a full bucket.
 */
@Component
public class InboundRateLimiter {
    private final SyncTrackerProperties.RateLimiting settings;
    private final Clock clock;
    private final Cache<String, TokenBucket> partitions;

    public InboundRateLimiter(SyncTrackerProperties properties, Clock clock) {
        this.settings = properties.getRateLimiting();
        this.clock = clock;
        this.partitions = Caffeine.newBuilder()
            .maximumSize(settings.getPartitionCacheMaxSize())
            .expireAfterAccess(Duration.ofMinutes(settings.getPartitionIdleMinutes()))
            .build();
    }

    public RateLimitDecision admit(String partitionKey) {
        TokenBucket bucket = partitions.get(partitionKey, key -> new TokenBucket(
            settings.getTokenLimit(),
            settings.getTokensPerPeriod(),
            Duration.ofSeconds(settings.getReplenishPeriodSeconds()),
            clock
        ));
        RateLimitDecision decision = bucket.tryAcquire();
        int queueLimit = settings.getQueueLimit();
        if (decision.allowed() || queueLimit == 0 || !bucket.tryEnterQueue(queueLimit)) {
            return decision;
        }
        try {
            Thread.sleep(Math.max(1, decision.retryAfter().toMillis()));
            return bucket.tryAcquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return decision;
        } finally {
            bucket.leaveQueue();
        }
    }

    public long partitionCount() {
        partitions.cleanUp();
        return partitions.estimatedSize();
    }
}

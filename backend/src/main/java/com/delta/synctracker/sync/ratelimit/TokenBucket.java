package com.delta.synctracker.sync.ratelimit;

import com.delta.synctracker.sync.model.RateLimitDecision;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket for one caller. Tokens are added in whole periods: every {@code replenishPeriod}
 * the bucket gains {@code tokensPerPeriod}, capped at {@code tokenLimit}.
 */
public class TokenBucket {
    private final int tokenLimit;
    private final int tokensPerPeriod;
    private final Duration replenishPeriod;
    private final Clock clock;

    private int tokens;
    private Instant lastReplenishedAt;
    private int queued;

    public TokenBucket(int tokenLimit, int tokensPerPeriod, Duration replenishPeriod, Clock clock) {
        if (tokenLimit < 1 || tokensPerPeriod < 1) {
            throw new IllegalArgumentException("tokenLimit and tokensPerPeriod must be positive");
        }
        if (replenishPeriod == null || replenishPeriod.isZero() || replenishPeriod.isNegative()) {
            throw new IllegalArgumentException("replenishPeriod must be positive");
        }
        this.tokenLimit = tokenLimit;
        this.tokensPerPeriod = tokensPerPeriod;
        this.replenishPeriod = replenishPeriod;
        this.clock = clock;
        this.tokens = tokenLimit;
        this.lastReplenishedAt = clock.instant();
    }

    public synchronized RateLimitDecision tryAcquire() {
        Instant now = clock.instant();
        replenish(now);
        if (tokens > 0) {
            tokens--;
            return RateLimitDecision.allow();
        }
        return RateLimitDecision.reject(Duration.between(now, lastReplenishedAt.plus(replenishPeriod)));
    }

    public synchronized int availableTokens() {
        replenish(clock.instant());
        return tokens;
    }

    synchronized boolean tryEnterQueue(int queueLimit) {
        if (queued >= queueLimit) {
            return false;
        }
        queued++;
        return true;
    }

    synchronized void leaveQueue() {
        queued = Math.max(0, queued - 1);
    }

    private void replenish(Instant now) {
        long periodMillis = replenishPeriod.toMillis();
        long elapsedMillis = Duration.between(lastReplenishedAt, now).toMillis();
        if (elapsedMillis < periodMillis) {
            return;
        }
        long periods = elapsedMillis / periodMillis;
        long refill = periods * tokensPerPeriod;
        tokens = (int) Math.min(tokenLimit, tokens + refill);
        lastReplenishedAt = lastReplenishedAt.plusMillis(periods * periodMillis);
    }
}

package com.delta.synctracker.sync.model;

import java.time.Duration;

public record RateLimitDecision(boolean allowed, Duration retryAfter) {
    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, null);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        Duration safe = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
        return new RateLimitDecision(false, safe);
    }

    /** Whole seconds, rounded up, never below one. */
    public long retryAfterSeconds() {
        if (retryAfter == null) {
            return 0;
        }
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}

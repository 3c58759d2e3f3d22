package com.phillippitts.voicebridge.service.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable token-bucket state for one key. Replaced atomically by {@link RateLimiter}.
 *
 * @param key        limited key (client key, or session id for ingest throttling)
 * @param tokens     available tokens, fractional between refills
 * @param lastRefill instant of the last refill computation
 */
public record RateBucket(String key, double tokens, Instant lastRefill) {

    static RateBucket full(String key, int capacity, Instant now) {
        return new RateBucket(key, capacity, now);
    }

    /**
     * Adds the tokens accrued since the last refill, capped at capacity.
     */
    RateBucket refill(Instant now, double refillPerSecond, int capacity) {
        if (!now.isAfter(lastRefill)) {
            return this;
        }
        double elapsedSeconds = Duration.between(lastRefill, now).toNanos() / 1_000_000_000.0;
        double refilled = Math.min(capacity, tokens + elapsedSeconds * refillPerSecond);
        return new RateBucket(key, refilled, now);
    }

    RateBucket consume() {
        return new RateBucket(key, tokens - 1.0, lastRefill);
    }

    boolean hasToken() {
        return tokens >= 1.0;
    }
}

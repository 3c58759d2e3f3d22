package com.phillippitts.voicebridge.service.ratelimit;

import com.phillippitts.voicebridge.config.properties.RateLimitProperties;
import com.phillippitts.voicebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Token-bucket rate limiting keyed by client key.
 *
 * <p>Two independent bucket sets exist: connection admission ({@link #allow(String)}) and
 * optional audio ingest throttling ({@link #allowIngest(String)}). Each decision refills and
 * consumes inside {@code ConcurrentHashMap.compute}, so it is atomic per key without a global
 * lock. Buckets untouched for {@code voicebridge.rate-limit.idle-eviction-ms} are evicted.
 */
@Service
public class RateLimiter {

    private static final Logger LOG = LogManager.getLogger(RateLimiter.class);

    private final RateLimitProperties props;
    private final Clock clock;

    private final ConcurrentMap<String, RateBucket> admissionBuckets = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RateBucket> ingestBuckets = new ConcurrentHashMap<>();

    public RateLimiter(RateLimitProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Takes one admission token for the key.
     *
     * @return true if a token was available
     */
    public boolean allow(String key) {
        boolean allowed = tryConsume(admissionBuckets, key, props.getCapacity(), props.getRefillPerSecond());
        if (!allowed) {
            LOG.debug("Rate limit exceeded for client {}", LogSanitizer.maskKey(key));
        }
        return allowed;
    }

    /**
     * Takes one ingest token for the key. Always true when ingest throttling is disabled.
     */
    public boolean allowIngest(String key) {
        if (!props.isThrottleIngest()) {
            return true;
        }
        return tryConsume(ingestBuckets, key, props.getIngestCapacity(), props.getIngestRefillPerSecond());
    }

    /**
     * Removes buckets that have not been touched within the idle eviction window.
     *
     * @return number of evicted buckets
     */
    @Scheduled(fixedDelayString = "${voicebridge.rate-limit.eviction-interval-ms:60000}")
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(Duration.ofMillis(props.getIdleEvictionMs()));
        int before = admissionBuckets.size() + ingestBuckets.size();
        admissionBuckets.values().removeIf(b -> b.lastRefill().isBefore(cutoff));
        ingestBuckets.values().removeIf(b -> b.lastRefill().isBefore(cutoff));
        int evicted = before - admissionBuckets.size() - ingestBuckets.size();
        if (evicted > 0) {
            LOG.debug("Evicted {} idle rate bucket(s)", evicted);
        }
        return evicted;
    }

    public int bucketCount() {
        return admissionBuckets.size() + ingestBuckets.size();
    }

    private boolean tryConsume(ConcurrentMap<String, RateBucket> buckets, String key,
                               int capacity, double refillPerSecond) {
        Objects.requireNonNull(key, "key");
        boolean[] allowed = new boolean[1];
        Instant now = clock.instant();
        buckets.compute(key, (k, bucket) -> {
            RateBucket current = bucket == null
                    ? RateBucket.full(k, capacity, now)
                    : bucket.refill(now, refillPerSecond, capacity);
            if (current.hasToken()) {
                allowed[0] = true;
                return current.consume();
            }
            return current;
        });
        return allowed[0];
    }
}

package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token bucket settings shared by session admission and optional ingest throttling.
 *
 * <p>Properties:
 * <ul>
 *   <li>voicebridge.rate-limit.capacity - bucket size for session opens (default: 10)</li>
 *   <li>voicebridge.rate-limit.refill-per-second - session-open tokens added per second (default: 1.0)</li>
 *   <li>voicebridge.rate-limit.throttle-ingest - also throttle audio frames (default: false)</li>
 *   <li>voicebridge.rate-limit.ingest-capacity / ingest-refill-per-second - frame bucket
 *       (defaults: 200 / 100.0)</li>
 *   <li>voicebridge.rate-limit.idle-eviction-ms - drop buckets untouched this long (default: 600000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicebridge.rate-limit")
@Validated
public class RateLimitProperties {

    @Positive
    private int capacity = 10;

    @Positive
    private double refillPerSecond = 1.0;

    private boolean throttleIngest = false;

    @Positive
    private int ingestCapacity = 200;

    @Positive
    private double ingestRefillPerSecond = 100.0;

    @Positive
    private long idleEvictionMs = 600_000;

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    public void setRefillPerSecond(double refillPerSecond) {
        this.refillPerSecond = refillPerSecond;
    }

    public boolean isThrottleIngest() {
        return throttleIngest;
    }

    public void setThrottleIngest(boolean throttleIngest) {
        this.throttleIngest = throttleIngest;
    }

    public int getIngestCapacity() {
        return ingestCapacity;
    }

    public void setIngestCapacity(int ingestCapacity) {
        this.ingestCapacity = ingestCapacity;
    }

    public double getIngestRefillPerSecond() {
        return ingestRefillPerSecond;
    }

    public void setIngestRefillPerSecond(double ingestRefillPerSecond) {
        this.ingestRefillPerSecond = ingestRefillPerSecond;
    }

    public long getIdleEvictionMs() {
        return idleEvictionMs;
    }

    public void setIdleEvictionMs(long idleEvictionMs) {
        this.idleEvictionMs = idleEvictionMs;
    }
}

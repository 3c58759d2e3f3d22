package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Reorder buffer bounds of the result broadcaster and the per-session outbox size.
 */
@ConfigurationProperties(prefix = "voicebridge.reorder")
@Validated
public class ReorderProperties {

    /** Early results buffered per session before an out-of-order flush. */
    @Positive
    private int capacity = 8;

    /** Longest a sequence gap may persist before buffered results are flushed, in ms. */
    @Positive
    private long maxWaitMs = 2_000;

    /** Outbound messages queued per session before new ones are dropped. */
    @Positive
    private int outboxCapacity = 256;

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public long getMaxWaitMs() {
        return maxWaitMs;
    }

    public void setMaxWaitMs(long maxWaitMs) {
        this.maxWaitMs = maxWaitMs;
    }

    public int getOutboxCapacity() {
        return outboxCapacity;
    }

    public void setOutboxCapacity(int outboxCapacity) {
        this.outboxCapacity = outboxCapacity;
    }
}

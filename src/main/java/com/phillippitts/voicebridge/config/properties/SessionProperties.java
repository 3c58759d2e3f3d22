package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Session admission and lifecycle limits.
 *
 * <p>Properties:
 * <ul>
 *   <li>voicebridge.session.max-sessions - process-wide concurrent session cap (default: 100)</li>
 *   <li>voicebridge.session.max-sessions-per-client - concurrent sessions per client key (default: 5)</li>
 *   <li>voicebridge.session.idle-timeout - close sessions idle this long (default: 60s)</li>
 *   <li>voicebridge.session.drain-grace - wait for in-flight work on close (default: 5s)</li>
 *   <li>voicebridge.session.reap-interval-ms - idle sweep period (default: 10000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicebridge.session")
@Validated
public class SessionProperties {

    @Positive(message = "Max sessions must be positive")
    private int maxSessions = 100;

    @Positive(message = "Max sessions per client must be positive")
    private int maxSessionsPerClient = 5;

    @NotNull
    private Duration idleTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration drainGrace = Duration.ofSeconds(5);

    @Positive
    private long reapIntervalMs = 10_000;

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }

    public int getMaxSessionsPerClient() {
        return maxSessionsPerClient;
    }

    public void setMaxSessionsPerClient(int maxSessionsPerClient) {
        this.maxSessionsPerClient = maxSessionsPerClient;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getDrainGrace() {
        return drainGrace;
    }

    public void setDrainGrace(Duration drainGrace) {
        this.drainGrace = drainGrace;
    }

    public long getReapIntervalMs() {
        return reapIntervalMs;
    }

    public void setReapIntervalMs(long reapIntervalMs) {
        this.reapIntervalMs = reapIntervalMs;
    }
}

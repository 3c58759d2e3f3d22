package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry, fallback and per-session concurrency policy of the provider dispatcher.
 *
 * <p>Properties:
 * <ul>
 *   <li>voicebridge.dispatch.attempt-timeout-ms - per-attempt provider timeout (default: 5000)</li>
 *   <li>voicebridge.dispatch.attempts-per-provider - attempts against one provider before
 *       falling back (default: 2, i.e. one retry)</li>
 *   <li>voicebridge.dispatch.retry-on-timeout - whether a timed-out attempt is retried on the same
 *       provider (default: false; a timeout falls straight through to the next provider)</li>
 *   <li>voicebridge.dispatch.max-in-flight-per-session - concurrent dispatches per session
 *       (default: 2)</li>
 *   <li>voicebridge.dispatch.max-queued-per-session - segments waiting for an in-flight slot
 *       (default: 32)</li>
 *   <li>voicebridge.dispatch.attempt-log-size - attempts kept for inspection (default: 1000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicebridge.dispatch")
@Validated
public class DispatchProperties {

    @Positive(message = "Attempt timeout must be positive")
    private long attemptTimeoutMs = 5_000;

    @Min(1)
    @Max(5)
    private int attemptsPerProvider = 2;

    private boolean retryOnTimeout = false;

    @Positive
    private int maxInFlightPerSession = 2;

    @Positive
    private int maxQueuedPerSession = 32;

    @Positive
    private int attemptLogSize = 1_000;

    public long getAttemptTimeoutMs() {
        return attemptTimeoutMs;
    }

    public void setAttemptTimeoutMs(long attemptTimeoutMs) {
        this.attemptTimeoutMs = attemptTimeoutMs;
    }

    public int getAttemptsPerProvider() {
        return attemptsPerProvider;
    }

    public void setAttemptsPerProvider(int attemptsPerProvider) {
        this.attemptsPerProvider = attemptsPerProvider;
    }

    public boolean isRetryOnTimeout() {
        return retryOnTimeout;
    }

    public void setRetryOnTimeout(boolean retryOnTimeout) {
        this.retryOnTimeout = retryOnTimeout;
    }

    public int getMaxInFlightPerSession() {
        return maxInFlightPerSession;
    }

    public void setMaxInFlightPerSession(int maxInFlightPerSession) {
        this.maxInFlightPerSession = maxInFlightPerSession;
    }

    public int getMaxQueuedPerSession() {
        return maxQueuedPerSession;
    }

    public void setMaxQueuedPerSession(int maxQueuedPerSession) {
        this.maxQueuedPerSession = maxQueuedPerSession;
    }

    public int getAttemptLogSize() {
        return attemptLogSize;
    }

    public void setAttemptLogSize(int attemptLogSize) {
        this.attemptLogSize = attemptLogSize;
    }
}

package com.phillippitts.voicebridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the streaming pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Provider attempt latency and outcome per provider</li>
 *   <li>Exhausted segments and per-session dispatch rejections</li>
 *   <li>Reorder violations and dropped outbound messages</li>
 *   <li>Session admission and rate-limit denials</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class StreamingMetrics {

    private static final String METRIC_PREFIX = "voicebridge";

    private final MeterRegistry registry;

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one provider attempt.
     *
     * @param provider      provider name
     * @param outcome       attempt outcome (success, timeout, error)
     * @param durationNanos duration in nanoseconds
     */
    public void recordAttempt(String provider, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".provider.attempt")
                .description("Time taken by a single provider attempt")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementExhausted() {
        Counter.builder(METRIC_PREFIX + ".dispatch.exhausted")
                .description("Segments for which every provider failed")
                .register(registry)
                .increment();
    }

    public void incrementDispatchRejected() {
        Counter.builder(METRIC_PREFIX + ".dispatch.rejected")
                .description("Segments rejected because the session dispatch queue was full")
                .register(registry)
                .increment();
    }

    public void incrementLateResultDiscarded(String provider) {
        Counter.builder(METRIC_PREFIX + ".provider.late")
                .description("Provider results that arrived after their attempt was superseded")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * Counts a reorder violation.
     *
     * @param reason overflow or timeout
     */
    public void incrementReorderViolation(String reason) {
        Counter.builder(METRIC_PREFIX + ".reorder.violation")
                .description("Results delivered out of order after the reorder bound was hit")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementOutboundDropped() {
        Counter.builder(METRIC_PREFIX + ".outbound.dropped")
                .description("Outbound messages dropped because the session outbox was full")
                .register(registry)
                .increment();
    }

    /**
     * Counts a session admission decision.
     *
     * @param outcome accepted, or the limit that rejected the session
     */
    public void incrementSessionAdmission(String outcome) {
        Counter.builder(METRIC_PREFIX + ".session.admission")
                .description("Session open requests by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementQueueFallback() {
        Counter.builder(METRIC_PREFIX + ".queue.fallback")
                .description("Segments dispatched in-process because the queue was unavailable")
                .register(registry)
                .increment();
    }
}

package com.phillippitts.voicebridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingMetricsTest {

    private MeterRegistry registry;
    private StreamingMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StreamingMetrics(registry);
    }

    @Test
    void shouldRecordAttemptLatencyPerProviderAndOutcome() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(250);

        metrics.recordAttempt("openai-whisper", "success", durationNanos);
        metrics.recordAttempt("openai-whisper", "timeout", durationNanos);

        Timer success = registry.find("voicebridge.provider.attempt")
                .tag("provider", "openai-whisper")
                .tag("outcome", "success")
                .timer();
        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(1);
        assertThat(success.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
        assertThat(registry.find("voicebridge.provider.attempt").timers()).hasSize(2);
    }

    @Test
    void shouldCountAdmissionsByOutcome() {
        metrics.incrementSessionAdmission("accepted");
        metrics.incrementSessionAdmission("accepted");
        metrics.incrementSessionAdmission("rate");

        assertThat(registry.find("voicebridge.session.admission").tag("outcome", "accepted").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("voicebridge.session.admission").tag("outcome", "rate").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountLateResultsPerProvider() {
        metrics.incrementLateResultDiscarded("mock");

        Counter late = registry.find("voicebridge.provider.late").tag("provider", "mock").counter();
        assertThat(late).isNotNull();
        assertThat(late.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountPipelineFailures() {
        metrics.incrementExhausted();
        metrics.incrementDispatchRejected();
        metrics.incrementOutboundDropped();
        metrics.incrementQueueFallback();
        metrics.incrementReorderViolation("timeout");

        assertThat(registry.find("voicebridge.dispatch.exhausted").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("voicebridge.dispatch.rejected").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("voicebridge.outbound.dropped").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("voicebridge.queue.fallback").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("voicebridge.reorder.violation").tag("reason", "timeout").counter().count())
                .isEqualTo(1.0);
    }
}

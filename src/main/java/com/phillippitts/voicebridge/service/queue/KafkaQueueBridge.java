package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.config.properties.QueueProperties;
import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.QueueUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Kafka-backed {@link QueueBridge}.
 *
 * <p>Segments go to {@code voicebridge.queue.segments-topic} and results to
 * {@code voicebridge.queue.results-topic}, both keyed by session id so one session stays on one
 * partition. Sends are asynchronous; producer settings ({@code acks=all}, retries,
 * {@code max.block.ms}) come from {@code spring.kafka.producer.*}.
 *
 * <p><b>Degradation:</b> the first failed send moves the bridge to DEGRADED and logs the
 * capability downgrade once. While degraded, {@link #isAvailable()} lets one probe segment
 * through per {@code voicebridge.queue.retry-interval-ms}; a successful send reconnects.
 */
@Component
@ConditionalOnProperty(prefix = "voicebridge.queue", name = "enabled", havingValue = "true")
public class KafkaQueueBridge implements QueueBridge {

    private static final Logger LOG = LogManager.getLogger(KafkaQueueBridge.class);

    private final KafkaTemplate<String, String> template;
    private final QueueProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTED);
    private final AtomicReference<Instant> nextProbe = new AtomicReference<>(Instant.MIN);

    public KafkaQueueBridge(KafkaTemplate<String, String> template,
                            QueueProperties props,
                            ApplicationEventPublisher publisher,
                            Clock clock) {
        this.template = Objects.requireNonNull(template, "template");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.info("Kafka queue bridge enabled (segments={}, results={})",
                props.getSegmentsTopic(), props.getResultsTopic());
    }

    @Override
    public CompletableFuture<Void> publish(AudioSegment segment) {
        String topic = props.getSegmentsTopic();
        String attemptId = UUID.randomUUID().toString();
        CompletableFuture<Void> out = new CompletableFuture<>();
        try {
            template.send(topic, segment.sessionId(), QueueEnvelopeCodec.encodeSegment(segment, attemptId))
                    .whenComplete((sent, ex) -> {
                        if (ex == null) {
                            markConnected();
                            out.complete(null);
                        } else {
                            markDegraded(ex);
                            out.completeExceptionally(new QueueUnavailableException(topic, ex));
                        }
                    });
        } catch (RuntimeException e) {
            markDegraded(e);
            out.completeExceptionally(new QueueUnavailableException(topic, e));
        }
        return out;
    }

    @Override
    public void publishResult(TranscriptionResult result) {
        String topic = props.getResultsTopic();
        try {
            template.send(topic, result.sessionId(), QueueEnvelopeCodec.encodeResult(result))
                    .whenComplete((sent, ex) -> {
                        if (ex != null) {
                            LOG.warn("Failed to publish result {}:{} to {}: {}",
                                    result.sessionId(), result.sequence(), topic, ex.toString());
                        }
                    });
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish result {}:{} to {}: {}",
                    result.sessionId(), result.sequence(), topic, e.toString());
        }
    }

    @Override
    public boolean isAvailable() {
        if (state.get() != State.DEGRADED) {
            return true;
        }
        Instant now = clock.instant();
        Instant probeAt = nextProbe.get();
        if (now.isBefore(probeAt)) {
            return false;
        }
        // one caller wins the probe for this interval
        return nextProbe.compareAndSet(probeAt, now.plus(retryInterval()));
    }

    @Override
    public State state() {
        return state.get();
    }

    private void markDegraded(Throwable cause) {
        nextProbe.set(clock.instant().plus(retryInterval()));
        State previous = state.getAndSet(State.DEGRADED);
        if (previous != State.DEGRADED) {
            LOG.warn("Kafka unavailable ({}); degrading to in-process dispatch, retry in {} ms",
                    cause.toString(), props.getRetryIntervalMs());
            publisher.publishEvent(new QueueStateChangedEvent(previous, State.DEGRADED,
                    cause.toString(), clock.instant()));
        }
    }

    private void markConnected() {
        State previous = state.getAndSet(State.CONNECTED);
        if (previous == State.DEGRADED) {
            LOG.info("Kafka reachable again; resuming queued dispatch");
            publisher.publishEvent(new QueueStateChangedEvent(previous, State.CONNECTED,
                    "send succeeded", clock.instant()));
        }
    }

    private Duration retryInterval() {
        return Duration.ofMillis(props.getRetryIntervalMs());
    }
}

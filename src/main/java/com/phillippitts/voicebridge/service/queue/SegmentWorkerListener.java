package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.config.properties.QueueProperties;
import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.service.dispatch.ProviderDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Dispatch worker: consumes queued segments, runs the provider chain and publishes results.
 *
 * <p>All instances share {@code voicebridge.queue.worker-group}, so each segment is handled by
 * one worker. Redeliveries of the same publish are skipped.
 */
@Component
@ConditionalOnProperty(prefix = "voicebridge.queue", name = "enabled", havingValue = "true")
public class SegmentWorkerListener {

    private static final Logger LOG = LogManager.getLogger(SegmentWorkerListener.class);

    private final ProviderDispatcher dispatcher;
    private final QueueBridge bridge;
    private final DeliveryDeduplicator deduplicator;

    public SegmentWorkerListener(ProviderDispatcher dispatcher, QueueBridge bridge, QueueProperties props) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.deduplicator = new DeliveryDeduplicator(props.getDedupCapacity());
    }

    @KafkaListener(topics = "${voicebridge.queue.segments-topic}", groupId = "${voicebridge.queue.worker-group}")
    public void onSegment(String payload) {
        QueueEnvelopeCodec.SegmentEnvelope envelope;
        try {
            envelope = QueueEnvelopeCodec.decodeSegment(payload);
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping malformed segment envelope: {}", e.getMessage());
            return;
        }
        AudioSegment segment = envelope.segment();
        if (!deduplicator.firstDelivery(segment.sessionId(), segment.sequence(), envelope.attemptId())) {
            LOG.debug("Skipping redelivered segment {} (attempt {})", segment.segmentKey(), envelope.attemptId());
            return;
        }
        ThreadContext.put("sessionId", segment.sessionId());
        try {
            dispatcher.dispatchAsync(segment).whenComplete((result, ex) -> {
                if (result != null) {
                    bridge.publishResult(result);
                } else {
                    LOG.debug("Queued segment {} produced no result: {}", segment.segmentKey(), String.valueOf(ex));
                }
            });
        } finally {
            ThreadContext.remove("sessionId");
        }
    }
}

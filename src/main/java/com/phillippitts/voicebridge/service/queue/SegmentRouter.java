package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.service.dispatch.ProviderDispatcher;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

/**
 * Chooses where a segment is transcribed: through the {@link QueueBridge} when one is configured
 * and available, otherwise in-process via the {@link ProviderDispatcher}.
 *
 * <p>Segments whose publication fails fall back to in-process dispatch, so the queue never loses
 * a segment that was routed to it. Results of queued segments come back through the results
 * listener rather than the callback.
 */
@Component
public class SegmentRouter {

    private static final Logger LOG = LogManager.getLogger(SegmentRouter.class);

    private final ProviderDispatcher dispatcher;
    private final ObjectProvider<QueueBridge> queueBridge;
    private final StreamingMetrics metrics;

    public SegmentRouter(ProviderDispatcher dispatcher,
                         ObjectProvider<QueueBridge> queueBridge,
                         StreamingMetrics metrics) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.queueBridge = Objects.requireNonNull(queueBridge, "queueBridge");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Routes the segment; never blocks on transcription.
     *
     * @param segment  segment to transcribe
     * @param onResult receives the in-process result
     */
    public void route(AudioSegment segment, Consumer<TranscriptionResult> onResult) {
        QueueBridge bridge = queueBridge.getIfAvailable();
        if (bridge == null || !bridge.isAvailable()) {
            dispatchLocally(segment, onResult);
            return;
        }
        bridge.publish(segment).whenComplete((ok, ex) -> {
            if (ex != null) {
                LOG.debug("Queue publish failed for {}; dispatching in-process", segment.segmentKey());
                metrics.incrementQueueFallback();
                dispatchLocally(segment, onResult);
            }
        });
    }

    private void dispatchLocally(AudioSegment segment, Consumer<TranscriptionResult> onResult) {
        dispatcher.dispatchAsync(segment).whenComplete((result, ex) -> {
            if (result != null) {
                try {
                    onResult.accept(result);
                } catch (RuntimeException e) {
                    LOG.error("Result handling failed for {}", segment.segmentKey(), e);
                }
            } else if (ex instanceof CancellationException) {
                LOG.debug("Dispatch of {} cancelled", segment.segmentKey());
            } else {
                LOG.error("Dispatch of {} failed unexpectedly", segment.segmentKey(), ex);
            }
        });
    }
}

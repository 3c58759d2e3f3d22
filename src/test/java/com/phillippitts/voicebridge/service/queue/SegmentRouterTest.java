package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.QueueUnavailableException;
import com.phillippitts.voicebridge.service.dispatch.ProviderDispatcher;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SegmentRouterTest {

    private ProviderDispatcher dispatcher;
    private ObjectProvider<QueueBridge> bridgeProvider;
    private QueueBridge bridge;
    private SimpleMeterRegistry meters;
    private SegmentRouter router;
    private final List<TranscriptionResult> delivered = new ArrayList<>();

    private final AudioSegment segment = new AudioSegment("s1", 0, new byte[] {1}, Instant.now(), "pcm16", false);
    private final TranscriptionResult result = new TranscriptionResult("s1", 0, "hi", 0.9, true, "mock", 1,
            Instant.now(), null);

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        dispatcher = mock(ProviderDispatcher.class);
        bridgeProvider = mock(ObjectProvider.class);
        bridge = mock(QueueBridge.class);
        meters = new SimpleMeterRegistry();
        router = new SegmentRouter(dispatcher, bridgeProvider, new StreamingMetrics(meters));
        when(dispatcher.dispatchAsync(segment)).thenReturn(CompletableFuture.completedFuture(result));
    }

    @Test
    void withoutQueueSegmentsDispatchInProcess() {
        router.route(segment, delivered::add);

        assertThat(delivered).containsExactly(result);
    }

    @Test
    void availableQueueReceivesSegment() {
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);
        when(bridge.isAvailable()).thenReturn(true);
        when(bridge.publish(segment)).thenReturn(CompletableFuture.completedFuture(null));

        router.route(segment, delivered::add);

        verify(bridge).publish(segment);
        verify(dispatcher, never()).dispatchAsync(segment);
        assertThat(delivered).isEmpty();
    }

    @Test
    void failedPublishFallsBackToInProcessDispatch() {
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);
        when(bridge.isAvailable()).thenReturn(true);
        CompletableFuture<Void> failed = new CompletableFuture<>();
        failed.completeExceptionally(new QueueUnavailableException("audio.segments", null));
        when(bridge.publish(segment)).thenReturn(failed);

        router.route(segment, delivered::add);

        assertThat(delivered).containsExactly(result);
        assertThat(meters.find("voicebridge.queue.fallback").counter().count()).isEqualTo(1.0);
    }

    @Test
    void degradedQueueIsBypassed() {
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);
        when(bridge.isAvailable()).thenReturn(false);

        router.route(segment, delivered::add);

        verify(bridge, never()).publish(segment);
        assertThat(delivered).containsExactly(result);
    }

    @Test
    void cancelledDispatchDeliversNothing() {
        CompletableFuture<TranscriptionResult> cancelled = new CompletableFuture<>();
        cancelled.cancel(false);
        when(dispatcher.dispatchAsync(segment)).thenReturn(cancelled);

        router.route(segment, delivered::add);

        assertThat(delivered).isEmpty();
    }
}

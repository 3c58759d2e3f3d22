package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.config.ThreadPoolConfig;
import com.phillippitts.voicebridge.config.properties.AudioProperties;
import com.phillippitts.voicebridge.config.properties.DispatchProperties;
import com.phillippitts.voicebridge.config.properties.ProviderHealthProperties;
import com.phillippitts.voicebridge.config.properties.RateLimitProperties;
import com.phillippitts.voicebridge.config.properties.ReorderProperties;
import com.phillippitts.voicebridge.config.properties.SessionProperties;
import com.phillippitts.voicebridge.config.properties.ThreadPoolProperties;
import com.phillippitts.voicebridge.domain.SessionState;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.UnknownSessionException;
import com.phillippitts.voicebridge.service.broadcast.OutboundMessage;
import com.phillippitts.voicebridge.service.broadcast.ResultBroadcaster;
import com.phillippitts.voicebridge.service.dispatch.DefaultProviderDispatcher;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.provider.ProviderRegistry;
import com.phillippitts.voicebridge.service.provider.ProviderResponse;
import com.phillippitts.voicebridge.service.provider.TranscriptionProvider;
import com.phillippitts.voicebridge.service.provider.health.ProviderHealthMonitor;
import com.phillippitts.voicebridge.service.queue.QueueBridge;
import com.phillippitts.voicebridge.service.queue.SegmentRouter;
import com.phillippitts.voicebridge.service.ratelimit.RateLimiter;
import com.phillippitts.voicebridge.testutil.CapturingSink;
import com.phillippitts.voicebridge.testutil.EventCapturingPublisher;
import com.phillippitts.voicebridge.testutil.FakeTranscriptionProvider;
import com.phillippitts.voicebridge.testutil.MutableClock;
import com.phillippitts.voicebridge.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SessionManagerTest {

    /** One 250 ms window of 16 kHz mono 16-bit PCM. */
    private static final int WINDOW_BYTES = 8_000;

    private ExecutorService providerPool;
    private MutableClock clock;
    private SessionProperties sessionProps;
    private RateLimitProperties rateProps;
    private DispatchProperties dispatchProps;
    private SimpleMeterRegistry meters;
    private EventCapturingPublisher publisher;

    @BeforeEach
    void setUp() {
        providerPool = Executors.newCachedThreadPool();
        clock = new MutableClock();
        sessionProps = new SessionProperties();
        sessionProps.setDrainGrace(Duration.ofSeconds(2));
        rateProps = new RateLimitProperties();
        rateProps.setCapacity(100);
        dispatchProps = new DispatchProperties();
        meters = new SimpleMeterRegistry();
        publisher = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() {
        providerPool.shutdownNow();
    }

    @Test
    void openSessionStartsActiveAtSequenceZero() {
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));

        String id = manager.openSession("10.0.0.1", null, new CapturingSink());

        SessionSnapshot snapshot = manager.snapshot(id).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(snapshot.nextSequence()).isZero();
        assertThat(snapshot.formatHint()).isEqualTo("pcm16");
        assertThat(manager.activeSessionCount()).isEqualTo(1);
        assertThat(manager.sessionsForClient("10.0.0.1")).isEqualTo(1);
    }

    @Test
    void snapshotsListOpenSessionsOldestFirst() {
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        String first = manager.openSession("a", null, new CapturingSink());
        clock.advance(Duration.ofSeconds(1));
        String second = manager.openSession("b", "webm", new CapturingSink());
        clock.advance(Duration.ofSeconds(1));
        String third = manager.openSession("c", null, new CapturingSink());
        manager.closeSession(third);

        assertThat(manager.snapshots())
                .extracting(SessionSnapshot::sessionId)
                .containsExactly(first, second);
        assertThat(manager.snapshots().get(1).formatHint()).isEqualTo("webm");
    }

    @Test
    void globalCapRejectsWithoutSideEffects() {
        sessionProps.setMaxSessions(2);
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        manager.openSession("a", null, new CapturingSink());
        manager.openSession("b", null, new CapturingSink());

        assertThatThrownBy(() -> manager.openSession("c", null, new CapturingSink()))
                .isInstanceOf(CapacityExceededException.class)
                .extracting(e -> ((CapacityExceededException) e).getLimit())
                .isEqualTo(CapacityExceededException.Limit.GLOBAL_SESSIONS);

        assertThat(manager.sessionCount()).isEqualTo(2);
        assertThat(manager.sessionsForClient("c")).isZero();
        assertThat(meters.find("voicebridge.session.admission").tag("outcome", "global").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void perClientCapRejectsAndReleasesGlobalSlot() {
        sessionProps.setMaxSessions(2);
        sessionProps.setMaxSessionsPerClient(1);
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        manager.openSession("a", null, new CapturingSink());

        assertThatThrownBy(() -> manager.openSession("a", null, new CapturingSink()))
                .isInstanceOf(CapacityExceededException.class)
                .extracting(e -> ((CapacityExceededException) e).getLimit())
                .isEqualTo(CapacityExceededException.Limit.CLIENT_SESSIONS);

        // the rejected attempt must not hold a global slot
        String other = manager.openSession("b", null, new CapturingSink());
        assertThat(manager.find(other)).isPresent();
        assertThat(manager.sessionsForClient("a")).isEqualTo(1);
    }

    @Test
    void rateLimitedClientIsRejected() {
        rateProps.setCapacity(1);
        rateProps.setRefillPerSecond(0.1);
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        manager.openSession("a", null, new CapturingSink());

        assertThatThrownBy(() -> manager.openSession("a", null, new CapturingSink()))
                .isInstanceOf(CapacityExceededException.class)
                .extracting(e -> ((CapacityExceededException) e).getLimit())
                .isEqualTo(CapacityExceededException.Limit.RATE);
        assertThat(manager.sessionCount()).isEqualTo(1);
        assertThat(manager.sessionsForClient("a")).isEqualTo(1);
    }

    @Test
    void closingSessionFreesClientSlot() {
        sessionProps.setMaxSessionsPerClient(1);
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        String first = manager.openSession("a", null, new CapturingSink());

        assertThat(manager.closeSession(first)).isTrue();

        assertThat(manager.sessionsForClient("a")).isZero();
        assertThat(manager.openSession("a", null, new CapturingSink())).isNotEqualTo(first);
    }

    @Test
    void threeWindowsYieldThreeOrderedFinals() {
        ScriptedProvider provider = new ScriptedProvider("mock", List.of("a", "b", "c"));
        SessionManager manager = manager(new SyncExecutor(), provider);
        CapturingSink sink = new CapturingSink();
        String id = manager.openSession("client", "pcm16", sink);

        for (int i = 0; i < 3; i++) {
            assertThat(manager.ingest(id, new byte[WINDOW_BYTES])).isEqualTo(1);
        }

        List<OutboundMessage> finals = sink.messagesOfType(OutboundMessage.TYPE_TRANSCRIPTION);
        assertThat(finals).extracting(m -> m.get("text")).containsExactly("a", "b", "c");
        assertThat(finals).extracting(m -> m.get("isFinal")).containsOnly(true);
        assertThat(sink.transcriptionSequences()).containsExactly(0L, 1L, 2L);
    }

    @Test
    void slowEarlySegmentStillReachesClientFirst() {
        dispatchProps.setMaxInFlightPerSession(3);
        DelayByMarkerProvider provider = new DelayByMarkerProvider("mock");
        SessionManager manager = manager(providerPool, provider);
        CapturingSink sink = new CapturingSink();
        String id = manager.openSession("client", "pcm16", sink);

        manager.ingest(id, window((byte) 1));
        manager.ingest(id, window((byte) 2));
        manager.ingest(id, window((byte) 3));

        await().atMost(5, SECONDS).until(() -> sink.transcriptionSequences().size() == 3);
        assertThat(sink.messagesOfType(OutboundMessage.TYPE_TRANSCRIPTION))
                .extracting(m -> m.get("text"))
                .containsExactly("a", "b", "c");
        assertThat(provider.completionOrder).containsExactly("c", "b", "a");
    }

    @Test
    void closingSessionsDoNotHoldUpDeliveryToLiveSession() throws Exception {
        sessionProps.setDrainGrace(Duration.ofSeconds(5));
        ThreadPoolConfig pools = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor outbound = (ThreadPoolTaskExecutor) pools.outboundExecutor();
        ThreadPoolTaskExecutor close = (ThreadPoolTaskExecutor) pools.sessionCloseExecutor();
        try {
            SessionManager manager = manager(providerPool, outbound, close, new SlowMarkerProvider("mock"));
            // at least as many closing sessions as outbound threads
            int closing = outbound.getCorePoolSize();
            List<CapturingSink> closingSinks = new ArrayList<>();
            List<CompletableFuture<Boolean>> closes = new ArrayList<>();
            for (int i = 0; i < closing; i++) {
                CapturingSink sink = new CapturingSink();
                String id = manager.openSession("closing-" + i, "pcm16", sink);
                manager.ingest(id, window(SlowMarkerProvider.SLOW));
                closingSinks.add(sink);
                closes.add(manager.closeSessionAsync(id));
            }

            CapturingSink live = new CapturingSink();
            String liveId = manager.openSession("live", "pcm16", live);
            manager.ingest(liveId, window((byte) 0));

            await().atMost(Duration.ofMillis(1_500)).until(() -> live.transcriptionSequences().size() == 1);

            CompletableFuture.allOf(closes.toArray(new CompletableFuture<?>[0])).get(10, SECONDS);
            assertThat(closes).allSatisfy(f -> assertThat(f.join()).isTrue());
            assertThat(closingSinks).allSatisfy(sink -> {
                assertThat(sink.transcriptionSequences()).containsExactly(0L);
                assertThat(sink.closeCount()).isEqualTo(1);
            });
            assertThat(manager.find(liveId)).isPresent();
        } finally {
            outbound.shutdown();
            close.shutdown();
        }
    }

    @Test
    void partialAudioIsBufferedUntilWindowCompletes() {
        FakeTranscriptionProvider provider = new FakeTranscriptionProvider("mock", "hi");
        SessionManager manager = manager(new SyncExecutor(), provider);
        String id = manager.openSession("client", null, new CapturingSink());

        assertThat(manager.ingest(id, new byte[WINDOW_BYTES / 2])).isZero();
        assertThat(provider.calls.get()).isZero();
        assertThat(manager.ingest(id, new byte[WINDOW_BYTES / 2])).isEqualTo(1);
        assertThat(provider.calls.get()).isEqualTo(1);
        assertThat(manager.snapshot(id).orElseThrow().audioChunksReceived()).isEqualTo(2);
    }

    @Test
    void closeFlushesRemainderAsFinalChunkBeforeClosing() {
        FakeTranscriptionProvider provider = new FakeTranscriptionProvider("mock", "tail");
        SessionManager manager = manager(new SyncExecutor(), provider);
        CapturingSink sink = new CapturingSink();
        String id = manager.openSession("client", null, sink);
        manager.ingest(id, new byte[3_000]);

        assertThat(manager.closeSession(id)).isTrue();

        assertThat(sink.transcriptionSequences()).containsExactly(0L);
        assertThat(sink.isOpen()).isFalse();
        assertThat(sink.writesAfterClose()).isZero();
        assertThat(manager.find(id)).isEmpty();
    }

    @Test
    void closeCancelsSegmentsStillRunningAfterGrace() {
        sessionProps.setDrainGrace(Duration.ofMillis(200));
        dispatchProps.setAttemptTimeoutMs(30_000);
        FakeTranscriptionProvider provider = FakeTranscriptionProvider.slow("mock", "never", 10_000);
        SessionManager manager = manager(providerPool, provider);
        CapturingSink sink = new CapturingSink();
        String id = manager.openSession("client", null, sink);
        manager.ingest(id, new byte[WINDOW_BYTES]);

        long start = System.nanoTime();
        assertThat(manager.closeSession(id)).isTrue();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(sink.isOpen()).isFalse();
        assertThat(sink.transcriptionSequences()).isEmpty();
        assertThat(sink.writesAfterClose()).isZero();
    }

    @Test
    void ingestAfterCloseIsUnknownSession() {
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        String id = manager.openSession("client", null, new CapturingSink());
        manager.closeSession(id);

        assertThatThrownBy(() -> manager.ingest(id, new byte[10]))
                .isInstanceOf(UnknownSessionException.class);
    }

    @Test
    void secondCloseIsNoop() {
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        String id = manager.openSession("client", null, new CapturingSink());

        assertThat(manager.closeSession(id)).isTrue();
        assertThat(manager.closeSession(id)).isFalse();
        assertThat(manager.closeSession("no-such-session")).isFalse();
    }

    @Test
    void idleSessionsAreReaped() {
        sessionProps.setIdleTimeout(Duration.ofSeconds(30));
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        CapturingSink idleSink = new CapturingSink();
        String idle = manager.openSession("a", null, idleSink);
        clock.advance(Duration.ofSeconds(20));
        String busy = manager.openSession("b", null, new CapturingSink());
        manager.ingest(busy, new byte[100]);

        clock.advance(Duration.ofSeconds(15));
        int reaped = manager.reapIdleSessions();

        assertThat(reaped).isEqualTo(1);
        assertThat(manager.find(idle)).isEmpty();
        assertThat(idleSink.isOpen()).isFalse();
        assertThat(manager.find(busy)).isPresent();
    }

    @Test
    void resultForUnknownSessionIsDropped() {
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        CapturingSink sink = new CapturingSink();
        manager.openSession("client", null, sink);

        manager.onResult(new TranscriptionResult("ghost", 0, "boo", 0.9, true, "mock", 1, clock.instant(), null));

        assertThat(sink.messages()).isEmpty();
    }

    @Test
    void closeAllDrainsEverySession() {
        SessionManager manager = manager(new SyncExecutor(), new FakeTranscriptionProvider("mock", "hi"));
        CapturingSink first = new CapturingSink();
        CapturingSink second = new CapturingSink();
        manager.openSession("a", null, first);
        manager.openSession("b", null, second);

        manager.closeAll();

        assertThat(manager.sessionCount()).isZero();
        assertThat(first.isOpen()).isFalse();
        assertThat(second.isOpen()).isFalse();
    }

    private SessionManager manager(Executor dispatchExecutor, TranscriptionProvider... providers) {
        return manager(dispatchExecutor, new SyncExecutor(), new SyncExecutor(), providers);
    }

    private SessionManager manager(Executor dispatchExecutor, Executor outboundExecutor, Executor closeExecutor,
                                   TranscriptionProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry(List.of(providers));
        ProviderHealthMonitor monitor = new ProviderHealthMonitor(registry, new ProviderHealthProperties(),
                publisher, Clock.systemUTC());
        StreamingMetrics metrics = new StreamingMetrics(meters);
        DefaultProviderDispatcher dispatcher = new DefaultProviderDispatcher(registry, monitor, dispatchProps,
                publisher, metrics, dispatchExecutor, providerPool);
        SegmentRouter router = new SegmentRouter(dispatcher,
                new StaticListableBeanFactory().getBeanProvider(QueueBridge.class), metrics);
        ResultBroadcaster broadcaster = new ResultBroadcaster(new ReorderProperties(), outboundExecutor,
                publisher, metrics, clock);
        return new SessionManager(sessionProps, new AudioProperties(250), new RateLimiter(rateProps, clock),
                router, dispatcher, broadcaster, metrics, clock, closeExecutor);
    }

    private static byte[] window(byte marker) {
        byte[] bytes = new byte[WINDOW_BYTES];
        bytes[0] = marker;
        return bytes;
    }

    /** Answers with the next scripted text per call. */
    static class ScriptedProvider implements TranscriptionProvider {
        private final String name;
        private final ConcurrentLinkedQueue<String> script;

        ScriptedProvider(String name, List<String> texts) {
            this.name = name;
            this.script = new ConcurrentLinkedQueue<>(texts);
        }

        @Override public void initialize() { }

        @Override
        public ProviderResponse transcribe(byte[] audio, String formatHint) {
            String next = script.poll();
            return next == null ? ProviderResponse.empty() : new ProviderResponse(next, 0.9);
        }

        @Override public String getProviderName() { return name; }
        @Override public boolean isHealthy() { return true; }
        @Override public void close() { }
    }

    /** Answers after 2.5 s when the first byte is {@link #SLOW}, immediately otherwise. */
    static class SlowMarkerProvider implements TranscriptionProvider {
        static final byte SLOW = 9;
        private final String name;

        SlowMarkerProvider(String name) {
            this.name = name;
        }

        @Override public void initialize() { }

        @Override
        public ProviderResponse transcribe(byte[] audio, String formatHint) {
            if (audio[0] == SLOW) {
                try {
                    Thread.sleep(2_500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new ProviderResponse("marker " + audio[0], 0.9);
        }

        @Override public String getProviderName() { return name; }
        @Override public boolean isHealthy() { return true; }
        @Override public void close() { }
    }

    /** Reads a marker from the first byte; earlier markers answer slower. */
    static class DelayByMarkerProvider implements TranscriptionProvider {
        private final String name;
        final ConcurrentLinkedQueue<String> completionOrder = new ConcurrentLinkedQueue<>();

        DelayByMarkerProvider(String name) {
            this.name = name;
        }

        @Override public void initialize() { }

        @Override
        public ProviderResponse transcribe(byte[] audio, String formatHint) {
            int marker = audio[0];
            try {
                Thread.sleep((3 - marker) * 300L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            String text = String.valueOf((char) ('a' + marker - 1));
            completionOrder.add(text);
            return new ProviderResponse(text, 0.9);
        }

        @Override public String getProviderName() { return name; }
        @Override public boolean isHealthy() { return true; }
        @Override public void close() { }
    }
}

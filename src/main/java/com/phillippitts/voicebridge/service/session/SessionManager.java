package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.config.properties.AudioProperties;
import com.phillippitts.voicebridge.config.properties.SessionProperties;
import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.SessionState;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.CapacityExceededException;
import com.phillippitts.voicebridge.exception.UnknownSessionException;
import com.phillippitts.voicebridge.service.audio.AudioChunkAssembler;
import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.broadcast.OutboundSink;
import com.phillippitts.voicebridge.service.broadcast.ResultBroadcaster;
import com.phillippitts.voicebridge.service.dispatch.ProviderDispatcher;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.queue.SegmentRouter;
import com.phillippitts.voicebridge.service.ratelimit.RateLimiter;
import com.phillippitts.voicebridge.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every streaming session: admission, audio ingestion, result hand-off and shutdown.
 *
 * <p><b>Admission:</b> a session is opened only if the client passes the rate limiter and both
 * the global and the per-client session caps have room. Slots are reserved atomically, so a
 * rejected open leaves no trace.
 *
 * <p><b>Ingestion:</b> {@link #ingest(String, byte[])} feeds the session's assembler and routes
 * each completed segment. It returns as soon as segments are routed; transcription runs
 * elsewhere.
 *
 * <p><b>Close:</b> {@link #closeSession(String)} drains the session. The assembler remainder is
 * flushed as a final chunk, in-flight segments get up to {@code voicebridge.session.drain-grace}
 * to finish, the rest is cancelled, and the session becomes CLOSED. Results arriving after that
 * are discarded.
 */
@Service
public class SessionManager {

    private static final Logger LOG = LogManager.getLogger(SessionManager.class);

    private final SessionProperties props;
    private final AudioProperties audioProperties;
    private final RateLimiter rateLimiter;
    private final SegmentRouter router;
    private final ProviderDispatcher dispatcher;
    private final ResultBroadcaster broadcaster;
    private final StreamingMetrics metrics;
    private final Clock clock;
    private final Executor closeExecutor;

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Integer> sessionsPerClient = new ConcurrentHashMap<>();
    private final AtomicInteger reservedSlots = new AtomicInteger();

    public SessionManager(SessionProperties props,
                          AudioProperties audioProperties,
                          RateLimiter rateLimiter,
                          SegmentRouter router,
                          ProviderDispatcher dispatcher,
                          ResultBroadcaster broadcaster,
                          StreamingMetrics metrics,
                          Clock clock,
                          @Qualifier("sessionCloseExecutor") Executor closeExecutor) {
        this.props = Objects.requireNonNull(props, "props");
        this.audioProperties = Objects.requireNonNull(audioProperties, "audioProperties");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.router = Objects.requireNonNull(router, "router");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.closeExecutor = Objects.requireNonNull(closeExecutor, "closeExecutor");
    }

    /**
     * Opens a session for the client.
     *
     * @param clientKey  rate-limit and per-client cap key
     * @param formatHint announced audio format, or null for the configured default
     * @param sink       connection the session's results are written to
     * @return new session id
     * @throws CapacityExceededException if the client is rate limited or a session cap is reached
     */
    public String openSession(String clientKey, String formatHint, OutboundSink sink) {
        Objects.requireNonNull(clientKey, "clientKey");
        Objects.requireNonNull(sink, "sink");

        if (!rateLimiter.allow(clientKey)) {
            metrics.incrementSessionAdmission("rate");
            throw new CapacityExceededException(clientKey, CapacityExceededException.Limit.RATE,
                    "Too many connection attempts");
        }
        if (reservedSlots.incrementAndGet() > props.getMaxSessions()) {
            reservedSlots.decrementAndGet();
            metrics.incrementSessionAdmission("global");
            throw new CapacityExceededException(clientKey, CapacityExceededException.Limit.GLOBAL_SESSIONS,
                    "Server session limit reached (" + props.getMaxSessions() + ")");
        }
        if (!reserveClientSlot(clientKey)) {
            reservedSlots.decrementAndGet();
            metrics.incrementSessionAdmission("client");
            throw new CapacityExceededException(clientKey, CapacityExceededException.Limit.CLIENT_SESSIONS,
                    "Client session limit reached (" + props.getMaxSessionsPerClient() + ")");
        }

        String sessionId = UUID.randomUUID().toString();
        String format = AudioFormat.normalize(formatHint, audioProperties.getDefaultFormat());
        try {
            Session session = new Session(sessionId, clientKey, format, clock.instant(),
                    (id, hint, sequenceSource) -> AudioChunkAssembler.create(id, hint, audioProperties,
                            sequenceSource, clock));
            broadcaster.register(sessionId, sink);
            sessions.put(sessionId, session);
        } catch (RuntimeException e) {
            releaseSlots(clientKey);
            throw e;
        }
        metrics.incrementSessionAdmission("accepted");
        LOG.info("Session {} opened for client {} (format={}, active={})",
                sessionId, LogSanitizer.maskKey(clientKey), format, sessions.size());
        return sessionId;
    }

    /**
     * Feeds audio bytes to the session and routes every completed segment.
     *
     * @return number of segments routed
     * @throws UnknownSessionException if the session is not ACTIVE
     * @throws CapacityExceededException if ingest throttling is on and the session exceeded it
     */
    public int ingest(String sessionId, byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        Session session = sessions.get(sessionId);
        if (session == null || !session.isActive()) {
            throw new UnknownSessionException(sessionId);
        }
        if (!rateLimiter.allowIngest(sessionId)) {
            throw new CapacityExceededException(session.clientKey(), CapacityExceededException.Limit.RATE,
                    "Audio rate limit exceeded");
        }
        session.recordChunk(clock.instant());

        List<AudioSegment> segments;
        try {
            segments = session.assembler().feed(bytes);
        } catch (IllegalStateException e) {
            // assembler was flushed by a concurrent close
            throw new UnknownSessionException(sessionId, "session is closing");
        }
        for (AudioSegment segment : segments) {
            route(session, segment);
        }
        return segments.size();
    }

    /**
     * Hands a result to the broadcaster. Results for unknown or closed sessions are dropped.
     */
    public void onResult(TranscriptionResult result) {
        Session session = sessions.get(result.sessionId());
        if (session == null || session.state() == SessionState.CLOSED) {
            LOG.debug("Discarding result seq={} for closed session {}", result.sequence(), result.sessionId());
            return;
        }
        broadcaster.deliver(result);
        if (result.isFinal()) {
            session.resolve(result.sequence());
        }
    }

    /**
     * Drains and closes the session. Repeated or concurrent calls return false without effect.
     *
     * @return true if this call closed the session
     */
    public boolean closeSession(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null || !session.stateMachine().beginDrain()) {
            return false;
        }
        ThreadContext.put("sessionId", sessionId);
        try {
            LOG.info("Draining session {} ({} segment(s) in flight)", sessionId, session.pendingCount());
            session.assembler().flush().ifPresent(segment -> route(session, segment));

            if (!session.awaitDrained(props.getDrainGrace())) {
                LOG.warn("Session {} not drained within {} ms; cancelling {} segment(s)",
                        sessionId, props.getDrainGrace().toMillis(), session.pendingCount());
            }
            dispatcher.cancelSession(sessionId);
            session.stateMachine().markClosed();
            broadcaster.closeSession(sessionId, props.getDrainGrace());
            LOG.info("Session {} closed (chunks={}, segments={})",
                    sessionId, session.audioChunksReceived(), session.nextSequence());
            return true;
        } finally {
            sessions.remove(sessionId, session);
            releaseSlots(session.clientKey());
            ThreadContext.remove("sessionId");
        }
    }

    /**
     * Closes the session on the session-close executor, leaving the calling thread free.
     */
    public CompletableFuture<Boolean> closeSessionAsync(String sessionId) {
        return CompletableFuture.supplyAsync(() -> closeSession(sessionId), closeExecutor);
    }

    /**
     * Closes ACTIVE sessions that received no audio and have no pending segments for longer than
     * {@code voicebridge.session.idle-timeout}.
     *
     * @return number of sessions scheduled for close
     */
    @Scheduled(fixedDelayString = "${voicebridge.session.reap-interval-ms:10000}")
    public int reapIdleSessions() {
        Instant cutoff = clock.instant().minus(props.getIdleTimeout());
        int reaped = 0;
        for (Session session : sessions.values()) {
            if (session.isActive() && session.lastActivity().isBefore(cutoff) && !session.hasPending()) {
                LOG.info("Reaping idle session {} (last activity {})", session.id(), session.lastActivity());
                closeSessionAsync(session.id());
                reaped++;
            }
        }
        return reaped;
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        return find(sessionId).map(this::snapshotOf);
    }

    /**
     * Snapshots of every open or draining session, oldest first.
     */
    public List<SessionSnapshot> snapshots() {
        return sessions.values().stream()
                .map(this::snapshotOf)
                .sorted(Comparator.comparing(SessionSnapshot::createdAt))
                .toList();
    }

    private SessionSnapshot snapshotOf(Session s) {
        return new SessionSnapshot(s.id(), s.state(), s.formatHint(), s.createdAt(), s.lastActivity(),
                s.audioChunksReceived(), broadcaster.sentCount(s.id()), s.nextSequence(), s.pendingCount());
    }

    public int activeSessionCount() {
        return (int) sessions.values().stream().filter(Session::isActive).count();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public int sessionsForClient(String clientKey) {
        return sessionsPerClient.getOrDefault(clientKey, 0);
    }

    /**
     * Drains every open session on shutdown.
     */
    @PreDestroy
    public void closeAll() {
        List<String> ids = new ArrayList<>(sessions.keySet());
        if (!ids.isEmpty()) {
            LOG.info("Closing {} session(s) on shutdown", ids.size());
        }
        ids.forEach(this::closeSession);
    }

    private void route(Session session, AudioSegment segment) {
        session.registerPending(segment.sequence());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Routing segment {} ({} bytes, final={}, format={})", segment.segmentKey(),
                    segment.size(), segment.finalChunk(), segment.formatHint());
        }
        router.route(segment, this::onResult);
    }

    private boolean reserveClientSlot(String clientKey) {
        boolean[] reserved = new boolean[1];
        sessionsPerClient.compute(clientKey, (k, count) -> {
            int current = count == null ? 0 : count;
            if (current >= props.getMaxSessionsPerClient()) {
                return count;
            }
            reserved[0] = true;
            return current + 1;
        });
        return reserved[0];
    }

    private void releaseSlots(String clientKey) {
        reservedSlots.decrementAndGet();
        sessionsPerClient.computeIfPresent(clientKey, (k, count) -> count <= 1 ? null : count - 1);
    }
}

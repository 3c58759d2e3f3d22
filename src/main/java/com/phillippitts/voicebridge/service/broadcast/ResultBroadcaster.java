package com.phillippitts.voicebridge.service.broadcast;

import com.phillippitts.voicebridge.config.properties.ReorderProperties;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Delivers transcription results to session clients in sequence order.
 *
 * <p>Per session the broadcaster keeps the next expected sequence and a bounded reorder buffer:
 * <ul>
 *   <li>the expected final result is emitted at once, followed by any contiguous buffered ones</li>
 *   <li>an early final result is buffered</li>
 *   <li>when the buffer overflows, or a gap persists past {@code voicebridge.reorder.max-wait-ms},
 *       buffered results are released out of order and a {@link ReorderViolationEvent} is
 *       published</li>
 * </ul>
 *
 * <p>Interim results are emitted immediately and never move the expectation. A final result
 * below the expectation is a duplicate and dropped, unless its sequence was skipped by an earlier
 * forced flush. Results for sessions without a channel are discarded.
 *
 * <p>Successful results with empty text (silence) advance the expectation without reaching the
 * client.
 */
@Service
public class ResultBroadcaster {

    private static final Logger LOG = LogManager.getLogger(ResultBroadcaster.class);

    /** Skipped sequences remembered per session for late delivery. */
    private static final int MAX_SKIPPED = 64;

    private final ReorderProperties props;
    private final Executor outboundExecutor;
    private final ApplicationEventPublisher publisher;
    private final StreamingMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<String, SessionChannel> channels = new ConcurrentHashMap<>();

    public ResultBroadcaster(ReorderProperties props,
                             @Qualifier("outboundExecutor") Executor outboundExecutor,
                             ApplicationEventPublisher publisher,
                             StreamingMetrics metrics,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.outboundExecutor = Objects.requireNonNull(outboundExecutor, "outboundExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Opens the outbound channel of a session. Expectation starts at sequence 0.
     */
    public void register(String sessionId, OutboundSink sink) {
        SessionOutbox outbox = new SessionOutbox(sessionId, sink, outboundExecutor, props.getOutboxCapacity());
        SessionChannel previous = channels.putIfAbsent(sessionId, new SessionChannel(sessionId, outbox));
        if (previous != null) {
            throw new IllegalStateException("Session already registered: " + sessionId);
        }
    }

    public boolean isRegistered(String sessionId) {
        return channels.containsKey(sessionId);
    }

    /**
     * Routes a result through the session's reorder buffer.
     */
    public void deliver(TranscriptionResult result) {
        Objects.requireNonNull(result, "result");
        SessionChannel ch = channels.get(result.sessionId());
        if (ch == null) {
            LOG.debug("Discarding result seq={} for unknown session {}", result.sequence(), result.sessionId());
            return;
        }
        ReorderViolationEvent violation;
        synchronized (ch) {
            violation = accept(ch, result);
        }
        if (violation != null) {
            reportViolation(violation);
        }
    }

    /**
     * Sends a control message (pong, status, error) outside the ordering path.
     *
     * @return false if the session has no open channel or its outbox is full
     */
    public boolean send(String sessionId, OutboundMessage message) {
        SessionChannel ch = channels.get(sessionId);
        if (ch == null) {
            return false;
        }
        boolean accepted = ch.outbox.offer(message);
        if (!accepted) {
            metrics.incrementOutboundDropped();
        }
        return accepted;
    }

    /**
     * Number of transcription and failure messages handed to the session's outbox.
     */
    public long sentCount(String sessionId) {
        SessionChannel ch = channels.get(sessionId);
        return ch == null ? 0 : ch.sent;
    }

    /**
     * Next sequence the session is waiting for, or -1 for unknown sessions.
     */
    public long expectedSequence(String sessionId) {
        SessionChannel ch = channels.get(sessionId);
        if (ch == null) {
            return -1;
        }
        synchronized (ch) {
            return ch.expected;
        }
    }

    /**
     * Releases the session's channel. Buffered results are emitted in sequence order, then the
     * outbox drains for up to {@code grace} and the sink is closed. Later results are discarded.
     */
    public void closeSession(String sessionId, Duration grace) {
        SessionChannel ch = channels.remove(sessionId);
        if (ch == null) {
            return;
        }
        synchronized (ch) {
            if (!ch.buffer.isEmpty()) {
                LOG.debug("Releasing {} buffered result(s) on close of session {}", ch.buffer.size(), sessionId);
                ch.buffer.values().forEach(r -> emit(ch, r));
                ch.buffer.clear();
            }
            ch.gapSince = null;
        }
        ch.outbox.closeGracefully(grace);
        LOG.debug("Outbound channel closed for session {} ({} result(s) sent)", sessionId, ch.sent);
    }

    /**
     * Releases buffers whose gap has been open longer than the reorder wait.
     */
    @Scheduled(fixedDelayString = "${voicebridge.reorder.sweep-interval-ms:250}")
    public void flushExpiredGaps() {
        Instant now = clock.instant();
        Duration maxWait = Duration.ofMillis(props.getMaxWaitMs());
        for (SessionChannel ch : channels.values()) {
            ReorderViolationEvent violation = null;
            synchronized (ch) {
                if (ch.gapSince != null && !now.isBefore(ch.gapSince.plus(maxWait))) {
                    violation = forceFlush(ch, ReorderViolationEvent.Reason.TIMEOUT);
                }
            }
            if (violation != null) {
                reportViolation(violation);
            }
        }
    }

    int activeChannels() {
        return channels.size();
    }

    private ReorderViolationEvent accept(SessionChannel ch, TranscriptionResult result) {
        long seq = result.sequence();
        if (!result.isFinal()) {
            if (seq >= ch.expected) {
                emit(ch, result);
            }
            return null;
        }

        if (seq < ch.expected) {
            if (ch.skipped.remove(seq)) {
                LOG.info("Late result seq={} for session {} emitted after reorder flush", seq, ch.sessionId);
                emit(ch, result);
            } else {
                LOG.debug("Dropping stale result seq={} for session {}", seq, ch.sessionId);
            }
            return null;
        }

        if (seq == ch.expected) {
            emit(ch, result);
            ch.expected++;
            drainContiguous(ch);
            ch.gapSince = ch.buffer.isEmpty() ? null : clock.instant();
            return null;
        }

        if (ch.buffer.putIfAbsent(seq, result) != null) {
            LOG.debug("Dropping duplicate buffered result seq={} for session {}", seq, ch.sessionId);
            return null;
        }
        if (ch.gapSince == null) {
            ch.gapSince = clock.instant();
        }
        if (ch.buffer.size() > props.getCapacity()) {
            return forceFlush(ch, ReorderViolationEvent.Reason.OVERFLOW);
        }
        return null;
    }

    private void drainContiguous(SessionChannel ch) {
        while (!ch.buffer.isEmpty() && ch.buffer.firstKey() == ch.expected) {
            emit(ch, ch.buffer.pollFirstEntry().getValue());
            ch.expected++;
        }
    }

    private ReorderViolationEvent forceFlush(SessionChannel ch, ReorderViolationEvent.Reason reason) {
        if (ch.buffer.isEmpty()) {
            ch.gapSince = null;
            return null;
        }
        long missing = ch.expected;
        long last = ch.buffer.lastKey();
        List<Long> skipped = new ArrayList<>();
        for (long s = ch.expected; s < last; s++) {
            if (!ch.buffer.containsKey(s)) {
                skipped.add(s);
                ch.skipped.add(s);
            }
        }
        while (ch.skipped.size() > MAX_SKIPPED) {
            ch.skipped.pollFirst();
        }
        ch.buffer.values().forEach(r -> emit(ch, r));
        ch.buffer.clear();
        ch.expected = last + 1;
        ch.gapSince = null;
        return new ReorderViolationEvent(ch.sessionId, missing, last, skipped, reason, clock.instant());
    }

    private void emit(SessionChannel ch, TranscriptionResult result) {
        if (!result.isFailure() && result.text().isBlank()) {
            LOG.debug("Skipping empty result seq={} for session {}", result.sequence(), ch.sessionId);
            return;
        }
        OutboundMessage message = result.isFailure()
                ? OutboundMessage.failure(result)
                : OutboundMessage.transcription(result);
        if (ch.outbox.offer(message)) {
            ch.sent++;
            if (LOG.isDebugEnabled()) {
                LOG.debug("Emitted seq={} final={} to session {}: {}", result.sequence(), result.isFinal(),
                        ch.sessionId, LogSanitizer.truncate(result.text(), 40));
            }
        } else {
            metrics.incrementOutboundDropped();
        }
    }

    private void reportViolation(ReorderViolationEvent violation) {
        LOG.warn("Reorder violation ({}) in session {}: released through seq={} while waiting for seq={}, skipped={}",
                violation.reason(), violation.sessionId(), violation.releasedThrough(),
                violation.expectedSequence(), violation.skipped());
        metrics.incrementReorderViolation(violation.reason().name().toLowerCase(Locale.ROOT));
        publisher.publishEvent(violation);
    }

    /** Ordering state of one session. Guarded by its own monitor. */
    private static final class SessionChannel {
        private final String sessionId;
        private final SessionOutbox outbox;
        private final TreeMap<Long, TranscriptionResult> buffer = new TreeMap<>();
        private final TreeSet<Long> skipped = new TreeSet<>();
        private long expected;
        private Instant gapSince;
        private volatile long sent;

        private SessionChannel(String sessionId, SessionOutbox outbox) {
            this.sessionId = sessionId;
            this.outbox = outbox;
        }
    }
}

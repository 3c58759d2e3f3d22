package com.phillippitts.voicebridge.service.broadcast;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded per-session queue of outbound messages, drained serially onto the sink.
 *
 * <p>At most one drain task runs per outbox, so messages reach the sink in offer order. After
 * {@link #closeGracefully(Duration)} returns, the sink is never written again.
 */
final class SessionOutbox {

    private static final Logger LOG = LogManager.getLogger(SessionOutbox.class);

    private final String sessionId;
    private final OutboundSink sink;
    private final Executor executor;
    private final int capacity;

    private final Object lock = new Object();
    private final Deque<OutboundMessage> queue = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    private final ReentrantLock sendLock = new ReentrantLock();
    private boolean sinkReleased;

    SessionOutbox(String sessionId, OutboundSink sink, Executor executor, int capacity) {
        this.sessionId = sessionId;
        this.sink = sink;
        this.executor = executor;
        this.capacity = capacity;
    }

    /**
     * Enqueues a message.
     *
     * @return false if the outbox is closed or full
     */
    boolean offer(OutboundMessage message) {
        boolean startDrain;
        synchronized (lock) {
            if (closed) {
                return false;
            }
            if (queue.size() >= capacity) {
                LOG.warn("Outbox full for session {}; dropping {} message", sessionId, message.type());
                return false;
            }
            queue.addLast(message);
            startDrain = !draining;
            draining = true;
        }
        if (startDrain) {
            executor.execute(this::drain);
        }
        return true;
    }

    int pending() {
        synchronized (lock) {
            return queue.size();
        }
    }

    private void drain() {
        while (true) {
            OutboundMessage next;
            synchronized (lock) {
                next = queue.pollFirst();
                if (next == null) {
                    draining = false;
                    lock.notifyAll();
                    return;
                }
            }
            write(next);
        }
    }

    private void write(OutboundMessage message) {
        sendLock.lock();
        try {
            if (sinkReleased || !sink.isOpen()) {
                return;
            }
            sink.send(message);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to send {} message to session {}: {}", message.type(), sessionId, e.toString());
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Stops accepting messages, waits up to {@code grace} for queued ones to be written, then
     * closes the sink. Messages still queued after the grace period are dropped.
     */
    void closeGracefully(Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        synchronized (lock) {
            closed = true;
            while (draining || !queue.isEmpty()) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0) {
                    LOG.warn("Outbox for session {} not drained within {} ms; dropping {} message(s)",
                            sessionId, grace.toMillis(), queue.size());
                    queue.clear();
                    break;
                }
                try {
                    lock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    queue.clear();
                    break;
                }
            }
        }
        sendLock.lock();
        try {
            sinkReleased = true;
            sink.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing sink for session {}: {}", sessionId, e.toString());
        } finally {
            sendLock.unlock();
        }
    }
}

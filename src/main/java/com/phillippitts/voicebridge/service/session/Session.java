package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.domain.SessionState;
import com.phillippitts.voicebridge.service.audio.AudioChunkAssembler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * One client audio stream. Owned by {@link SessionManager}; other components refer to it by id.
 *
 * <p>Holds the sequence counter (starting at 0, never reused), the chunk assembler, lifecycle
 * state and the set of segment sequences still waiting for a final result.
 */
public final class Session {

    private final String id;
    private final String clientKey;
    private final String formatHint;
    private final Instant createdAt;
    private final AtomicLong sequence = new AtomicLong();
    private final SessionStateMachine stateMachine = new SessionStateMachine();
    private final AudioChunkAssembler assembler;

    private final AtomicLong audioChunksReceived = new AtomicLong();
    private volatile Instant lastActivity;

    private final ReentrantLock pendingLock = new ReentrantLock();
    private final Condition drained = pendingLock.newCondition();
    private final Set<Long> pending = new TreeSet<>();

    Session(String id, String clientKey, String formatHint, Instant createdAt,
            AssemblerFactory assemblerFactory) {
        this.id = Objects.requireNonNull(id, "id");
        this.clientKey = Objects.requireNonNull(clientKey, "clientKey");
        this.formatHint = Objects.requireNonNull(formatHint, "formatHint");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = createdAt;
        this.assembler = assemblerFactory.create(id, formatHint, sequence::getAndIncrement);
    }

    /** Builds the session's assembler around its sequence counter. */
    @FunctionalInterface
    interface AssemblerFactory {
        AudioChunkAssembler create(String sessionId, String formatHint, LongSupplier sequenceSource);
    }

    public String id() {
        return id;
    }

    public String clientKey() {
        return clientKey;
    }

    public String formatHint() {
        return formatHint;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public SessionState state() {
        return stateMachine.current();
    }

    public boolean isActive() {
        return stateMachine.isActive();
    }

    /** Next sequence number the assembler will assign. */
    public long nextSequence() {
        return sequence.get();
    }

    public long audioChunksReceived() {
        return audioChunksReceived.get();
    }

    AudioChunkAssembler assembler() {
        return assembler;
    }

    SessionStateMachine stateMachine() {
        return stateMachine;
    }

    void recordChunk(Instant at) {
        audioChunksReceived.incrementAndGet();
        lastActivity = at;
    }

    void registerPending(long seq) {
        pendingLock.lock();
        try {
            pending.add(seq);
        } finally {
            pendingLock.unlock();
        }
    }

    void resolve(long seq) {
        pendingLock.lock();
        try {
            if (pending.remove(seq) && pending.isEmpty()) {
                drained.signalAll();
            }
        } finally {
            pendingLock.unlock();
        }
    }

    int pendingCount() {
        pendingLock.lock();
        try {
            return pending.size();
        } finally {
            pendingLock.unlock();
        }
    }

    boolean hasPending() {
        return pendingCount() > 0;
    }

    /**
     * Waits until every registered segment has a final result.
     *
     * @return true if drained within the timeout
     */
    boolean awaitDrained(Duration timeout) {
        long remaining = timeout.toNanos();
        pendingLock.lock();
        try {
            while (!pending.isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = drained.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            pendingLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", state=" + state() + ", nextSequence=" + sequence.get() + '}';
    }
}

package com.phillippitts.voicebridge.service.dispatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Per-session admission state: in-flight permits plus a bounded wait queue.
 *
 * <p>{@link #admit} and {@link #release} are only called inside
 * {@code ConcurrentHashMap.compute} for the session key, which serializes them per session.
 * Running attempts are tracked in a concurrent set because the chain threads add and remove
 * them outside that critical section.
 */
final class SessionGate {

    enum Admission { START, QUEUED, REJECTED }

    private final int maxInFlight;
    private final int maxQueued;
    private final Deque<PendingDispatch> waiting = new ArrayDeque<>();
    private final Set<Future<?>> running = ConcurrentHashMap.newKeySet();
    private int inFlight;
    private volatile boolean cancelled;

    SessionGate(int maxInFlight, int maxQueued) {
        this.maxInFlight = maxInFlight;
        this.maxQueued = maxQueued;
    }

    Admission admit(PendingDispatch pending) {
        if (inFlight < maxInFlight) {
            inFlight++;
            return Admission.START;
        }
        if (waiting.size() < maxQueued) {
            waiting.addLast(pending);
            return Admission.QUEUED;
        }
        return Admission.REJECTED;
    }

    /**
     * Frees the permit of a finished chain. The permit passes directly to the next waiting
     * segment when there is one.
     *
     * @return next segment to start, or null
     */
    PendingDispatch release() {
        PendingDispatch next = waiting.pollFirst();
        if (next == null) {
            inFlight--;
        }
        return next;
    }

    boolean isIdle() {
        return inFlight == 0 && waiting.isEmpty();
    }

    boolean isCancelled() {
        return cancelled;
    }

    void track(Future<?> attempt) {
        running.add(attempt);
        if (cancelled) {
            attempt.cancel(true);
        }
    }

    void untrack(Future<?> attempt) {
        running.remove(attempt);
    }

    /**
     * Marks the gate cancelled, interrupts running attempts and hands back queued segments.
     * Called after the gate was removed from the map, so no admission can race with it.
     */
    List<PendingDispatch> cancel() {
        cancelled = true;
        running.forEach(f -> f.cancel(true));
        List<PendingDispatch> dropped = new ArrayList<>(waiting);
        waiting.clear();
        return dropped;
    }
}

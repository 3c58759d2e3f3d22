package com.phillippitts.voicebridge.service.dispatch;

import com.phillippitts.voicebridge.domain.ProviderAttempt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory history of provider attempts. Oldest entries are evicted first.
 */
final class AttemptLog {

    private final int capacity;
    private final Deque<ProviderAttempt> entries;

    AttemptLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    synchronized void record(ProviderAttempt attempt) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(attempt);
    }

    synchronized List<ProviderAttempt> attemptsFor(String segmentKey) {
        List<ProviderAttempt> out = new ArrayList<>();
        for (ProviderAttempt a : entries) {
            if (a.segmentKey().equals(segmentKey)) {
                out.add(a);
            }
        }
        return out;
    }

    synchronized int size() {
        return entries.size();
    }
}

package com.phillippitts.voicebridge.service.queue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded LRU of delivery keys (session id, sequence, attempt id) seen by a queue consumer.
 */
final class DeliveryDeduplicator {

    private final Map<String, Boolean> seen;

    DeliveryDeduplicator(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.seen = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * @return true the first time the key is seen, false for redeliveries
     */
    synchronized boolean firstDelivery(String sessionId, long sequence, String attemptId) {
        return seen.put(sessionId + ':' + sequence + ':' + attemptId, Boolean.TRUE) == null;
    }

    synchronized int size() {
        return seen.size();
    }
}

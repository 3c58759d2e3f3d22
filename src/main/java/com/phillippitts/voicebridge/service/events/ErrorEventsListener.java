package com.phillippitts.voicebridge.service.events;

import com.phillippitts.voicebridge.service.broadcast.ReorderViolationEvent;
import com.phillippitts.voicebridge.service.provider.health.ProviderFailureEvent;
import com.phillippitts.voicebridge.service.queue.QueueBridge;
import com.phillippitts.voicebridge.service.queue.QueueStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized operator-facing summary of pipeline error events. Privacy-safe and throttled to
 * avoid log spam; per-occurrence detail is logged at the source.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        String key = "provider-" + e.provider() + '-' + e.outcome();
        if (shouldLog(key)) {
            LOG.warn("Provider {} failing ({}): {}. Check endpoint, API key and network.",
                    e.provider(), e.outcome(), e.message());
        }
    }

    @EventListener
    void onReorderViolation(ReorderViolationEvent e) {
        String key = "reorder-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Results delivered out of order ({}). Providers may be slower than "
                    + "voicebridge.reorder.max-wait-ms allows.", e.reason());
        }
    }

    @EventListener
    void onQueueStateChanged(QueueStateChangedEvent e) {
        if (e.current() == QueueBridge.State.DEGRADED && shouldLog("queue-degraded")) {
            LOG.warn("Queue degraded to in-process dispatch: {}. Check spring.kafka.bootstrap-servers.",
                    e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}

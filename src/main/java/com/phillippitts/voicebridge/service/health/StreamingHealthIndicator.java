package com.phillippitts.voicebridge.service.health;

import com.phillippitts.voicebridge.service.provider.health.ProviderHealthMonitor;
import com.phillippitts.voicebridge.service.provider.health.ProviderHealthMonitor.ProviderState;
import com.phillippitts.voicebridge.service.provider.health.ProviderHealthMonitor.ProviderStatus;
import com.phillippitts.voicebridge.service.queue.QueueBridge;
import com.phillippitts.voicebridge.service.session.SessionManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the streaming pipeline.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every provider routable and the queue (if enabled) connected</li>
 *   <li>DEGRADED: at least one provider routable, but some are disabled or the queue fell back
 *       to in-process dispatch</li>
 *   <li>DOWN: no provider routable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health and reused by {@code GET /api/status}.
 */
@Component
public class StreamingHealthIndicator implements HealthIndicator {

    private final SessionManager sessionManager;
    private final ProviderHealthMonitor healthMonitor;
    private final ObjectProvider<QueueBridge> queueBridge;

    public StreamingHealthIndicator(SessionManager sessionManager,
                                    ProviderHealthMonitor healthMonitor,
                                    ObjectProvider<QueueBridge> queueBridge) {
        this.sessionManager = sessionManager;
        this.healthMonitor = healthMonitor;
        this.queueBridge = queueBridge;
    }

    @Override
    public Health health() {
        Map<String, ProviderStatus> providers = healthMonitor.snapshot();
        long routable = providers.entrySet().stream()
                .filter(e -> e.getValue().ready() && healthMonitor.isProviderEnabled(e.getKey()))
                .count();
        QueueBridge.State queueState = queueState();

        Health.Builder builder = new Health.Builder();
        if (routable == 0) {
            builder.down().withDetail("status", "No providers available");
        } else if (routable < providers.size() || queueState == QueueBridge.State.DEGRADED) {
            builder.status("DEGRADED").withDetail("status", "Partial availability");
        } else {
            builder.up().withDetail("status", "Operational");
        }

        return builder
                .withDetail("activeSessions", sessionManager.activeSessionCount())
                .withDetail("providers", describeProviders(providers))
                .withDetail("queue", queueState.name().toLowerCase(Locale.ROOT))
                .build();
    }

    /**
     * Queue connectivity; DISABLED when no bridge is configured.
     */
    public QueueBridge.State queueState() {
        QueueBridge bridge = queueBridge.getIfAvailable();
        return bridge == null ? QueueBridge.State.DISABLED : bridge.state();
    }

    private Map<String, Object> describeProviders(Map<String, ProviderStatus> providers) {
        Map<String, Object> out = new LinkedHashMap<>();
        providers.forEach((name, status) -> {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("state", describeState(status));
            detail.put("errorRate", Math.round(status.errorRate() * 1000) / 1000.0);
            detail.put("attempts", status.attempts());
            out.put(name, detail);
        });
        return out;
    }

    private String describeState(ProviderStatus status) {
        if (!status.ready()) {
            return "unhealthy";
        }
        return status.state() == ProviderState.HEALTHY ? "ready" : status.state().name().toLowerCase(Locale.ROOT);
    }
}

package com.phillippitts.voicebridge.service.provider.health;

import com.phillippitts.voicebridge.config.properties.ProviderHealthProperties;
import com.phillippitts.voicebridge.service.provider.ProviderRegistry;
import com.phillippitts.voicebridge.service.provider.TranscriptionProvider;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event-driven health tracking for transcription providers.
 *
 * <p>Detection model:
 * <ul>
 *   <li>The dispatcher publishes {@link ProviderFailureEvent} for every failed attempt and calls
 *       {@link #recordSuccess(String)} for every successful one.</li>
 *   <li>Outcomes are kept per provider in a sliding time window; the window yields the recent
 *       error rate reported by the health surface.</li>
 *   <li>A provider reaching the failure budget inside the window is DISABLED for a cooldown and
 *       skipped by the dispatcher. After the cooldown it is tried again; a success makes it
 *       HEALTHY.</li>
 *   <li>A failing provider that reports itself unhealthy (closed or never initialized) is
 *       restarted under a per-provider lock.</li>
 * </ul>
 */
@Component
public class ProviderHealthMonitor {

    private static final Logger LOG = LogManager.getLogger(ProviderHealthMonitor.class);

    public enum ProviderState { HEALTHY, DEGRADED, DISABLED }

    /**
     * Point-in-time view of one provider.
     *
     * @param state     health state
     * @param errorRate failures divided by attempts inside the window, 0.0 when idle
     * @param attempts  attempts inside the window
     * @param ready     provider reports itself initialized
     */
    public record ProviderStatus(ProviderState state, double errorRate, int attempts, boolean ready) {}

    private record Outcome(Instant at, boolean success) {}

    private final ProviderRegistry registry;
    private final ProviderHealthProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ConcurrentMap<String, Deque<Outcome>> outcomes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ProviderState> state = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> disabledUntil = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> restartLocks = new ConcurrentHashMap<>();

    public ProviderHealthMonitor(ProviderRegistry registry,
                                 ProviderHealthProperties props,
                                 ApplicationEventPublisher publisher,
                                 Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (String name : registry.names()) {
            outcomes.put(name, new ArrayDeque<>());
            state.put(name, ProviderState.HEALTHY);
            restartLocks.put(name, new ReentrantLock());
        }
        LOG.info("Provider health monitor initialized for providers={}", registry.names());
    }

    @PostConstruct
    public void initializeProviders() {
        for (String failed : registry.initializeAll()) {
            state.put(failed, ProviderState.DEGRADED);
        }
    }

    /** Visible for tests */
    ProviderState getState(String provider) {
        return state.get(provider);
    }

    /**
     * Checks if the dispatcher may route to the provider. A disabled provider becomes eligible
     * again once its cooldown has elapsed.
     */
    public boolean isProviderEnabled(String provider) {
        if (!props.isEnabled()) {
            return true;
        }
        if (state.get(provider) != ProviderState.DISABLED) {
            return true;
        }
        Instant until = disabledUntil.get(provider);
        return until == null || !clock.instant().isBefore(until);
    }

    /**
     * Records a successful attempt. A provider that was not HEALTHY publishes a recovery event.
     */
    public void recordSuccess(String provider) {
        Deque<Outcome> window = outcomes.get(provider);
        if (window == null) {
            return;
        }
        synchronized (window) {
            window.addLast(new Outcome(clock.instant(), true));
            prune(window);
        }
        if (state.get(provider) != ProviderState.HEALTHY) {
            publisher.publishEvent(new ProviderRecoveredEvent(provider, clock.instant()));
        }
    }

    @EventListener
    public void onFailure(ProviderFailureEvent event) {
        String provider = event.provider();
        Deque<Outcome> window = outcomes.get(provider);
        if (window == null) {
            LOG.warn("ProviderFailureEvent for unknown provider: {}", provider);
            return;
        }

        int failures;
        synchronized (window) {
            window.addLast(new Outcome(clock.instant(), false));
            prune(window);
            failures = (int) window.stream().filter(o -> !o.success()).count();
        }
        LOG.debug("Provider failure: provider={}, outcome={}, msg={}", provider, event.outcome(), event.message());

        if (state.get(provider) == ProviderState.DISABLED && !isProviderEnabled(provider)) {
            return;
        }
        if (props.isEnabled() && failures >= props.getMaxFailuresPerWindow()) {
            disableProvider(provider, failures);
            return;
        }
        state.put(provider, ProviderState.DEGRADED);
        registry.find(provider)
                .filter(p -> !p.isHealthy())
                .ifPresent(this::attemptRestart);
    }

    @EventListener
    public void onRecovered(ProviderRecoveredEvent event) {
        String provider = event.provider();
        if (!state.containsKey(provider)) {
            return;
        }
        ProviderState previous = state.put(provider, ProviderState.HEALTHY);
        disabledUntil.remove(provider);
        if (previous != ProviderState.HEALTHY) {
            LOG.info("Provider recovered: {} (was {})", provider, previous);
        }
    }

    /**
     * Error rate inside the sliding window, 0.0 without attempts.
     */
    public double errorRate(String provider) {
        Deque<Outcome> window = outcomes.get(provider);
        if (window == null) {
            return 0.0;
        }
        synchronized (window) {
            prune(window);
            if (window.isEmpty()) {
                return 0.0;
            }
            long failures = window.stream().filter(o -> !o.success()).count();
            return (double) failures / window.size();
        }
    }

    /**
     * Status of every provider in chain order.
     */
    public Map<String, ProviderStatus> snapshot() {
        Map<String, ProviderStatus> out = new LinkedHashMap<>();
        for (String name : registry.names()) {
            int attempts;
            Deque<Outcome> window = outcomes.get(name);
            synchronized (window) {
                prune(window);
                attempts = window.size();
            }
            boolean ready = registry.find(name).map(TranscriptionProvider::isHealthy).orElse(false);
            out.put(name, new ProviderStatus(state.get(name), errorRate(name), attempts, ready));
        }
        return out;
    }

    @Scheduled(fixedRate = 60_000)
    void logHealthSummary() {
        StringBuilder sb = new StringBuilder("Provider states: ");
        snapshot().forEach((name, st) -> sb.append(name).append('=').append(st.state())
                .append(String.format("(err=%.2f)", st.errorRate())).append(' '));
        LOG.info(sb.toString().trim());
    }

    private void disableProvider(String provider, int failures) {
        Instant until = clock.instant().plus(Duration.ofSeconds(props.getCooldownSeconds()));
        state.put(provider, ProviderState.DISABLED);
        disabledUntil.put(provider, until);
        LOG.error("Provider {} disabled after {} failures within {}s; cooldown until {}",
                provider, failures, props.getWindowSeconds(), until);
    }

    /** Re-initializes a provider; concurrent failures for the same provider skip the restart. */
    private void attemptRestart(TranscriptionProvider provider) {
        String name = provider.getProviderName();
        ReentrantLock lock = restartLocks.get(name);
        if (!lock.tryLock()) {
            LOG.debug("Restart already in progress for {}", name);
            return;
        }
        try {
            LOG.warn("Restarting provider {}", name);
            try {
                provider.close();
            } catch (RuntimeException ex) {
                LOG.debug("Error during provider.close(): {}", ex.toString());
            }
            provider.initialize();
            publisher.publishEvent(new ProviderRecoveredEvent(name, clock.instant()));
            LOG.info("Provider {} restarted successfully", name);
        } catch (RuntimeException ex) {
            LOG.error("Provider {} failed to initialize after restart: {}", name, ex.toString());
        } finally {
            lock.unlock();
        }
    }

    private void prune(Deque<Outcome> window) {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(props.getWindowSeconds()));
        while (!window.isEmpty() && window.peekFirst().at().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}

package com.phillippitts.voicebridge.service.dispatch;

import com.phillippitts.voicebridge.config.properties.DispatchProperties;
import com.phillippitts.voicebridge.domain.AttemptOutcome;
import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.ProviderAttempt;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.ErrorCode;
import com.phillippitts.voicebridge.exception.ProviderTimeoutException;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.provider.ProviderRegistry;
import com.phillippitts.voicebridge.service.provider.ProviderResponse;
import com.phillippitts.voicebridge.service.provider.TranscriptionProvider;
import com.phillippitts.voicebridge.service.provider.health.ProviderFailureEvent;
import com.phillippitts.voicebridge.service.provider.health.ProviderHealthMonitor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default implementation of the provider fallback chain.
 *
 * <p>Key features:
 * <ul>
 *   <li><b>Fallback:</b> providers are tried in configured order; the first success wins</li>
 *   <li><b>Retry:</b> an explicit provider error is retried against the same provider up to
 *       {@code voicebridge.dispatch.attempts-per-provider} attempts. A timeout moves straight to
 *       the next provider unless {@code retry-on-timeout} is set</li>
 *   <li><b>Timeout Protection:</b> every attempt runs on {@code providerExecutor} and is
 *       abandoned (cancelled and marked superseded) when it exceeds the attempt timeout</li>
 *   <li><b>Per-session Bound:</b> at most {@code max-in-flight-per-session} chains run per
 *       session; further segments wait in a bounded queue and are rejected when it is full</li>
 *   <li><b>Idempotency:</b> a segment already in flight is not dispatched twice; callers share
 *       the running chain's future</li>
 * </ul>
 *
 * <p><b>Thread Model:</b> chains run on {@code dispatchExecutor}; provider calls on
 * {@code providerExecutor}. When the provider pool saturates, CallerRunsPolicy runs the call on
 * the chain thread and the attempt timeout can no longer interrupt it.
 *
 * <p><b>Error Handling:</b> every failed attempt publishes a {@link ProviderFailureEvent} and is
 * recorded in the bounded attempt log. When all providers are exhausted the segment completes
 * with a failure marker carrying {@link ErrorCode#ALL_PROVIDERS_EXHAUSTED}.
 */
@Service
public class DefaultProviderDispatcher implements ProviderDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultProviderDispatcher.class);

    private final ProviderRegistry registry;
    private final ProviderHealthMonitor healthMonitor;
    private final DispatchProperties props;
    private final ApplicationEventPublisher publisher;
    private final StreamingMetrics metrics;
    private final Executor dispatchExecutor;
    private final Executor providerExecutor;

    private final AttemptLog attemptLog;
    private final ConcurrentMap<String, SessionGate> gates = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<TranscriptionResult>> inFlight =
            new ConcurrentHashMap<>();

    public DefaultProviderDispatcher(ProviderRegistry registry,
                                     ProviderHealthMonitor healthMonitor,
                                     DispatchProperties props,
                                     ApplicationEventPublisher publisher,
                                     StreamingMetrics metrics,
                                     @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                     @Qualifier("providerExecutor") Executor providerExecutor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.providerExecutor = Objects.requireNonNull(providerExecutor, "providerExecutor");
        this.attemptLog = new AttemptLog(props.getAttemptLogSize());
    }

    @Override
    public TranscriptionResult dispatch(AudioSegment segment) {
        try {
            return dispatchAsync(segment).join();
        } catch (CancellationException | CompletionException e) {
            LOG.warn("Dispatch of {} did not complete: {}", segment.segmentKey(), e.toString());
            return TranscriptionResult.failure(segment, ErrorCode.ALL_PROVIDERS_EXHAUSTED, 0);
        }
    }

    @Override
    public CompletableFuture<TranscriptionResult> dispatchAsync(AudioSegment segment) {
        Objects.requireNonNull(segment, "segment");
        String key = segment.segmentKey();

        CompletableFuture<TranscriptionResult> future = new CompletableFuture<>();
        CompletableFuture<TranscriptionResult> existing = inFlight.putIfAbsent(key, future);
        if (existing != null) {
            LOG.debug("Segment {} already in flight; joining running chain", key);
            return existing;
        }
        future.whenComplete((r, t) -> inFlight.remove(key, future));

        PendingDispatch pending = new PendingDispatch(segment, future);
        SessionGate.Admission[] admission = new SessionGate.Admission[1];
        SessionGate gate = gates.compute(segment.sessionId(), (id, g) -> {
            SessionGate target = g != null ? g
                    : new SessionGate(props.getMaxInFlightPerSession(), props.getMaxQueuedPerSession());
            admission[0] = target.admit(pending);
            return target;
        });

        switch (admission[0]) {
            case START -> startChain(gate, pending);
            case QUEUED -> LOG.debug("Segment {} queued; session at in-flight limit", key);
            case REJECTED -> {
                LOG.warn("Dispatch queue full for session {}; rejecting segment {}",
                        segment.sessionId(), segment.sequence());
                metrics.incrementDispatchRejected();
                future.complete(TranscriptionResult.failure(segment, ErrorCode.CAPACITY_EXCEEDED, 0));
            }
        }
        return future;
    }

    @Override
    public void cancelSession(String sessionId) {
        SessionGate gate = gates.remove(sessionId);
        if (gate == null) {
            return;
        }
        List<PendingDispatch> dropped = gate.cancel();
        dropped.forEach(p -> p.future().cancel(false));
        LOG.debug("Cancelled dispatch for session {} ({} queued segment(s) dropped)", sessionId, dropped.size());
    }

    @Override
    public List<ProviderAttempt> attemptsFor(String segmentKey) {
        return attemptLog.attemptsFor(segmentKey);
    }

    /** Visible for tests */
    int trackedSessions() {
        return gates.size();
    }

    private void startChain(SessionGate gate, PendingDispatch pending) {
        dispatchExecutor.execute(() -> runChain(gate, pending));
    }

    private void runChain(SessionGate gate, PendingDispatch pending) {
        AudioSegment segment = pending.segment();
        try {
            Optional<TranscriptionResult> result = executeChain(gate, segment);
            if (result.isPresent()) {
                pending.future().complete(result.get());
            } else {
                pending.future().cancel(false);
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure dispatching {}", segment.segmentKey(), e);
            pending.future().complete(
                    TranscriptionResult.failure(segment, ErrorCode.ALL_PROVIDERS_EXHAUSTED, 0));
        } finally {
            releasePermit(gate, segment.sessionId());
        }
    }

    private void releasePermit(SessionGate gate, String sessionId) {
        PendingDispatch[] next = new PendingDispatch[1];
        gates.computeIfPresent(sessionId, (id, current) -> {
            if (current != gate) {
                return current;
            }
            next[0] = current.release();
            return current.isIdle() ? null : current;
        });
        if (next[0] != null) {
            startChain(gate, next[0]);
        }
    }

    /**
     * Walks the provider chain for one segment.
     *
     * @return the final result, or empty when the session was cancelled mid-chain
     */
    private Optional<TranscriptionResult> executeChain(SessionGate gate, AudioSegment segment) {
        long t0 = System.nanoTime();
        int attemptNumber = 0;

        for (TranscriptionProvider provider : eligibleProviders()) {
            AttemptResult previous = null;
            for (int i = 0; i < props.getAttemptsPerProvider(); i++) {
                if (gate.isCancelled()) {
                    return Optional.empty();
                }
                if (previous != null && previous.outcome() == AttemptOutcome.TIMEOUT) {
                    if (!props.isRetryOnTimeout()) {
                        break;
                    }
                    if (previous.task().isRunning()) {
                        LOG.debug("Skipping retry of {} for {}; previous attempt still running",
                                provider.getProviderName(), segment.segmentKey());
                        break;
                    }
                }
                attemptNumber++;
                AttemptResult attempt = runAttempt(gate, provider, segment, attemptNumber);
                if (attempt.outcome() == AttemptOutcome.SUCCESS) {
                    ProviderResponse response = attempt.response();
                    return Optional.of(TranscriptionResult.finalResult(segment, response.text(),
                            response.confidence(), provider.getProviderName(), elapsedMs(t0)));
                }
                if (attempt.outcome() == null) {
                    return Optional.empty();
                }
                previous = attempt;
            }
        }

        LOG.warn("All providers exhausted for segment {} after {} attempt(s)",
                segment.segmentKey(), attemptNumber);
        metrics.incrementExhausted();
        return Optional.of(TranscriptionResult.failure(segment, ErrorCode.ALL_PROVIDERS_EXHAUSTED, elapsedMs(t0)));
    }

    /**
     * Providers in chain order, skipping those disabled by the health monitor. When every
     * provider is disabled the full chain is returned so the segment still gets attempts.
     */
    private List<TranscriptionProvider> eligibleProviders() {
        List<TranscriptionProvider> all = registry.ordered();
        List<TranscriptionProvider> enabled = all.stream()
                .filter(p -> healthMonitor.isProviderEnabled(p.getProviderName()))
                .toList();
        if (enabled.isEmpty()) {
            LOG.warn("All providers disabled; trying full chain");
            return all;
        }
        return enabled;
    }

    private AttemptResult runAttempt(SessionGate gate, TranscriptionProvider provider,
                                     AudioSegment segment, int attemptNumber) {
        String providerName = provider.getProviderName();
        String attemptId = segment.segmentKey() + "#" + attemptNumber;
        AttemptTask task = AttemptTask.create(provider, segment, attemptId, () -> {
            LOG.debug("Discarding late result from {} for attempt {}", providerName, attemptId);
            metrics.incrementLateResultDiscarded(providerName);
        });

        long start = System.nanoTime();
        gate.track(task);
        try {
            providerExecutor.execute(task);
            ProviderResponse response = task.get(props.getAttemptTimeoutMs(), TimeUnit.MILLISECONDS);
            record(segment, task, attemptNumber, AttemptOutcome.SUCCESS, start);
            healthMonitor.recordSuccess(providerName);
            return new AttemptResult(AttemptOutcome.SUCCESS, response, task);
        } catch (TimeoutException te) {
            task.supersede();
            record(segment, task, attemptNumber, AttemptOutcome.TIMEOUT, start);
            LOG.warn("Provider {} timed out after {} ms on attempt {}",
                    providerName, props.getAttemptTimeoutMs(), attemptId);
            publishFailure(segment, task, AttemptOutcome.TIMEOUT,
                    new ProviderTimeoutException(providerName, props.getAttemptTimeoutMs()));
            return new AttemptResult(AttemptOutcome.TIMEOUT, null, task);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
            record(segment, task, attemptNumber, AttemptOutcome.ERROR, start);
            LOG.warn("Provider {} failed on attempt {}: {}", providerName, attemptId, cause.getMessage());
            publishFailure(segment, task, AttemptOutcome.ERROR, cause);
            return new AttemptResult(AttemptOutcome.ERROR, null, task);
        } catch (CancellationException ce) {
            LOG.debug("Attempt {} cancelled with its session", attemptId);
            return new AttemptResult(null, null, task);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            task.supersede();
            return new AttemptResult(null, null, task);
        } finally {
            gate.untrack(task);
        }
    }

    private void record(AudioSegment segment, AttemptTask task, int attemptNumber,
                        AttemptOutcome outcome, long startNanos) {
        long nanos = System.nanoTime() - startNanos;
        attemptLog.record(new ProviderAttempt(segment.segmentKey(), task.attemptId(), task.providerName(),
                attemptNumber, outcome, nanos / 1_000_000L, Instant.now()));
        metrics.recordAttempt(task.providerName(), outcome.name().toLowerCase(Locale.ROOT), nanos);
    }

    private void publishFailure(AudioSegment segment, AttemptTask task, AttemptOutcome outcome, Throwable cause) {
        Map<String, String> context = Map.of(
                "segment", segment.segmentKey(),
                "attemptId", task.attemptId());
        publisher.publishEvent(new ProviderFailureEvent(task.providerName(), Instant.now(), outcome,
                String.valueOf(cause.getMessage()), cause, context));
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }

    /** Outcome of one attempt; a null outcome means the session was cancelled. */
    private record AttemptResult(AttemptOutcome outcome, ProviderResponse response, AttemptTask task) {}
}

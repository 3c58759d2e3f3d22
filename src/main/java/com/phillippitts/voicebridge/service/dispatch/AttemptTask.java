package com.phillippitts.voicebridge.service.dispatch;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.service.provider.ProviderResponse;
import com.phillippitts.voicebridge.service.provider.TranscriptionProvider;

import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One call of one provider for one segment.
 *
 * <p>Once the dispatcher gives up on the attempt it is marked superseded and cancelled. A
 * provider that still returns afterwards triggers {@code onLateResult}; its answer never reaches
 * the session.
 */
final class AttemptTask extends FutureTask<ProviderResponse> {

    private final String attemptId;
    private final String providerName;
    private final AtomicBoolean superseded;
    private final AtomicBoolean running;

    private AttemptTask(TranscriptionProvider provider, AudioSegment segment, String attemptId,
                        AtomicBoolean superseded, AtomicBoolean running, Runnable onLateResult) {
        super(() -> {
            running.set(true);
            try {
                ProviderResponse response = provider.transcribe(segment.payload(), segment.formatHint());
                if (superseded.get()) {
                    onLateResult.run();
                }
                return response;
            } finally {
                running.set(false);
            }
        });
        this.attemptId = attemptId;
        this.providerName = provider.getProviderName();
        this.superseded = superseded;
        this.running = running;
    }

    static AttemptTask create(TranscriptionProvider provider, AudioSegment segment, String attemptId,
                              Runnable onLateResult) {
        return new AttemptTask(provider, segment, attemptId, new AtomicBoolean(false),
                new AtomicBoolean(false), onLateResult);
    }

    /**
     * True while the provider call is executing. Unlike {@link #isDone()} this stays true after
     * cancellation until the provider actually returns.
     */
    boolean isRunning() {
        return running.get();
    }

    /** Abandons the attempt; a result produced later is discarded. */
    void supersede() {
        superseded.set(true);
        cancel(true);
    }

    String attemptId() {
        return attemptId;
    }

    String providerName() {
        return providerName;
    }
}

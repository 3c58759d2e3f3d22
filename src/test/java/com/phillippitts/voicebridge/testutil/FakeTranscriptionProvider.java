package com.phillippitts.voicebridge.testutil;

import com.phillippitts.voicebridge.exception.ProviderException;
import com.phillippitts.voicebridge.service.provider.ProviderResponse;
import com.phillippitts.voicebridge.service.provider.TranscriptionProvider;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for TranscriptionProvider with configurable behavior.
 *
 * <p>Allows tests to control:
 * <ul>
 *   <li>Returned text and confidence</li>
 *   <li>Health status (can simulate a closed or uninitialized provider)</li>
 *   <li>Delay simulation (for timeout testing; the sleep responds to interruption)</li>
 *   <li>Failure mode: every call fails, or only the first {@code failuresBeforeSuccess} calls</li>
 * </ul>
 *
 * <p><b>Mutable fields:</b> {@code cannedText}, {@code healthy}, {@code delayMs} and
 * {@code failuresBeforeSuccess} are public to allow dynamic modification in multi-step tests.
 */
public class FakeTranscriptionProvider implements TranscriptionProvider {

    private final String providerName;
    public volatile String cannedText;
    public volatile double cannedConfidence = 0.9;
    public volatile boolean healthy = true;
    public volatile long delayMs;
    public volatile boolean alwaysFail;
    public volatile int failuresBeforeSuccess;

    public final AtomicInteger calls = new AtomicInteger();
    public final AtomicInteger completedCalls = new AtomicInteger();
    public final AtomicInteger initCount = new AtomicInteger();
    public final AtomicInteger closeCount = new AtomicInteger();

    public FakeTranscriptionProvider(String name, String text) {
        this.providerName = name;
        this.cannedText = text;
    }

    /** Provider whose every call fails with a ProviderException. */
    public static FakeTranscriptionProvider failing(String name) {
        FakeTranscriptionProvider p = new FakeTranscriptionProvider(name, "");
        p.alwaysFail = true;
        return p;
    }

    /** Provider whose every call sleeps for the given time before answering. */
    public static FakeTranscriptionProvider slow(String name, String text, long delayMs) {
        FakeTranscriptionProvider p = new FakeTranscriptionProvider(name, text);
        p.delayMs = delayMs;
        return p;
    }

    @Override
    public void initialize() {
        initCount.incrementAndGet();
        healthy = true;
    }

    @Override
    public ProviderResponse transcribe(byte[] audio, String formatHint) {
        int call = calls.incrementAndGet();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException("interrupted", providerName, e);
            }
        }
        if (alwaysFail || call <= failuresBeforeSuccess) {
            throw new ProviderException("simulated failure #" + call, providerName);
        }
        completedCalls.incrementAndGet();
        return new ProviderResponse(cannedText, cannedText.isEmpty() ? 0.0 : cannedConfidence);
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        healthy = false;
    }
}

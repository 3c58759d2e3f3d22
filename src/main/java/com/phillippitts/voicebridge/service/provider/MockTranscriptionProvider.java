package com.phillippitts.voicebridge.service.provider;

import com.phillippitts.voicebridge.service.audio.AudioFormat;
import com.phillippitts.voicebridge.service.audio.AudioSilenceDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Offline provider that needs no model or network.
 *
 * <p>Silent PCM segments produce empty text with zero confidence. Any other segment produces the
 * next phrase of a fixed rotation with confidence 0.9. Used when no API key is configured and
 * as the last link of the default chain.
 */
public class MockTranscriptionProvider extends AbstractTranscriptionProvider {

    private static final Logger LOG = LogManager.getLogger(MockTranscriptionProvider.class);

    static final List<String> PHRASES = List.of(
            "Hello, this is a test transcription.",
            "VoiceBridge application is working properly.",
            "Speech recognition system is now active.",
            "Audio transcription test successful.",
            "Real-time voice to text conversion."
    );

    static final double MOCK_CONFIDENCE = 0.9;

    private final AtomicInteger cursor = new AtomicInteger();

    public MockTranscriptionProvider(String providerName) {
        super(providerName);
    }

    @Override
    protected void doInitialize() {
        LOG.warn("Provider {} uses mock transcription; configure an HTTP provider for real results",
                getProviderName());
    }

    @Override
    protected void doClose() {
        // nothing to release
    }

    @Override
    public ProviderResponse transcribe(byte[] audio, String formatHint) {
        requireAudio(audio);
        ensureInitialized();
        if (AudioFormat.isRawPcm(formatHint) && AudioSilenceDetector.isSilent(audio)) {
            return ProviderResponse.empty();
        }
        String phrase = PHRASES.get(Math.floorMod(cursor.getAndIncrement(), PHRASES.size()));
        return new ProviderResponse(phrase, MOCK_CONFIDENCE);
    }
}

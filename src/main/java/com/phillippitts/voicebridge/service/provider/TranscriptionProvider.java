package com.phillippitts.voicebridge.service.provider;

import com.phillippitts.voicebridge.exception.ProviderException;

/**
 * Capability contract for transcription backends: given raw audio bytes, return text and
 * confidence. This is the only thing the streaming engine requires from a model or API.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Provider is constructed from its chain definition</li>
 *   <li>{@link #initialize()} prepares clients and validates configuration</li>
 *   <li>{@link #transcribe(byte[], String)} is called concurrently for many segments</li>
 *   <li>{@link #close()} releases resources on shutdown</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must support concurrent {@code transcribe} calls and must
 * respond to thread interruption, which the dispatcher uses to abandon timed-out attempts.
 */
public interface TranscriptionProvider extends AutoCloseable {

    /**
     * Prepares the provider. Called once at startup and again when a failed provider is
     * restarted.
     *
     * @throws ProviderException if the provider cannot be made ready
     */
    void initialize();

    /**
     * Transcribes one audio segment.
     *
     * @param audio      raw audio bytes of one segment
     * @param formatHint codec hint of the bytes (e.g. "pcm16", "webm")
     * @return text and confidence
     * @throws ProviderException if the backend fails or answers with an error
     * @throws IllegalArgumentException if audio is null or empty
     */
    ProviderResponse transcribe(byte[] audio, String formatHint);

    /**
     * Returns the configured provider name for logging, metrics and results.
     */
    String getProviderName();

    /**
     * Checks if the provider is initialized and not closed.
     */
    boolean isHealthy();

    @Override
    void close();
}

package com.phillippitts.voicebridge.service.provider;

import com.phillippitts.voicebridge.exception.ProviderException;

/**
 * Base class providing thread-safe lifecycle handling for providers.
 *
 * <p>Template Method: {@link #initialize()} and {@link #close()} are idempotent and delegate to
 * {@link #doInitialize()} and {@link #doClose()} under an internal lock. Subclasses implement
 * {@link #transcribe(byte[], String)} and call {@link #ensureInitialized()} first.
 *
 * <p><b>Lifecycle:</b> uninitialized, initialized, closed. A closed provider may be initialized
 * again; the health monitor relies on this to restart a failing provider.
 */
public abstract class AbstractTranscriptionProvider implements TranscriptionProvider {

    /**
     * Guards {@link #initialized} and {@link #closed}.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    private final String providerName;

    protected AbstractTranscriptionProvider(String providerName) {
        if (providerName == null || providerName.isBlank()) {
            throw new IllegalArgumentException("providerName must not be blank");
        }
        this.providerName = providerName;
    }

    @Override
    public final String getProviderName() {
        return providerName;
    }

    /**
     * Initializes the provider. Idempotent while not closed; re-initializes after close.
     *
     * @throws ProviderException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
            closed = false;
        }
    }

    /**
     * Provider-specific initialization, called under {@link #lock}.
     *
     * @throws ProviderException if initialization fails
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Closes the provider. Idempotent.
     */
    @Override
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Provider-specific cleanup, called under {@link #lock}. Must not throw.
     */
    protected abstract void doClose();

    /**
     * Validates that the provider is ready for transcription.
     *
     * @throws ProviderException if the provider is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new ProviderException("provider not initialized or closed", providerName);
            }
        }
    }

    /**
     * Validates the audio argument of {@link #transcribe(byte[], String)}.
     */
    protected static void requireAudio(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new IllegalArgumentException("audio must not be null or empty");
        }
    }

    /**
     * Wraps an unexpected failure with provider context, preserving {@link ProviderException}s.
     *
     * <pre>{@code
     * try {
     *     return callBackend(audio);
     * } catch (Exception e) {
     *     throw handleTranscriptionError(e);
     * }
     * }</pre>
     *
     * @return never returns normally
     * @throws ProviderException always
     */
    protected final ProviderException handleTranscriptionError(Exception exception) {
        if (exception instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (exception instanceof ProviderException pe) {
            throw pe;
        }
        throw new ProviderException(
                "transcription failed: " + exception.getMessage(),
                providerName,
                exception
        );
    }
}

package com.phillippitts.voicebridge.service.audio;

import com.phillippitts.voicebridge.config.properties.AudioProperties;
import com.phillippitts.voicebridge.domain.AudioSegment;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Accumulates arbitrarily sized network fragments of one session into fixed windows.
 *
 * <p>For raw PCM the window is time-based: {@code windowMs} of audio at 32,000 bytes per second,
 * aligned to the 2-byte frame. Encoded formats carry no fixed byte rate, so they are cut at a
 * configured byte threshold instead.
 *
 * <p>Every emitted segment takes the next value of the owning session's sequence counter, so
 * sequence numbers stay strictly increasing across {@link #feed(byte[])} and {@link #flush()}.
 *
 * <p><b>Thread Safety:</b> methods are synchronized; a session normally feeds from a single
 * connection thread, but close may flush from another thread.
 */
public final class AudioChunkAssembler {

    private final String sessionId;
    private final String formatHint;
    private final int windowBytes;
    private final LongSupplier sequenceSource;
    private final Clock clock;

    private byte[] buffer;
    private int buffered;
    private boolean flushed;

    AudioChunkAssembler(String sessionId, String formatHint, int windowBytes,
                        LongSupplier sequenceSource, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.formatHint = Objects.requireNonNull(formatHint, "formatHint");
        if (windowBytes <= 0) {
            throw new IllegalArgumentException("windowBytes must be positive, got: " + windowBytes);
        }
        this.windowBytes = windowBytes;
        this.sequenceSource = Objects.requireNonNull(sequenceSource, "sequenceSource");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.buffer = new byte[windowBytes * 2];
    }

    /**
     * Creates an assembler whose window matches the session's announced format.
     *
     * @param sessionId      owning session
     * @param formatHint     normalized format hint
     * @param props          window configuration
     * @param sequenceSource the session's sequence counter
     * @param clock          clock for capture timestamps
     */
    public static AudioChunkAssembler create(String sessionId, String formatHint, AudioProperties props,
                                             LongSupplier sequenceSource, Clock clock) {
        int window = AudioFormat.isRawPcm(formatHint)
                ? AudioFormat.windowBytes(props.getWindowMs())
                : props.getEncodedThresholdBytes();
        return new AudioChunkAssembler(sessionId, formatHint, window, sequenceSource, clock);
    }

    /**
     * Buffers the fragment and emits one segment per completed window.
     *
     * @param bytes next fragment in network order (may be empty)
     * @return emitted segments in sequence order, possibly empty
     * @throws IllegalStateException if the assembler was already flushed
     */
    public synchronized List<AudioSegment> feed(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (flushed) {
            throw new IllegalStateException("Assembler for session " + sessionId + " already flushed");
        }
        if (bytes.length == 0) {
            return List.of();
        }
        append(bytes);

        List<AudioSegment> out = new ArrayList<>(buffered / windowBytes);
        int offset = 0;
        while (buffered - offset >= windowBytes) {
            byte[] window = Arrays.copyOfRange(buffer, offset, offset + windowBytes);
            out.add(emit(window, false));
            offset += windowBytes;
        }
        if (offset > 0) {
            System.arraycopy(buffer, offset, buffer, 0, buffered - offset);
            buffered -= offset;
        }
        return out;
    }

    /**
     * Emits the partial remainder as the session's final chunk. Later calls return empty and
     * {@link #feed(byte[])} is rejected afterwards.
     *
     * @return the final segment, or empty if nothing was buffered
     */
    public synchronized Optional<AudioSegment> flush() {
        if (flushed) {
            return Optional.empty();
        }
        flushed = true;
        if (buffered == 0) {
            return Optional.empty();
        }
        int length = buffered;
        if (AudioFormat.isRawPcm(formatHint)) {
            length -= length % AudioFormat.REQUIRED_BLOCK_ALIGN;
        }
        byte[] remainder = Arrays.copyOf(buffer, length);
        buffered = 0;
        if (remainder.length == 0) {
            return Optional.empty();
        }
        return Optional.of(emit(remainder, true));
    }

    /** Bytes currently held back waiting for a window boundary. */
    public synchronized int bufferedBytes() {
        return buffered;
    }

    public int windowBytes() {
        return windowBytes;
    }

    private AudioSegment emit(byte[] payload, boolean finalChunk) {
        return new AudioSegment(sessionId, sequenceSource.getAsLong(), payload,
                clock.instant(), formatHint, finalChunk);
    }

    private void append(byte[] bytes) {
        int required = buffered + bytes.length;
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
        System.arraycopy(bytes, 0, buffer, buffered, bytes.length);
        buffered = required;
    }
}

package com.phillippitts.voicebridge.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable unit of audio cut from a session's inbound stream.
 *
 * <p>The payload array is never exposed directly; {@link #payload()} returns a copy so an emitted
 * segment cannot be mutated after the assembler hands it off.
 *
 * @param sessionId   owning session
 * @param sequence    strictly increasing position within the session, starting at 0
 * @param payload     raw audio bytes
 * @param capturedAt  when the segment was cut
 * @param formatHint  codec hint passed through to providers (e.g. "pcm16", "webm")
 * @param finalChunk  true for the remainder flushed on session close
 */
public record AudioSegment(
        String sessionId,
        long sequence,
        byte[] payload,
        Instant capturedAt,
        String formatHint,
        boolean finalChunk
) {

    public AudioSegment {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        Objects.requireNonNull(formatHint, "formatHint must not be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0, got: " + sequence);
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int size() {
        return payload.length;
    }

    /**
     * Key identifying this segment across attempts and deliveries: {@code sessionId:sequence}.
     */
    public String segmentKey() {
        return sessionId + ':' + sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioSegment other)) {
            return false;
        }
        return sequence == other.sequence
                && finalChunk == other.finalChunk
                && sessionId.equals(other.sessionId)
                && formatHint.equals(other.formatHint)
                && capturedAt.equals(other.capturedAt)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(sessionId, sequence, capturedAt, formatHint, finalChunk);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "AudioSegment[sessionId=" + sessionId + ", sequence=" + sequence
                + ", bytes=" + payload.length + ", formatHint=" + formatHint
                + ", finalChunk=" + finalChunk + ']';
    }
}

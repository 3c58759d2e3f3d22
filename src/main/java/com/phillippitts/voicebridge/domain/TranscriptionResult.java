package com.phillippitts.voicebridge.domain;

import com.phillippitts.voicebridge.exception.ErrorCode;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable transcription outcome for one segment of a session.
 *
 * <p>A result with a non-null {@code error} is a failure marker: its text is empty and it is
 * always final, so the segment still produces exactly one final result.
 *
 * @param sessionId  session the answered segment belongs to
 * @param sequence   sequence number of the answered segment
 * @param text       transcribed text (empty for silence or failure)
 * @param confidence confidence score between 0.0 and 1.0
 * @param isFinal    false for interim results that a later final result supersedes
 * @param provider   name of the provider that produced the result, or "none"
 * @param latencyMs  processing latency in milliseconds
 * @param timestamp  completion time
 * @param error      failure marker, or null on success
 */
public record TranscriptionResult(
        String sessionId,
        long sequence,
        String text,
        double confidence,
        boolean isFinal,
        String provider,
        long latencyMs,
        Instant timestamp,
        ErrorCode error
) {

    /** Provider name carried by failure markers. */
    public static final String NO_PROVIDER = "none";

    public TranscriptionResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(text, "Transcription text must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        if (error != null && !isFinal) {
            throw new IllegalArgumentException("Failure results must be final");
        }
        if (latencyMs < 0) {
            latencyMs = 0;
        }
    }

    /**
     * Creates a final, successful result.
     */
    public static TranscriptionResult finalResult(AudioSegment segment, String text, double confidence,
                                                  String provider, long latencyMs) {
        return new TranscriptionResult(segment.sessionId(), segment.sequence(), text, confidence,
                true, provider, latencyMs, Instant.now(), null);
    }

    /**
     * Creates the failure marker emitted for a segment that no provider could transcribe.
     */
    public static TranscriptionResult failure(AudioSegment segment, ErrorCode error, long latencyMs) {
        Objects.requireNonNull(error, "error must not be null");
        return new TranscriptionResult(segment.sessionId(), segment.sequence(), "", 0.0,
                true, NO_PROVIDER, latencyMs, Instant.now(), error);
    }

    public boolean isFailure() {
        return error != null;
    }
}

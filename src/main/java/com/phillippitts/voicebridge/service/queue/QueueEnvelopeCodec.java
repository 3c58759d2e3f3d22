package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.ErrorCode;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Locale;

/**
 * JSON envelopes for the segment and result topics.
 *
 * <p>Segment envelope:
 * <pre>{@code
 * {"session_id":"...","sequence":3,"attempt_id":"...","format":"pcm16",
 *  "final":false,"captured_at":"2024-01-01T00:00:00Z","payload":"<base64>"}
 * }</pre>
 * Result envelope carries the {@link TranscriptionResult} fields plus an optional
 * {@code error} code in wire form.
 */
public final class QueueEnvelopeCodec {

    private QueueEnvelopeCodec() {}

    /**
     * A decoded segment together with the publish attempt that carried it.
     */
    public record SegmentEnvelope(AudioSegment segment, String attemptId) {}

    public static String encodeSegment(AudioSegment segment, String attemptId) {
        JSONObject json = new JSONObject();
        json.put("session_id", segment.sessionId());
        json.put("sequence", segment.sequence());
        json.put("attempt_id", attemptId);
        json.put("format", segment.formatHint());
        json.put("final", segment.finalChunk());
        json.put("captured_at", segment.capturedAt().toString());
        json.put("payload", Base64.getEncoder().encodeToString(segment.payload()));
        return json.toString();
    }

    /**
     * @throws IllegalArgumentException if the envelope is malformed
     */
    public static SegmentEnvelope decodeSegment(String raw) {
        try {
            JSONObject json = new JSONObject(raw);
            AudioSegment segment = new AudioSegment(
                    json.getString("session_id"),
                    json.getLong("sequence"),
                    Base64.getDecoder().decode(json.getString("payload")),
                    Instant.parse(json.getString("captured_at")),
                    json.getString("format"),
                    json.optBoolean("final", false));
            return new SegmentEnvelope(segment, json.getString("attempt_id"));
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed segment envelope: " + e.getMessage(), e);
        }
    }

    public static String encodeResult(TranscriptionResult result) {
        JSONObject json = new JSONObject();
        json.put("session_id", result.sessionId());
        json.put("sequence", result.sequence());
        json.put("text", result.text());
        json.put("confidence", result.confidence());
        json.put("is_final", result.isFinal());
        json.put("provider", result.provider());
        json.put("latency_ms", result.latencyMs());
        json.put("timestamp", result.timestamp().toString());
        if (result.error() != null) {
            json.put("error", result.error().wireName());
        }
        return json.toString();
    }

    /**
     * @throws IllegalArgumentException if the envelope is malformed or names an unknown error
     */
    public static TranscriptionResult decodeResult(String raw) {
        try {
            JSONObject json = new JSONObject(raw);
            String error = json.optString("error", null);
            return new TranscriptionResult(
                    json.getString("session_id"),
                    json.getLong("sequence"),
                    json.getString("text"),
                    json.getDouble("confidence"),
                    json.getBoolean("is_final"),
                    json.getString("provider"),
                    json.optLong("latency_ms", 0),
                    Instant.parse(json.getString("timestamp")),
                    error == null ? null : ErrorCode.valueOf(error.toUpperCase(Locale.ROOT)));
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed result envelope: " + e.getMessage(), e);
        }
    }
}

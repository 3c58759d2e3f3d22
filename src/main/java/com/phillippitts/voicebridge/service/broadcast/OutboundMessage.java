package com.phillippitts.voicebridge.service.broadcast;

import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.exception.ErrorCode;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON message sent to a streaming client.
 *
 * <p>Wire types: {@code transcription}, {@code error}, {@code connection_established},
 * {@code pong} and {@code status}. Field names use snake_case except {@code isFinal}, which
 * clients already read in camel case.
 */
public final class OutboundMessage {

    public static final String TYPE_TRANSCRIPTION = "transcription";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_CONNECTION_ESTABLISHED = "connection_established";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_STATUS = "status";

    private final String type;
    private final Map<String, Object> fields;

    private OutboundMessage(String type, Map<String, Object> fields) {
        this.type = Objects.requireNonNull(type, "type");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static OutboundMessage transcription(TranscriptionResult result) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("session_id", result.sessionId());
        f.put("sequence", result.sequence());
        f.put("text", result.text());
        f.put("confidence", result.confidence());
        f.put("isFinal", result.isFinal());
        f.put("provider", result.provider());
        f.put("processing_time", result.latencyMs() / 1000.0);
        f.put("timestamp", result.timestamp().toString());
        return new OutboundMessage(TYPE_TRANSCRIPTION, f);
    }

    /**
     * Error message for a segment that produced no transcription.
     */
    public static OutboundMessage failure(TranscriptionResult result) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("code", result.error().wireName());
        f.put("message", "Transcription failed for segment " + result.sequence());
        f.put("session_id", result.sessionId());
        f.put("sequence", result.sequence());
        f.put("isFinal", true);
        f.put("timestamp", result.timestamp().toString());
        return new OutboundMessage(TYPE_ERROR, f);
    }

    public static OutboundMessage error(ErrorCode code, String message, Instant at) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("code", code.wireName());
        f.put("message", message);
        f.put("timestamp", at.toString());
        return new OutboundMessage(TYPE_ERROR, f);
    }

    public static OutboundMessage connectionEstablished(String sessionId, Instant at) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("session_id", sessionId);
        f.put("timestamp", at.toString());
        return new OutboundMessage(TYPE_CONNECTION_ESTABLISHED, f);
    }

    public static OutboundMessage pong(Instant at) {
        return new OutboundMessage(TYPE_PONG, Map.of("timestamp", at.toString()));
    }

    public static OutboundMessage status(Map<String, ?> status) {
        return new OutboundMessage(TYPE_STATUS, new LinkedHashMap<>(status));
    }

    public String type() {
        return type;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String toJson() {
        JSONObject json = new JSONObject();
        json.put("type", type);
        fields.forEach(json::put);
        return json.toString();
    }

    @Override
    public String toString() {
        return "OutboundMessage{type=" + type + ", fields=" + fields.keySet() + '}';
    }
}

package com.phillippitts.voicebridge.service.session;

import com.phillippitts.voicebridge.domain.SessionState;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of a session for status messages and the REST surface.
 */
public record SessionSnapshot(
        String sessionId,
        SessionState state,
        String formatHint,
        Instant createdAt,
        Instant lastActivity,
        long audioChunksReceived,
        long transcriptionsSent,
        long nextSequence,
        int pendingSegments
) {

    /**
     * Wire representation used by the {@code status} message, snake_case keys.
     */
    public Map<String, Object> toStatusFields() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("session_id", sessionId);
        m.put("state", state.name());
        m.put("format", formatHint);
        m.put("created_at", createdAt.toString());
        m.put("last_activity", lastActivity.toString());
        m.put("audio_chunks_received", audioChunksReceived);
        m.put("transcriptions_sent", transcriptionsSent);
        m.put("next_sequence", nextSequence);
        m.put("pending_segments", pendingSegments);
        return m;
    }
}

package com.phillippitts.voicebridge.exception;

/**
 * Thrown when an operation names a session that does not exist or is no longer active.
 */
public class UnknownSessionException extends VoiceBridgeException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super(ErrorCode.UNKNOWN_SESSION, "Unknown or inactive session: " + sessionId);
        this.sessionId = sessionId;
    }

    public UnknownSessionException(String sessionId, String reason) {
        super(ErrorCode.UNKNOWN_SESSION, "Session " + sessionId + " " + reason);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}

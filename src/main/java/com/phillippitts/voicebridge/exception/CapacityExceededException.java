package com.phillippitts.voicebridge.exception;

/**
 * Thrown when a new session is refused: the process-wide or per-client session cap is reached,
 * or the client's rate limit bucket is empty.
 */
public class CapacityExceededException extends VoiceBridgeException {

    /** Which limit refused admission. */
    public enum Limit { GLOBAL_SESSIONS, CLIENT_SESSIONS, RATE }

    private final String clientKey;
    private final Limit limit;
    private final String reason;

    public CapacityExceededException(String clientKey, Limit limit, String message) {
        super(ErrorCode.CAPACITY_EXCEEDED, message + " (client: " + clientKey + ", limit: " + limit + ")");
        this.clientKey = clientKey;
        this.limit = limit;
        this.reason = message;
    }

    public String getClientKey() {
        return clientKey;
    }

    public Limit getLimit() {
        return limit;
    }

    /** Message without the client key; safe to send back over the connection. */
    public String getReason() {
        return reason;
    }
}

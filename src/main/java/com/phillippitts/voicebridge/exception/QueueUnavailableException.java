package com.phillippitts.voicebridge.exception;

/**
 * Signals that the message broker could not accept a publish. Callers degrade to in-process
 * dispatch; this is never surfaced to clients.
 */
public class QueueUnavailableException extends VoiceBridgeException {

    private final String topic;

    public QueueUnavailableException(String topic, Throwable cause) {
        super(ErrorCode.QUEUE_UNAVAILABLE, "Broker unavailable for topic " + topic
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}

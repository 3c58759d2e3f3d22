package com.phillippitts.voicebridge.exception;

/**
 * Thrown when client audio is rejected before it reaches a provider: an unsupported format, an
 * empty or oversized upload, or an undecodable text frame.
 *
 * <p>The message never contains client identity and may be returned to the client as is.
 */
public class InvalidAudioException extends VoiceBridgeException {

    public InvalidAudioException(String message) {
        super(ErrorCode.INVALID_AUDIO, message);
    }
}

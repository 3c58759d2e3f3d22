package com.phillippitts.voicebridge.exception;

import java.util.Objects;

/**
 * Base exception for all VoiceBridge application-specific errors.
 * All domain exceptions extend this class and carry an {@link ErrorCode} so the connection and
 * REST boundaries can map them without inspecting the concrete type.
 */
public class VoiceBridgeException extends RuntimeException {

    private final ErrorCode errorCode;

    public VoiceBridgeException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public VoiceBridgeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}

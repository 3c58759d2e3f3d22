package com.phillippitts.voicebridge.exception;

/**
 * Thrown when a transcription provider fails to transcribe a segment.
 * This may occur due to transport errors, non-success responses or unparseable output.
 */
public class ProviderException extends VoiceBridgeException {

    private final String providerName;

    public ProviderException(String message) {
        super(ErrorCode.PROVIDER_ERROR, message);
        this.providerName = "unknown";
    }

    public ProviderException(String message, String providerName) {
        super(ErrorCode.PROVIDER_ERROR, message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public ProviderException(String message, String providerName, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    protected ProviderException(ErrorCode code, String message, String providerName, Throwable cause) {
        super(code, message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}

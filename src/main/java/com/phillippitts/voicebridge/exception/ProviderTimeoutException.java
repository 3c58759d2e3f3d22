package com.phillippitts.voicebridge.exception;

/**
 * Thrown when a provider attempt does not complete within its timeout.
 */
public class ProviderTimeoutException extends ProviderException {

    private final long timeoutMs;

    public ProviderTimeoutException(String providerName, long timeoutMs) {
        super(ErrorCode.PROVIDER_TIMEOUT, "Timed out after " + timeoutMs + "ms", providerName, null);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}

package com.phillippitts.voicebridge.service.provider;

import java.util.Objects;

/**
 * What a provider returns for one call: text plus a confidence score.
 *
 * @param text       transcribed text, empty for silence
 * @param confidence score between 0.0 and 1.0
 */
public record ProviderResponse(String text, double confidence) {

    public ProviderResponse {
        Objects.requireNonNull(text, "text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    /** Empty text with zero confidence. */
    public static ProviderResponse empty() {
        return new ProviderResponse("", 0.0);
    }
}

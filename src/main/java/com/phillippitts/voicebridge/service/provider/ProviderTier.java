package com.phillippitts.voicebridge.service.provider;

/**
 * Position of a provider in the configured chain.
 */
public enum ProviderTier {
    PRIMARY,
    SECONDARY,
    FALLBACK;

    /** Tier for the zero-based position in the chain. */
    public static ProviderTier forPosition(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        return switch (index) {
            case 0 -> PRIMARY;
            case 1 -> SECONDARY;
            default -> FALLBACK;
        };
    }
}

package com.phillippitts.voicebridge.service.provider.health;

import java.time.Instant;

/**
 * Published when a degraded or disabled provider answers successfully again, or was restarted.
 */
public record ProviderRecoveredEvent(
        String provider,
        Instant at
) {
    public ProviderRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}

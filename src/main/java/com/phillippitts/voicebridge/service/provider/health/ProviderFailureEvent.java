package com.phillippitts.voicebridge.service.provider.health;

import com.phillippitts.voicebridge.domain.AttemptOutcome;

import java.time.Instant;
import java.util.Map;

/**
 * Published for every failed provider attempt (timeout or error).
 *
 * <p>PII note: never include transcript text or audio in context. Restrict to technical
 * diagnostics such as segment key and attempt id.
 */
public record ProviderFailureEvent(
        String provider,
        Instant at,
        AttemptOutcome outcome,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ProviderFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        if (context == null) {
            context = Map.of();
        }
    }
}

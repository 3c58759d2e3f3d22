package com.phillippitts.voicebridge.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Bookkeeping record for one call of one provider for one segment. Never persisted.
 *
 * @param segmentKey    {@code sessionId:sequence} of the segment
 * @param attemptId     unique tag of this attempt
 * @param provider      provider that was called
 * @param attemptNumber 1-based attempt number across the whole fallback chain
 * @param outcome       success, timeout or error
 * @param latencyMs     time until the outcome was decided
 * @param at            when the outcome was recorded
 */
public record ProviderAttempt(
        String segmentKey,
        String attemptId,
        String provider,
        int attemptNumber,
        AttemptOutcome outcome,
        long latencyMs,
        Instant at
) {

    public ProviderAttempt {
        Objects.requireNonNull(segmentKey, "segmentKey must not be null");
        Objects.requireNonNull(attemptId, "attemptId must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (at == null) {
            at = Instant.now();
        }
    }

    public boolean failed() {
        return outcome != AttemptOutcome.SUCCESS;
    }
}

package com.phillippitts.voicebridge.service.broadcast;

import java.time.Instant;
import java.util.List;

/**
 * Published when buffered results are released out of order because the reorder bound was hit.
 *
 * @param sessionId        affected session
 * @param expectedSequence sequence that was still missing
 * @param releasedThrough  highest sequence released by the flush
 * @param skipped          missing sequences; if they arrive later they are still emitted
 * @param reason           what forced the flush
 * @param at               when the flush happened
 */
public record ReorderViolationEvent(
        String sessionId,
        long expectedSequence,
        long releasedThrough,
        List<Long> skipped,
        Reason reason,
        Instant at
) {
    public enum Reason { OVERFLOW, TIMEOUT }

    public ReorderViolationEvent {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
        if (at == null) at = Instant.now();
    }
}

package com.phillippitts.voicebridge.service.queue;

import java.time.Instant;

/**
 * Published when the queue bridge degrades to in-process dispatch or reconnects.
 */
public record QueueStateChangedEvent(
        QueueBridge.State previous,
        QueueBridge.State current,
        String reason,
        Instant at
) {}

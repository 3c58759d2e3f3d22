package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.domain.AudioSegment;
import com.phillippitts.voicebridge.domain.TranscriptionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Optional hand-off of segments and results through a message broker, so dispatch can run on
 * other instances.
 *
 * <p>Delivery is at-least-once; consumers deduplicate by session id, sequence and attempt id.
 */
public interface QueueBridge {

    enum State { DISABLED, CONNECTED, DEGRADED }

    /**
     * Publishes a segment for remote dispatch.
     *
     * @return future completing when the broker acknowledged the segment; completes
     *         exceptionally with {@link com.phillippitts.voicebridge.exception.QueueUnavailableException}
     *         if it could not be sent, in which case the caller dispatches in-process
     */
    CompletableFuture<Void> publish(AudioSegment segment);

    /**
     * Publishes a result produced by a dispatch worker. Failures are logged, not thrown.
     */
    void publishResult(TranscriptionResult result);

    /**
     * Whether segments should be offered to the broker right now. A degraded bridge reports
     * false until its retry interval elapses, then lets one probe through.
     */
    boolean isAvailable();

    State state();
}

package com.phillippitts.voicebridge.service.broadcast;

import java.io.IOException;

/**
 * Connection-side end of a session's outbound channel.
 *
 * <p>Implementations are written to by exactly one outbox drain at a time.
 */
public interface OutboundSink {

    /**
     * Writes one message to the client.
     *
     * @throws IOException if the connection is broken
     */
    void send(OutboundMessage message) throws IOException;

    boolean isOpen();

    /** Closes the connection. Idempotent. */
    void close();
}
